/*
 * Copyright 2026 The Needle Project
 *
 * The Needle Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.needle.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.needle.automaton.Trie.NO_NODE;
import static io.needle.automaton.Trie.NO_PATTERN;
import static io.needle.automaton.Trie.ROOT;

/**
 * Push-style search over an {@link AhoCorasickAutomaton}: symbols are handed in one at a time and
 * {@link #process(Object)} returns {@code false} whenever at least one pattern ends at the symbol just
 * processed. Use {@link AhoCorasickAutomaton#newSearchProcessor()} to get an instance.
 * <p>
 * Usage example, looking for "AB", "BC" and "CD" in "ABCD":
 * <pre>
 *      AhoCorasickAutomaton&lt;Character&gt; automaton = AhoCorasickAutomaton.forStrings("AB", "BC", "CD");
 *      AhoCorasickSearchProcessor&lt;Character&gt; processor = automaton.newSearchProcessor();
 *      List&lt;Character&gt; haystack = Symbols.of("ABCD");
 *
 *      int idx1 = Symbols.forEach(haystack, processor);
 *      // idx1 is 1 (index of the last character of "AB")
 *      // processor.getFoundPatternId() is 0 (index of "AB" in the patterns)
 *
 *      int idx2 = Symbols.forEach(haystack, idx1 + 1, processor);
 *      // idx2 is 2, processor.getFoundPatternId() is 1
 * </pre>
 * Instances keep mutable state and must not be shared between threads. The automaton itself can
 * serve any number of processors concurrently.
 */
public final class AhoCorasickSearchProcessor<T> implements MultiSearchProcessor<T> {

    private final AhoCorasickAutomaton<T> automaton;
    private final Trie<T> trie;

    private int current = ROOT;
    private long position;
    private int found = NO_NODE;

    AhoCorasickSearchProcessor(AhoCorasickAutomaton<T> automaton, Trie<T> trie) {
        this.automaton = automaton;
        this.trie = trie;
    }

    @Override
    public boolean process(T value) {
        position++;
        int next = trie.transition(current, value);
        if (next == NO_NODE) {
            current = ROOT;
            found = NO_NODE;
            return true;
        }
        current = next;
        found = trie.firstReportingNode(next);
        return found == NO_NODE;
    }

    @Override
    public int getFoundPatternId() {
        return found == NO_NODE ? NO_PATTERN : trie.patternIds[found];
    }

    /**
     * Returns every match ending at the last processed symbol, longest pattern first.
     */
    public List<Match<T>> foundMatches() {
        if (found == NO_NODE) {
            return Collections.emptyList();
        }
        List<Match<T>> matches = new ArrayList<Match<T>>(2);
        for (int node = found; node != NO_NODE; node = trie.outputLinks[node]) {
            matches.add(automaton.newMatch(node, position));
        }
        return matches;
    }

    /**
     * Returns the number of symbols processed since creation or the last {@link #reset()}.
     */
    public long position() {
        return position;
    }

    @Override
    public void reset() {
        current = ROOT;
        position = 0;
        found = NO_NODE;
    }
}
