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

import java.util.Iterator;
import java.util.NoSuchElementException;

import static io.needle.automaton.Trie.NO_NODE;
import static io.needle.automaton.Trie.ROOT;

/**
 * A single streaming pass of an {@link AhoCorasickAutomaton} over one input. Input symbols are pulled
 * only when every match ending at the previous symbol has been returned.
 */
final class MatchIterator<T> implements Iterator<Match<T>> {

    private final AhoCorasickAutomaton<T> automaton;
    private final Trie<T> trie;
    private final Iterator<? extends T> input;

    private int current = ROOT;
    private long position;
    /** Next node on the output chain whose pattern has not been returned yet. */
    private int pending = NO_NODE;

    /**
     * Creates an iterator that counts {@code input} as starting after {@code skipped} symbols.
     */
    MatchIterator(AhoCorasickAutomaton<T> automaton, Trie<T> trie, Iterator<? extends T> input, long skipped) {
        this.automaton = automaton;
        this.trie = trie;
        this.input = input;
        position = skipped;
    }

    @Override
    public boolean hasNext() {
        while (pending == NO_NODE) {
            if (!input.hasNext()) {
                return false;
            }
            advance(input.next());
        }
        return true;
    }

    @Override
    public Match<T> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        int node = pending;
        pending = trie.outputLinks[node];
        return automaton.newMatch(node, position);
    }

    private void advance(T symbol) {
        position++;
        int next = trie.transition(current, symbol);
        if (next == NO_NODE) {
            current = ROOT;
            return;
        }
        current = next;
        pending = trie.firstReportingNode(next);
    }
}
