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

import io.needle.util.HashingStrategy;
import io.needle.util.internal.SystemPropertyUtil;
import io.needle.util.internal.logging.InternalLogger;
import io.needle.util.internal.logging.InternalLoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static io.needle.util.internal.ObjectUtil.checkNotNullArrayParam;
import static io.needle.util.internal.ObjectUtil.checkNotNullWithIAE;

/**
 * Aho-Corasick automaton that finds every occurrence of a fixed set of patterns in a single pass
 * over an input sequence, overlapping and nested occurrences included.
 * <p>
 * Patterns and inputs are sequences of symbols of an arbitrary type {@code T}; symbols are compared
 * with a {@link HashingStrategy}, {@link HashingStrategy#JAVA_HASHER} by default. For text,
 * {@link #forStrings(String...)} and {@link Symbols#of(CharSequence)} avoid manual boxing:
 * <pre>
 *     AhoCorasickAutomaton&lt;Character&gt; automaton = AhoCorasickAutomaton.forStrings("he", "she", "hers");
 *     for (Match&lt;Character&gt; match : automaton.matches(Symbols.of("ushers"))) {
 *         // she [1, 4), he [2, 4), hers [2, 6)
 *     }
 * </pre>
 * Matches are reported by increasing end index; matches sharing an end index are reported longest
 * pattern first.
 * <p>
 * Instances are immutable and can be shared freely between threads. Every call to
 * {@link #matches(Iterable)} and friends starts an independent stream at the root.
 * <p>
 * The following system properties are read once, when this class is initialized:
 * <ul>
 *     <li>{@code io.needle.automaton.linkResolution}: {@code breadthFirst} (default) or
 *     {@code suffixProbe}, the {@link LinkResolution} used when none is given.</li>
 *     <li>{@code io.needle.automaton.initialEdgeCapacity}: initial capacity of the per-node edge
 *     tables, {@code 4} by default.</li>
 * </ul>
 */
public final class AhoCorasickAutomaton<T> {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(AhoCorasickAutomaton.class);

    private static final String PROP_LINK_RESOLUTION = "io.needle.automaton.linkResolution";
    private static final String PROP_INITIAL_EDGE_CAPACITY = "io.needle.automaton.initialEdgeCapacity";

    private static final LinkResolution DEFAULT_LINK_RESOLUTION;
    private static final int DEFAULT_INITIAL_EDGE_CAPACITY = 4;
    private static final int INITIAL_EDGE_CAPACITY;

    static {
        String resolution = SystemPropertyUtil.get(PROP_LINK_RESOLUTION, "breadthFirst");
        LinkResolution parsed = LinkResolution.parse(resolution);
        if (parsed == null) {
            logger.warn("Unknown value for -D{}: {} (using: breadthFirst)", PROP_LINK_RESOLUTION, resolution);
            parsed = LinkResolution.BREADTH_FIRST;
        }
        DEFAULT_LINK_RESOLUTION = parsed;

        int edgeCapacity = SystemPropertyUtil.getInt(PROP_INITIAL_EDGE_CAPACITY, DEFAULT_INITIAL_EDGE_CAPACITY);
        if (edgeCapacity <= 0) {
            logger.warn("-D{} must be positive: {} (using: {})",
                    PROP_INITIAL_EDGE_CAPACITY, edgeCapacity, DEFAULT_INITIAL_EDGE_CAPACITY);
            edgeCapacity = DEFAULT_INITIAL_EDGE_CAPACITY;
        }
        INITIAL_EDGE_CAPACITY = edgeCapacity;

        if (logger.isDebugEnabled()) {
            logger.debug("-D{}: {}", PROP_LINK_RESOLUTION, DEFAULT_LINK_RESOLUTION);
            logger.debug("-D{}: {}", PROP_INITIAL_EDGE_CAPACITY, INITIAL_EDGE_CAPACITY);
        }
    }

    private final List<List<T>> patterns;
    private final HashingStrategy<? super T> hashingStrategy;
    private final LinkResolution linkResolution;
    private final Trie<T> trie;

    /**
     * Returns the {@link LinkResolution} used by the factory methods that take none.
     */
    public static LinkResolution defaultLinkResolution() {
        return DEFAULT_LINK_RESOLUTION;
    }

    /**
     * Creates an automaton comparing symbols with {@link HashingStrategy#JAVA_HASHER}.
     *
     * @see #newAutomaton(Iterable, HashingStrategy, LinkResolution)
     */
    @SuppressWarnings("unchecked")
    public static <T> AhoCorasickAutomaton<T> newAutomaton(Iterable<? extends Iterable<? extends T>> patterns) {
        return newAutomaton(patterns, (HashingStrategy<? super T>) HashingStrategy.JAVA_HASHER);
    }

    /**
     * Creates an automaton using the default {@link LinkResolution}.
     *
     * @see #newAutomaton(Iterable, HashingStrategy, LinkResolution)
     */
    public static <T> AhoCorasickAutomaton<T> newAutomaton(Iterable<? extends Iterable<? extends T>> patterns,
                                                           HashingStrategy<? super T> hashingStrategy) {
        return newAutomaton(patterns, hashingStrategy, DEFAULT_LINK_RESOLUTION);
    }

    /**
     * Creates an automaton for {@code patterns}.
     * <p>
     * {@code null} and empty patterns are ignored; the others are copied and keep their relative
     * order, which defines their pattern ids.
     *
     * @param patterns the patterns to search for.
     * @param hashingStrategy compares symbols of patterns and inputs.
     * @param linkResolution how failure links are computed.
     * @throws IllegalArgumentException if an argument is {@code null}, a pattern contains a
     *         {@code null} symbol, or a symbol is an array and {@code hashingStrategy} is
     *         {@link HashingStrategy#JAVA_HASHER}.
     */
    public static <T> AhoCorasickAutomaton<T> newAutomaton(Iterable<? extends Iterable<? extends T>> patterns,
                                                           HashingStrategy<? super T> hashingStrategy,
                                                           LinkResolution linkResolution) {
        return new AhoCorasickAutomaton<T>(
                checkNotNullWithIAE(patterns, "patterns"),
                checkNotNullWithIAE(hashingStrategy, "hashingStrategy"),
                checkNotNullWithIAE(linkResolution, "linkResolution"));
    }

    /**
     * Creates an automaton over the characters of {@code patterns}.
     */
    public static AhoCorasickAutomaton<Character> forStrings(String... patterns) {
        return newAutomaton(Symbols.patterns(patterns));
    }

    /**
     * Creates an automaton over the characters of {@code patterns}, comparing characters with
     * {@code hashingStrategy}, for example {@link io.needle.util.HashingStrategies#caseInsensitiveCharacters()}.
     */
    public static AhoCorasickAutomaton<Character> forStrings(HashingStrategy<? super Character> hashingStrategy,
                                                             String... patterns) {
        return newAutomaton(Symbols.patterns(patterns), hashingStrategy);
    }

    private AhoCorasickAutomaton(Iterable<? extends Iterable<? extends T>> patterns,
                                 HashingStrategy<? super T> hashingStrategy, LinkResolution linkResolution) {
        long start = System.nanoTime();
        this.hashingStrategy = hashingStrategy;
        this.linkResolution = linkResolution;
        this.patterns = retain(patterns, hashingStrategy);

        int expectedNodes = 1;
        for (List<T> pattern : this.patterns) {
            expectedNodes += pattern.size();
        }
        TrieBuilder<T> builder = new TrieBuilder<T>(hashingStrategy, INITIAL_EDGE_CAPACITY, expectedNodes);
        for (int i = 0; i < this.patterns.size(); i++) {
            builder.add(this.patterns.get(i), i);
        }
        trie = builder.build();
        linkResolution.resolveFailureLinks(trie);
        trie.resolveOutputLinks();

        if (logger.isDebugEnabled()) {
            logger.debug("Built automaton with {} pattern(s) and {} node(s) using {} in {} ms",
                    this.patterns.size(), trie.size, linkResolution,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        }
    }

    private static <T> List<List<T>> retain(Iterable<? extends Iterable<? extends T>> patterns,
                                            HashingStrategy<? super T> hashingStrategy) {
        List<List<T>> retained = new ArrayList<List<T>>();
        int index = 0;
        for (Iterable<? extends T> pattern : patterns) {
            if (pattern != null) {
                List<T> copy = new ArrayList<T>();
                for (T symbol : pattern) {
                    checkNotNullArrayParam(symbol, copy.size(), "patterns[" + index + ']');
                    if (hashingStrategy == HashingStrategy.JAVA_HASHER && symbol.getClass().isArray()) {
                        throw new IllegalArgumentException("Symbol " + copy.size() + " of pattern " + index +
                                " is an array (" + symbol.getClass().getSimpleName() +
                                "); a HashingStrategy must be given for array symbols");
                    }
                    copy.add(symbol);
                }
                if (!copy.isEmpty()) {
                    retained.add(Collections.unmodifiableList(copy));
                }
            }
            index++;
        }
        return Collections.unmodifiableList(retained);
    }

    /**
     * Returns the retained patterns; a pattern id is an index into this list.
     */
    public List<List<T>> patterns() {
        return patterns;
    }

    public HashingStrategy<? super T> hashingStrategy() {
        return hashingStrategy;
    }

    public LinkResolution linkResolution() {
        return linkResolution;
    }

    /**
     * Returns the number of trie nodes, the root included.
     */
    public int nodeCount() {
        return trie.size;
    }

    /**
     * Returns the matches of all patterns in {@code input}, computed lazily. Each call to
     * {@link Iterable#iterator()} on the result starts a new pass over {@code input}.
     */
    public Iterable<Match<T>> matches(final Iterable<? extends T> input) {
        checkNotNullWithIAE(input, "input");
        return new Iterable<Match<T>>() {
            @Override
            public Iterator<Match<T>> iterator() {
                return matches(input.iterator());
            }
        };
    }

    /**
     * Returns the matches of all patterns in the symbols remaining in {@code input}. Symbols are
     * consumed only as far as needed to produce the requested matches. Match indexes are
     * {@code long}, so sources longer than {@link Integer#MAX_VALUE} symbols are reported correctly.
     */
    public Iterator<Match<T>> matches(Iterator<? extends T> input) {
        return matches(input, 0);
    }

    /**
     * Like {@link #matches(Iterator)}, with match indexes counted as if {@code skipped} symbols had
     * preceded {@code input}.
     */
    Iterator<Match<T>> matches(Iterator<? extends T> input, long skipped) {
        return new MatchIterator<T>(this, trie, checkNotNullWithIAE(input, "input"), skipped);
    }

    /**
     * Returns the matches of all patterns in {@code input} as a sequential, ordered {@link Stream}.
     */
    public Stream<Match<T>> matchStream(Iterable<? extends T> input) {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(
                matches(checkNotNullWithIAE(input, "input").iterator()),
                Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * Returns {@code true} if at least one pattern occurs in {@code input}. Stops reading at the end
     * of the first occurrence.
     */
    public boolean contains(Iterable<? extends T> input) {
        return matches(checkNotNullWithIAE(input, "input").iterator()).hasNext();
    }

    /**
     * Returns a new push-style processor positioned at the root.
     */
    public AhoCorasickSearchProcessor<T> newSearchProcessor() {
        return new AhoCorasickSearchProcessor<T>(this, trie);
    }

    Match<T> newMatch(int node, long end) {
        int patternId = trie.patternIds[node];
        return new Match<T>(patterns.get(patternId), patternId, end - trie.depths[node], end);
    }

    @Override
    public String toString() {
        return "AhoCorasickAutomaton(patterns: " + patterns.size() + ", nodes: " + trie.size +
               ", linkResolution: " + linkResolution + ", hashingStrategy: " + hashingStrategy + ')';
    }
}
