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
package io.needle.microbench.automaton;

import io.needle.automaton.AhoCorasickAutomaton;
import io.needle.automaton.AhoCorasickSearchProcessor;
import io.needle.automaton.LinkResolution;
import io.needle.automaton.Match;
import io.needle.automaton.Symbols;
import io.needle.util.HashingStrategies;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;

@Threads(1)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(2)
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 8, time = 1)
@State(Scope.Benchmark)
public class AhoCorasickAutomatonBenchmark {

    @Param({ "16", "256" })
    int patternCount;

    @Param({ "8", "32" })
    int patternLength;

    @Param({ "4", "26" })
    int alphabetSize;

    @Param({ "BREADTH_FIRST", "SUFFIX_PROBE" })
    LinkResolution linkResolution;

    @Param({ "0" })
    int seed;

    private List<List<Character>> patterns;
    private List<Character> haystack;
    private AhoCorasickAutomaton<Character> automaton;

    @Setup(Level.Trial)
    public void init() {
        final SplittableRandom random = new SplittableRandom(seed);
        String[] strings = new String[patternCount];
        for (int i = 0; i < patternCount; i++) {
            strings[i] = randomString(random, 1 + random.nextInt(patternLength));
        }
        patterns = Symbols.patterns(strings);
        haystack = Symbols.of(randomString(random, 4096));
        automaton = AhoCorasickAutomaton.newAutomaton(patterns, HashingStrategies.<Character>javaHasher(),
                linkResolution);
    }

    private String randomString(SplittableRandom random, int length) {
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = (char) ('a' + random.nextInt(alphabetSize));
        }
        return new String(chars);
    }

    @Benchmark
    public AhoCorasickAutomaton<Character> build() {
        return AhoCorasickAutomaton.newAutomaton(patterns, HashingStrategies.<Character>javaHasher(), linkResolution);
    }

    @Benchmark
    public void iterateMatches(Blackhole bh) {
        for (Match<Character> match : automaton.matches(haystack)) {
            bh.consume(match);
        }
    }

    @Benchmark
    public int pushSymbols() {
        AhoCorasickSearchProcessor<Character> processor = automaton.newSearchProcessor();
        int found = 0;
        for (int i = 0; i < haystack.size(); i++) {
            if (!processor.process(haystack.get(i))) {
                found++;
            }
        }
        return found;
    }

    @Benchmark
    public boolean contains() {
        return automaton.contains(haystack);
    }
}
