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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ConcurrentMatchingTest {

    private static final int THREADS = 8;

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    public void testConcurrentStreamsShareOneAutomaton() throws Exception {
        final AhoCorasickAutomaton<Character> automaton =
                AhoCorasickAutomaton.forStrings("abc", "a", "bc", "ca", "bca");
        final List<Character> input = Symbols.of("abcabcaba_abbabcc");
        final List<String> expected = AhoCorasickAutomatonTest.describe(automaton.matches(input));
        final CountDownLatch start = new CountDownLatch(1);

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<List<String>>> futures = new ArrayList<Future<List<String>>>();
            for (int i = 0; i < THREADS; i++) {
                futures.add(executor.submit(new Callable<List<String>>() {
                    @Override
                    public List<String> call() throws Exception {
                        start.await();
                        List<String> last = null;
                        for (int j = 0; j < 1000; j++) {
                            last = AhoCorasickAutomatonTest.describe(automaton.matches(input));
                            if (!last.equals(expected)) {
                                break;
                            }
                        }
                        return last;
                    }
                }));
            }
            start.countDown();
            for (Future<List<String>> future : futures) {
                assertEquals(expected, future.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    public void testInterleavedStreamsAreIndependent() {
        AhoCorasickAutomaton<Character> automaton = AhoCorasickAutomaton.forStrings("ab", "ba");
        Iterator<Match<Character>> first = automaton.matches(Symbols.of("abab")).iterator();
        Iterator<Match<Character>> second = automaton.matches(Symbols.of("baba")).iterator();

        assertEquals(0, first.next().patternId());
        assertEquals(1, second.next().patternId());
        assertEquals(1, first.next().patternId());
        assertEquals(0, second.next().patternId());
    }
}
