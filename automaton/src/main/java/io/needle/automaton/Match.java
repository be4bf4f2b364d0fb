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

import java.util.List;

/**
 * One occurrence of a pattern in an input sequence.
 * <p>
 * Indexes are 0-based: the occurrence covers the input symbols {@code [start(), end())}, so
 * {@link #end()} is also the 1-based position of the last matched symbol. Indexes are {@code long}
 * so that unbounded streams never wrap around.
 */
public final class Match<T> {

    private final List<T> pattern;
    private final int patternId;
    private final long start;
    private final long end;

    Match(List<T> pattern, int patternId, long start, long end) {
        this.pattern = pattern;
        this.patternId = patternId;
        this.start = start;
        this.end = end;
    }

    /**
     * Returns the matched pattern, as retained by the automaton.
     */
    public List<T> pattern() {
        return pattern;
    }

    /**
     * Returns the index of the matched pattern in {@link AhoCorasickAutomaton#patterns()}.
     */
    public int patternId() {
        return patternId;
    }

    /**
     * Returns the index of the first matched symbol.
     */
    public long start() {
        return start;
    }

    /**
     * Returns the index right after the last matched symbol.
     */
    public long end() {
        return end;
    }

    public int length() {
        return (int) (end - start);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Match)) {
            return false;
        }
        Match<?> that = (Match<?>) o;
        return patternId == that.patternId && start == that.start && end == that.end &&
               pattern.equals(that.pattern);
    }

    @Override
    public int hashCode() {
        int result = pattern.hashCode();
        result = 31 * result + patternId;
        result = 31 * result + Long.hashCode(start);
        result = 31 * result + Long.hashCode(end);
        return result;
    }

    @Override
    public String toString() {
        return "Match(pattern: " + Symbols.toString(pattern) + ", id: " + patternId +
               ", range: [" + start + ", " + end + "))";
    }
}
