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

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.RandomAccess;

import static io.needle.util.internal.ObjectUtil.checkNotNullArrayParam;
import static io.needle.util.internal.ObjectUtil.checkNotNullWithIAE;
import static io.needle.util.internal.ObjectUtil.checkPositiveOrZero;

/**
 * Static helpers for feeding character data and {@link SymbolProcessor}s.
 */
public final class Symbols {

    private Symbols() {
    }

    /**
     * Returns an unmodifiable {@link List} view of the characters of {@code text}. Nothing is copied;
     * the view reflects later changes of a mutable {@link CharSequence}.
     */
    public static List<Character> of(CharSequence text) {
        return new CharSequenceList(checkNotNullWithIAE(text, "text"));
    }

    /**
     * Returns one character pattern per string, in the given order.
     */
    public static List<List<Character>> patterns(String... patterns) {
        checkNotNullWithIAE(patterns, "patterns");
        List<List<Character>> result = new ArrayList<List<Character>>(patterns.length);
        for (int i = 0; i < patterns.length; i++) {
            result.add(of(checkNotNullArrayParam(patterns[i], i, "patterns")));
        }
        return result;
    }

    /**
     * Feeds every symbol of {@code input} to {@code processor} until it returns {@code false}.
     *
     * @return the index of the symbol for which the processor returned {@code false}, or {@code -1}
     *         if the input was exhausted.
     */
    public static <T> int forEach(Iterable<? extends T> input, SymbolProcessor<? super T> processor) {
        return forEach(input, 0, processor);
    }

    /**
     * Like {@link #forEach(Iterable, SymbolProcessor)}, but skips the first {@code fromIndex} symbols
     * without showing them to the processor. Returned indexes still count from the start of
     * {@code input}.
     */
    public static <T> int forEach(Iterable<? extends T> input, int fromIndex, SymbolProcessor<? super T> processor) {
        checkNotNullWithIAE(input, "input");
        checkPositiveOrZero(fromIndex, "fromIndex");
        checkNotNullWithIAE(processor, "processor");

        int index = 0;
        if (input instanceof List && input instanceof RandomAccess) {
            List<? extends T> list = (List<? extends T>) input;
            for (index = fromIndex; index < list.size(); index++) {
                if (!processor.process(list.get(index))) {
                    return index;
                }
            }
            return -1;
        }

        Iterator<? extends T> it = input.iterator();
        for (; index < fromIndex && it.hasNext(); index++) {
            it.next();
        }
        for (; it.hasNext(); index++) {
            if (!processor.process(it.next())) {
                return index;
            }
        }
        return -1;
    }

    /**
     * Renders a symbol sequence: character sequences are concatenated, anything else is printed
     * as a list.
     */
    static String toString(List<?> symbols) {
        StringBuilder buf = new StringBuilder(symbols.size());
        for (Object symbol : symbols) {
            if (!(symbol instanceof Character)) {
                return symbols.toString();
            }
            buf.append((char) (Character) symbol);
        }
        return buf.toString();
    }

    private static final class CharSequenceList extends AbstractList<Character> implements RandomAccess {

        private final CharSequence text;

        CharSequenceList(CharSequence text) {
            this.text = text;
        }

        @Override
        public Character get(int index) {
            return text.charAt(index);
        }

        @Override
        public int size() {
            return text.length();
        }
    }
}
