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
package io.needle.util;

/**
 * Factory methods for commonly used {@link HashingStrategy}s.
 */
public final class HashingStrategies {

    private static final HashingStrategy<Object> IDENTITY = new HashingStrategy<Object>() {
        @Override
        public int hashCode(Object obj) {
            return System.identityHashCode(obj);
        }

        @Override
        public boolean equals(Object a, Object b) {
            return a == b;
        }

        @Override
        public String toString() {
            return "IDENTITY";
        }
    };

    private static final HashingStrategy<Character> CASE_INSENSITIVE_CHARACTERS = new HashingStrategy<Character>() {
        @Override
        public int hashCode(Character c) {
            return c == null ? 0 : fold(c);
        }

        @Override
        public boolean equals(Character a, Character b) {
            if (a == b) {
                return true;
            }
            if (a == null || b == null) {
                return false;
            }
            return fold(a) == fold(b);
        }

        @Override
        public String toString() {
            return "CASE_INSENSITIVE_CHARACTERS";
        }
    };

    private HashingStrategies() {
    }

    /**
     * Returns {@link HashingStrategy#JAVA_HASHER}.
     */
    @SuppressWarnings("unchecked")
    public static <T> HashingStrategy<T> javaHasher() {
        return HashingStrategy.JAVA_HASHER;
    }

    /**
     * Returns a strategy that compares by reference and hashes with {@link System#identityHashCode(Object)}.
     */
    @SuppressWarnings("unchecked")
    public static <T> HashingStrategy<T> identity() {
        return (HashingStrategy<T>) IDENTITY;
    }

    /**
     * Returns a strategy that treats upper and lower case forms of a character as equal.
     */
    public static HashingStrategy<Character> caseInsensitiveCharacters() {
        return CASE_INSENSITIVE_CHARACTERS;
    }

    /**
     * Returns a strategy comparing lists element by element with {@code elementStrategy}.
     */
    public static <T> SequenceHashingStrategy<T> sequence(HashingStrategy<? super T> elementStrategy) {
        return new SequenceHashingStrategy<T>(elementStrategy);
    }

    private static char fold(char c) {
        // Some characters only round-trip through upper case (e.g. the Georgian alphabet).
        return Character.toLowerCase(Character.toUpperCase(c));
    }
}
