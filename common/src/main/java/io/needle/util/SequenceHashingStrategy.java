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

import java.util.List;

import static io.needle.util.internal.ObjectUtil.checkNotNull;

/**
 * A {@link HashingStrategy} over ordered symbol sequences. Two sequences are equal when they have
 * the same length and their elements are pairwise equal under the element strategy.
 */
public final class SequenceHashingStrategy<T> implements HashingStrategy<List<? extends T>> {

    private final HashingStrategy<? super T> elementStrategy;

    public SequenceHashingStrategy(HashingStrategy<? super T> elementStrategy) {
        this.elementStrategy = checkNotNull(elementStrategy, "elementStrategy");
    }

    /**
     * Returns the strategy used to compare single elements.
     */
    public HashingStrategy<? super T> elementStrategy() {
        return elementStrategy;
    }

    @Override
    public int hashCode(List<? extends T> sequence) {
        if (sequence == null) {
            return 0;
        }
        int hash = 1;
        for (int i = 0; i < sequence.size(); i++) {
            hash = 31 * hash + elementStrategy.hashCode(sequence.get(i));
        }
        return hash;
    }

    @Override
    public boolean equals(List<? extends T> a, List<? extends T> b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        final int size = a.size();
        if (size != b.size()) {
            return false;
        }
        for (int i = 0; i < size; i++) {
            if (!elementStrategy.equals(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "SequenceHashingStrategy(" + elementStrategy + ')';
    }
}
