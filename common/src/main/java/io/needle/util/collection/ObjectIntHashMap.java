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
package io.needle.util.collection;

import io.needle.util.HashingStrategy;

import java.util.function.ObjIntConsumer;

import static io.needle.util.internal.ObjectUtil.checkNotNull;
import static io.needle.util.internal.ObjectUtil.checkPositive;

/**
 * A hash map from object keys to non-negative {@code int} values, using open addressing with linear
 * probing. Keys are hashed and compared through a {@link HashingStrategy} rather than
 * {@link Object#hashCode()} and {@link Object#equals(Object)}.
 * <p>
 * {@code null} keys are not supported and entries cannot be removed. Absent keys map to
 * {@link #NO_ENTRY}.
 */
public final class ObjectIntHashMap<K> {

    /** Returned by {@link #get(Object)} and {@link #put(Object, int)} when there is no mapping. */
    public static final int NO_ENTRY = -1;

    private static final float LOAD_FACTOR = 0.5f;

    private final HashingStrategy<? super K> hashingStrategy;

    /** The maximum number of elements allowed without allocating more space. */
    private int maxSize;

    private K[] keys;
    private int[] values;
    private int size;

    public ObjectIntHashMap(HashingStrategy<? super K> hashingStrategy, int initialCapacity) {
        this.hashingStrategy = checkNotNull(hashingStrategy, "hashingStrategy");
        checkPositive(initialCapacity, "initialCapacity");
        allocate(adjustCapacity(initialCapacity));
    }

    /**
     * Returns the value mapped to {@code key}, or {@link #NO_ENTRY}. A {@code null} key never has a
     * mapping.
     */
    public int get(K key) {
        if (key == null) {
            return NO_ENTRY;
        }
        int index = indexOf(key);
        return index == -1 ? NO_ENTRY : values[index];
    }

    /**
     * Maps {@code key} to {@code value}.
     *
     * @return the previous value or {@link #NO_ENTRY}.
     */
    public int put(K key, int value) {
        checkNotNull(key, "key");
        int index = hashIndex(key);
        for (;;) {
            if (keys[index] == null) {
                keys[index] = key;
                values[index] = value;
                if (++size > maxSize) {
                    rehash(adjustCapacity((int) Math.min(keys.length * 2.0, Integer.MAX_VALUE - 8)));
                }
                return NO_ENTRY;
            }
            if (hashingStrategy.equals(keys[index], key)) {
                int previous = values[index];
                values[index] = value;
                return previous;
            }
            // The load factor keeps at least one slot empty, so probing terminates.
            index = probeNext(index);
        }
    }

    public int size() {
        return size;
    }

    /**
     * Performs {@code action} for every entry, in slot order. The order is stable for a given
     * sequence of insertions but otherwise unspecified.
     */
    public void forEach(ObjIntConsumer<? super K> action) {
        checkNotNull(action, "action");
        for (int i = 0; i < keys.length; ++i) {
            if (keys[i] != null) {
                action.accept(keys[i], values[i]);
            }
        }
    }

    /**
     * Returns the values of all entries, in the same order as {@link #forEach(ObjIntConsumer)}.
     */
    public int[] values() {
        int[] out = new int[size];
        int n = 0;
        for (int i = 0; i < keys.length; ++i) {
            if (keys[i] != null) {
                out[n++] = values[i];
            }
        }
        return out;
    }

    private int indexOf(K key) {
        int index = hashIndex(key);
        for (;;) {
            if (keys[index] == null) {
                return -1;
            }
            if (hashingStrategy.equals(key, keys[index])) {
                return index;
            }
            index = probeNext(index);
        }
    }

    private int probeNext(int index) {
        return index == keys.length - 1 ? 0 : index + 1;
    }

    private int hashIndex(K key) {
        int hash = hashingStrategy.hashCode(key);
        hash ^= hash >>> 16;
        return (hash % keys.length + keys.length) % keys.length;
    }

    private static int adjustCapacity(int capacity) {
        return capacity | 1;
    }

    @SuppressWarnings("unchecked")
    private void allocate(int capacity) {
        keys = (K[]) new Object[capacity];
        values = new int[capacity];
        maxSize = Math.min(capacity - 1, (int) (capacity * LOAD_FACTOR));
    }

    private void rehash(int newCapacity) {
        K[] oldKeys = keys;
        int[] oldValues = values;
        allocate(newCapacity);
        for (int i = 0; i < oldKeys.length; ++i) {
            K key = oldKeys[i];
            if (key != null) {
                int index = hashIndex(key);
                while (keys[index] != null) {
                    index = probeNext(index);
                }
                keys[index] = key;
                values[index] = oldValues[i];
            }
        }
    }
}
