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
import io.needle.util.collection.ObjectIntHashMap;

import java.util.Arrays;
import java.util.List;

import static io.needle.automaton.Trie.NO_NODE;
import static io.needle.automaton.Trie.NO_PATTERN;
import static io.needle.automaton.Trie.ROOT;

/**
 * Builds the prefix tree of a pattern set into a {@link Trie} arena.
 */
final class TrieBuilder<T> {

    private static final int MIN_CAPACITY = 16;

    private final HashingStrategy<? super T> hashingStrategy;
    private final int initialEdgeCapacity;

    private ObjectIntHashMap<T>[] edges;
    private int[] patternIds;
    private int[] depths;
    private int size;

    @SuppressWarnings("unchecked")
    TrieBuilder(HashingStrategy<? super T> hashingStrategy, int initialEdgeCapacity, int expectedNodes) {
        this.hashingStrategy = hashingStrategy;
        this.initialEdgeCapacity = initialEdgeCapacity;

        int capacity = Math.max(MIN_CAPACITY, expectedNodes);
        edges = (ObjectIntHashMap<T>[]) new ObjectIntHashMap<?>[capacity];
        patternIds = new int[capacity];
        depths = new int[capacity];

        newNode(0);
    }

    /**
     * Adds {@code pattern}, reusing every existing prefix, and marks the node it ends at with
     * {@code patternId}. A pattern that was added before is re-marked with the new id.
     */
    void add(List<T> pattern, int patternId) {
        int node = ROOT;
        for (T symbol : pattern) {
            int child = child(node, symbol);
            if (child == NO_NODE) {
                child = newNode(depths[node] + 1);
                edgesOf(node).put(symbol, child);
            }
            node = child;
        }
        patternIds[node] = patternId;
    }

    int size() {
        return size;
    }

    Trie<T> build() {
        return new Trie<T>(hashingStrategy, size,
                Arrays.copyOf(edges, size), Arrays.copyOf(patternIds, size), Arrays.copyOf(depths, size));
    }

    private int child(int node, T symbol) {
        ObjectIntHashMap<T> nodeEdges = edges[node];
        return nodeEdges == null ? NO_NODE : nodeEdges.get(symbol);
    }

    private ObjectIntHashMap<T> edgesOf(int node) {
        ObjectIntHashMap<T> nodeEdges = edges[node];
        if (nodeEdges == null) {
            nodeEdges = new ObjectIntHashMap<T>(hashingStrategy, initialEdgeCapacity);
            edges[node] = nodeEdges;
        }
        return nodeEdges;
    }

    private int newNode(int depth) {
        if (size == patternIds.length) {
            int newCapacity = patternIds.length << 1;
            edges = Arrays.copyOf(edges, newCapacity);
            patternIds = Arrays.copyOf(patternIds, newCapacity);
            depths = Arrays.copyOf(depths, newCapacity);
        }
        int node = size++;
        patternIds[node] = NO_PATTERN;
        depths[node] = depth;
        return node;
    }
}
