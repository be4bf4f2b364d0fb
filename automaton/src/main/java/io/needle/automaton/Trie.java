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

/**
 * Node arena of an {@link AhoCorasickAutomaton}. Nodes are addressed by {@code int} index, the root
 * is {@link #ROOT} and {@link #NO_NODE} marks an absent link. Every per-node attribute lives in a
 * parallel array indexed by node.
 * <p>
 * The edge, pattern and depth tables are filled by {@link TrieBuilder}. Failure links are filled by a
 * {@link LinkResolution}, output links by {@link #resolveOutputLinks()}. Nothing is written after
 * the owning automaton has been constructed.
 */
final class Trie<T> {

    static final int ROOT = 0;
    static final int NO_NODE = -1;
    static final int NO_PATTERN = -1;

    final HashingStrategy<? super T> hashingStrategy;
    final int size;

    /** Outgoing edges per node, {@code null} for leaves. */
    final ObjectIntHashMap<T>[] edges;
    /** Id of the pattern ending at each node, or {@link #NO_PATTERN}. */
    final int[] patternIds;
    final int[] depths;
    final int[] failureLinks;
    final int[] outputLinks;
    /** All nodes, root first, in breadth-first order. */
    final int[] breadthFirstOrder;

    Trie(HashingStrategy<? super T> hashingStrategy, int size, ObjectIntHashMap<T>[] edges,
         int[] patternIds, int[] depths) {
        this.hashingStrategy = hashingStrategy;
        this.size = size;
        this.edges = edges;
        this.patternIds = patternIds;
        this.depths = depths;

        failureLinks = new int[size];
        outputLinks = new int[size];
        Arrays.fill(failureLinks, NO_NODE);
        Arrays.fill(outputLinks, NO_NODE);

        breadthFirstOrder = new int[size];
        int tail = 0;
        breadthFirstOrder[tail++] = ROOT;
        for (int head = 0; head < tail; head++) {
            ObjectIntHashMap<T> nodeEdges = edges[breadthFirstOrder[head]];
            if (nodeEdges != null) {
                for (int child : nodeEdges.values()) {
                    breadthFirstOrder[tail++] = child;
                }
            }
        }
        assert tail == size;
    }

    /**
     * Returns the child of {@code node} reached by {@code symbol}, or {@link #NO_NODE}.
     */
    int child(int node, T symbol) {
        ObjectIntHashMap<T> nodeEdges = edges[node];
        return nodeEdges == null ? NO_NODE : nodeEdges.get(symbol);
    }

    /**
     * Returns the node reached from {@code node} by {@code symbol}: the direct child if there is one,
     * otherwise the child of the first node on the failure chain that has an edge for
     * {@code symbol}. Returns {@link #NO_NODE} when no node on the chain, the root included, has
     * such an edge.
     */
    int transition(int node, T symbol) {
        for (int current = node; current != NO_NODE; current = failureLinks[current]) {
            int next = child(current, symbol);
            if (next != NO_NODE) {
                return next;
            }
        }
        return NO_NODE;
    }

    boolean isTerminal(int node) {
        return patternIds[node] != NO_PATTERN;
    }

    /**
     * Returns the first node reporting a pattern when {@code node} is reached: the node itself if it
     * is terminal, otherwise its output link.
     */
    int firstReportingNode(int node) {
        return isTerminal(node) ? node : outputLinks[node];
    }

    /**
     * Sets the output link of every node to the nearest terminal node on its failure chain.
     * Requires the failure links to be resolved.
     */
    void resolveOutputLinks() {
        // A failure target is always shallower, so its output link is already known.
        for (int i = 1; i < size; i++) {
            int node = breadthFirstOrder[i];
            int failure = failureLinks[node];
            outputLinks[node] = isTerminal(failure) ? failure : outputLinks[failure];
        }
    }
}
