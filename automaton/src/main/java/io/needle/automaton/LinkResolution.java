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

import io.needle.util.HashingStrategies;
import io.needle.util.collection.ObjectIntHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static io.needle.automaton.Trie.NO_NODE;
import static io.needle.automaton.Trie.ROOT;

/**
 * Strategies for computing the failure links of an {@link AhoCorasickAutomaton}.
 * <p>
 * The failure link of a node spelling the path {@code P} points to the node spelling the longest
 * proper suffix of {@code P} that is itself a path in the trie; the root has none. Both strategies
 * produce identical links and differ only in construction cost.
 */
public enum LinkResolution {

    /**
     * Classical Aho-Corasick construction. Nodes are visited breadth-first; the link of the child
     * reached from {@code v} by symbol {@code x} is the {@code x}-child of the first node on
     * {@code v}'s failure chain that has one, or the root. Runs in time proportional to the number
     * of nodes times the failure chain length.
     */
    BREADTH_FIRST {
        @Override
        <T> void resolveFailureLinks(final Trie<T> trie) {
            final int[] failureLinks = trie.failureLinks;
            for (int i = 0; i < trie.size; i++) {
                final int node = trie.breadthFirstOrder[i];
                final ObjectIntHashMap<T> edges = trie.edges[node];
                if (edges == null) {
                    continue;
                }
                edges.forEach((symbol, child) -> {
                    int link = ROOT;
                    for (int f = failureLinks[node]; f != NO_NODE; f = failureLinks[f]) {
                        int candidate = trie.child(f, symbol);
                        if (candidate != NO_NODE) {
                            link = candidate;
                            break;
                        }
                    }
                    failureLinks[child] = link;
                });
            }
        }
    },

    /**
     * Explicit path lookup. One breadth-first pass records the full path of every node in a
     * path-to-node index; each node then probes the index with its proper suffixes, longest first,
     * until one is found. Construction costs grow with the square of the pattern length.
     */
    SUFFIX_PROBE {
        @Override
        <T> void resolveFailureLinks(final Trie<T> trie) {
            @SuppressWarnings("unchecked")
            final List<T>[] paths = (List<T>[]) new List<?>[trie.size];
            final ObjectIntHashMap<List<T>> nodesByPath = new ObjectIntHashMap<List<T>>(
                    HashingStrategies.<T>sequence(trie.hashingStrategy), trie.size);

            paths[ROOT] = Collections.emptyList();
            nodesByPath.put(paths[ROOT], ROOT);
            for (int i = 0; i < trie.size; i++) {
                final List<T> parentPath = paths[trie.breadthFirstOrder[i]];
                final ObjectIntHashMap<T> edges = trie.edges[trie.breadthFirstOrder[i]];
                if (edges == null) {
                    continue;
                }
                edges.forEach((symbol, child) -> {
                    List<T> path = new ArrayList<T>(parentPath.size() + 1);
                    path.addAll(parentPath);
                    path.add(symbol);
                    paths[child] = path;
                    nodesByPath.put(path, child);
                });
            }

            for (int node = 1; node < trie.size; node++) {
                final List<T> path = paths[node];
                int link = ROOT;
                for (int from = 1; from < path.size(); from++) {
                    int candidate = nodesByPath.get(path.subList(from, path.size()));
                    if (candidate != NO_NODE) {
                        link = candidate;
                        break;
                    }
                }
                trie.failureLinks[node] = link;
            }
        }
    };

    /**
     * Fills {@link Trie#failureLinks} for every node of {@code trie}. The root keeps
     * {@link Trie#NO_NODE}.
     */
    abstract <T> void resolveFailureLinks(Trie<T> trie);

    /**
     * Parses a configuration value such as {@code breadthFirst}, {@code breadth-first} or
     * {@code SUFFIX_PROBE}.
     *
     * @return the matching strategy, or {@code null} if {@code value} names none.
     */
    static LinkResolution parse(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
        for (LinkResolution resolution : values()) {
            if (resolution.name().replace("_", "").toLowerCase(Locale.ROOT).equals(normalized)) {
                return resolution;
            }
        }
        return null;
    }
}
