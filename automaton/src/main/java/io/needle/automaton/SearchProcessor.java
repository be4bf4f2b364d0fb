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

/**
 * Interface for {@link SymbolProcessor} that implements a search over a symbol sequence.
 * {@link #process(Object)} returns {@code false} right after a match has been found.
 */
public interface SearchProcessor<T> extends SymbolProcessor<T> {

    /**
     * Resets the state of the {@link SearchProcessor} to the initial state, as if no symbol had been
     * processed.
     */
    void reset();
}
