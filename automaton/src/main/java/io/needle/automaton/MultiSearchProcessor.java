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
 * Interface for {@link SearchProcessor} that searches for multiple patterns at once.
 */
public interface MultiSearchProcessor<T> extends SearchProcessor<T> {

    /**
     * @return the id of the pattern found at the current position, or {@code -1} if no pattern ends
     *         there. When several patterns end at the same position the id of the longest one is
     *         returned.
     */
    int getFoundPatternId();
}
