/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.wildmatch.engine;

/**
 * Result of a {@link BacktrackingMatcher} run with the work it took.
 *
 * @param matched whether the input fully matched
 * @param transitions state transitions executed
 * @param backtracks entries popped from the backtrack stack
 * @param peakBacktrackDepth largest backtrack stack size reached (bounded by the input length)
 * @since 1.0.0
 */
public record MatchOutcome(boolean matched, long transitions, long backtracks, int peakBacktrackDepth) {
}
