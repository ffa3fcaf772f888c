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
 * Control states of the {@link BacktrackingMatcher} state machine.
 *
 * @since 1.0.0
 */
public enum ControlState {
    /** Decide whether the match is finished or the next atom should be tried. */
    COMPUTE_NEXT_ATOM,
    /** Test the current atom against the current input character. */
    TRY_MATCH_ATOM,
    /** Terminal: the whole input matched the whole pattern. */
    SUCCESS,
    /** Resume from the most recent backtrack entry, if any. */
    ATTEMPT_BACKTRACK,
    /** Terminal: no alternatives remain. */
    FAILURE;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE;
    }
}
