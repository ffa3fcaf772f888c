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

package com.axonops.wildmatch.api;

import com.axonops.wildmatch.engine.BacktrackingMatcher;
import com.axonops.wildmatch.engine.FullMatcher;
import com.axonops.wildmatch.engine.MemoizedMatcher;

/**
 * The two interchangeable full-match engines. Both return identical results for every well-formed
 * pattern.
 *
 * @since 1.0.0
 */
public enum MatchEngine {
    /** Compiled atoms run through an explicit backtracking state machine. */
    BACKTRACKING(new BacktrackingMatcher()),
    /** Memoized table over raw pattern indices; the reference oracle. */
    MEMOIZED(new MemoizedMatcher());

    private final FullMatcher matcher;

    MatchEngine(FullMatcher matcher) {
        this.matcher = matcher;
    }

    /** Stateless, shareable matcher for this engine (no tracing). */
    public FullMatcher matcher() {
        return matcher;
    }

    /** The engine used to cross-check this one. */
    public MatchEngine oracle() {
        return this == BACKTRACKING ? MEMOIZED : BACKTRACKING;
    }
}
