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
 * Observer invoked once per {@link BacktrackingMatcher} state transition.
 *
 * <p>Listeners must not influence the match; they only observe. {@link #NO_OP} is the default and
 * is detected by the matcher so that no snapshots are built when tracing is off.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface MatchTraceListener {

    MatchTraceListener NO_OP = snapshot -> { };

    void onTransition(CursorSnapshot snapshot);
}
