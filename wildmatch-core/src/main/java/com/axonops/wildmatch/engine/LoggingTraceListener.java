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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trace listener writing each transition to the {@value #LOGGER_NAME} logger at DEBUG.
 *
 * <p>Enable by setting that logger to DEBUG in the application's logging backend.
 *
 * @since 1.0.0
 */
public final class LoggingTraceListener implements MatchTraceListener {

    public static final String LOGGER_NAME = "com.axonops.wildmatch.trace";

    /** Shared instance; the listener is stateless. */
    public static final LoggingTraceListener INSTANCE = new LoggingTraceListener();

    private static final Logger logger = LoggerFactory.getLogger(LOGGER_NAME);

    private LoggingTraceListener() {
    }

    @Override
    public void onTransition(CursorSnapshot snapshot) {
        if (logger.isDebugEnabled()) {
            logger.debug("state = {}; s_idx = {}; atom_idx = {}; backtracks = {}",
                snapshot.state(), snapshot.stringIndex(), snapshot.atomIndex(), snapshot.backtrackDepth());
        }
    }
}
