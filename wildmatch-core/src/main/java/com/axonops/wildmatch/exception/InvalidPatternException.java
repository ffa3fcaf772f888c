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

package com.axonops.wildmatch.exception;

/**
 * Thrown when a pattern is malformed and cannot be compiled.
 *
 * <p>The only malformation is a {@code '*'} with no literal or {@code '.'} directly before it,
 * e.g. {@code "*abc"} or {@code "a**"}. Never raised at match time.
 *
 * @since 1.0.0
 */
public final class InvalidPatternException extends WildmatchException {

    private final String pattern;
    private final int index;

    public InvalidPatternException(String pattern, int index, String message) {
        super("Wildmatch: Invalid pattern: " + message + " at index " + index
            + " (pattern: " + truncate(pattern) + ")");
        this.pattern = pattern;
        this.index = index;
    }

    public String getPattern() {
        return pattern;
    }

    /** Position of the offending character in {@link #getPattern()}. */
    public int getIndex() {
        return index;
    }

    static String truncate(String s) {
        return s != null && s.length() > 100 ? s.substring(0, 97) + "..." : s;
    }
}
