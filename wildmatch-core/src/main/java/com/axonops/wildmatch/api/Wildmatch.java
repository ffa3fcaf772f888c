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

import com.axonops.wildmatch.config.WildmatchConfig;
import com.axonops.wildmatch.exception.InvalidPatternException;

import java.util.Collection;
import java.util.List;

/**
 * Main entry point for one-off wildcard matching.
 *
 * Thread-safe: All methods can be called concurrently from multiple threads. Nothing is cached
 * between calls; compile a {@link Pattern} once when matching the same pattern repeatedly.
 *
 * @since 1.0.0
 */
public final class Wildmatch {

    private Wildmatch() {
        // Utility class
    }

    public static Pattern compile(String pattern) {
        return Pattern.compile(pattern);
    }

    public static Pattern compile(String pattern, WildmatchConfig config) {
        return Pattern.compile(pattern, config);
    }

    /**
     * Decides whether {@code text} fully matches {@code pattern} using the default engine.
     *
     * @param text input string
     * @param pattern pattern string
     * @return true if the entire text matches
     * @throws InvalidPatternException if the pattern is malformed
     */
    public static boolean isMatch(String text, String pattern) {
        return compile(pattern).matches(text);
    }

    /**
     * Decides whether {@code text} fully matches {@code pattern} using the given engine.
     *
     * @param text input string
     * @param pattern pattern string
     * @param engine engine to use
     * @return true if the entire text matches
     * @throws InvalidPatternException if the pattern is malformed
     */
    public static boolean isMatch(String text, String pattern, MatchEngine engine) {
        return compile(pattern, WildmatchConfig.builder().engine(engine).build()).matches(text);
    }

    /**
     * Tests if the entire input matches the pattern (argument order as in {@link java.util.regex.Pattern#matches}).
     *
     * @param pattern pattern string
     * @param input input string
     * @return true if entire input matches, false otherwise
     */
    public static boolean matches(String pattern, String input) {
        return compile(pattern).matches(input);
    }

    // ========== Bulk Operations ==========

    /**
     * Tests multiple inputs against pattern.
     *
     * @param pattern pattern string
     * @param inputs array of input strings
     * @return boolean array (parallel to inputs)
     */
    public static boolean[] matchAll(String pattern, String[] inputs) {
        return compile(pattern).matchAll(inputs);
    }

    /**
     * Tests multiple inputs against pattern.
     *
     * @param pattern pattern string
     * @param inputs collection of input strings
     * @return boolean array (parallel to inputs)
     */
    public static boolean[] matchAll(String pattern, Collection<String> inputs) {
        return compile(pattern).matchAll(inputs);
    }

    /**
     * Filters collection to only strings matching the pattern.
     *
     * @param pattern pattern string
     * @param inputs collection to filter
     * @return new list containing only matching strings
     */
    public static List<String> filter(String pattern, Collection<String> inputs) {
        return compile(pattern).filter(inputs);
    }

    /**
     * Filters collection to only strings NOT matching the pattern.
     *
     * @param pattern pattern string
     * @param inputs collection to filter
     * @return new list containing only non-matching strings
     */
    public static List<String> filterNot(String pattern, Collection<String> inputs) {
        return compile(pattern).filterNot(inputs);
    }
}
