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

package com.axonops.wildmatch.util;

/**
 * Hashes pattern and input strings for log messages.
 *
 * <p>Logs carry a stable hash instead of the raw text: patterns and inputs may be sensitive or
 * very long, and the same string always yields the same hash, so it can still be grepped.
 *
 * <p>Example: pattern {@code "mis*is*p*."} gives a hash such as {@code "5e2b7a1f"}.
 *
 * @since 1.0.0
 */
public final class PatternHasher {

    private PatternHasher() {
        // Utility class
    }

    /**
     * @param text pattern or input string
     * @return hex form of {@link String#hashCode()}, or {@code "null"}
     */
    public static String hash(String text) {
        if (text == null) {
            return "null";
        }
        return Integer.toHexString(text.hashCode());
    }

    /**
     * Hash with the string length appended, e.g. {@code "5e2b7a1f[len=10]"}.
     *
     * @param text pattern or input string
     * @return hash and length
     */
    public static String hashWithLength(String text) {
        if (text == null) {
            return "null";
        }
        return hash(text) + "[len=" + text.length() + "]";
    }
}
