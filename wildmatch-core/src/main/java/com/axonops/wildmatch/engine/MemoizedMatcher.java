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

import java.util.Objects;

/**
 * Full-match engine deciding directly on raw string and pattern indices, with every
 * {@code (stringIndex, patternIndex)} subproblem solved exactly once.
 *
 * <p>The table is filled from the end of both strings towards the start, so cell
 * {@code [s][p]} only reads cells with a larger string or pattern index. No recursion is used:
 * input length is bounded by heap, not by thread stack.
 *
 * <p>O(|text|&middot;|pattern|) time and space, always terminates. This is the reference against
 * which {@link BacktrackingMatcher} is validated.
 *
 * <p>Total over any pattern string: there is no compile step, so a {@code '*'} with nothing to
 * repeat is simply compared as an ordinary character.
 *
 * <p>Thread-safe: the table is created per call and discarded on return.
 *
 * @since 1.0.0
 */
public final class MemoizedMatcher implements FullMatcher {

    @Override
    public boolean isMatch(String text, String pattern) {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(pattern, "pattern cannot be null");

        int n = text.length();
        int m = pattern.length();

        // table[s][p]: does text[s..] fully match pattern[p..]
        boolean[][] table = new boolean[n + 1][m + 1];
        table[n][m] = true;

        for (int pIdx = m - 1; pIdx >= 0; pIdx--) {
            char pc = pattern.charAt(pIdx);
            boolean repeated = pIdx + 1 < m && pattern.charAt(pIdx + 1) == PatternCompiler.REPEAT;

            for (int sIdx = n; sIdx >= 0; sIdx--) {
                boolean matched = sIdx < n
                    && (pc == text.charAt(sIdx) || pc == PatternCompiler.WILDCARD);

                if (repeated) {
                    // zero repetitions, or one more
                    table[sIdx][pIdx] = table[sIdx][pIdx + 2] || (matched && table[sIdx + 1][pIdx]);
                } else {
                    table[sIdx][pIdx] = matched && table[sIdx + 1][pIdx + 1];
                }
            }
        }

        return table[0][0];
    }
}
