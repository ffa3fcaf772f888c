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

package com.axonops.wildmatch.selftest;

import com.axonops.wildmatch.exception.InvalidPatternException;
import com.axonops.wildmatch.engine.FullMatcher;
import com.axonops.wildmatch.engine.PatternCompiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fixed regression scenarios every engine must pass.
 *
 * <p>Run by the command line's {@code test_cases} mode and by the test suite. Changing an expected
 * result here is a behaviour change, not a test fix.
 *
 * @since 1.0.0
 */
public final class RegressionScenarios {

    /**
     * One expected full-match decision.
     *
     * @param text input string
     * @param pattern pattern string
     * @param expected required result
     */
    public record Scenario(String text, String pattern, boolean expected) {
        public Scenario {
            Objects.requireNonNull(text, "text cannot be null");
            Objects.requireNonNull(pattern, "pattern cannot be null");
        }

        @Override
        public String toString() {
            return "isMatch(\"" + text + "\", \"" + pattern + "\") == " + expected;
        }
    }

    public static final List<Scenario> SCENARIOS = List.of(
        new Scenario("aa", "a", false),
        new Scenario("aa", "a*", true),
        new Scenario("mississippi", "mis*is*p*.", false),
        new Scenario("aab", "c*a*b*", true),
        new Scenario("a", "ab*", true),
        new Scenario("aaaaaaaaaaaaab", "a*a*a*a*a*a*a*a*a*a*a*a*b", true),
        new Scenario("aaaaaaaaaaaaac", "a*a*a*a*a*a*a*a*a*a*a*a*b", false));

    /** Patterns the compiler must reject. */
    public static final List<String> MALFORMED_PATTERNS = List.of("*abc");

    private RegressionScenarios() {
        // Utility class
    }

    /**
     * Runs every scenario through {@code matcher}.
     *
     * @param matcher engine under test
     * @return scenarios whose result differed from the expectation; empty when all pass
     */
    public static List<Scenario> failures(FullMatcher matcher) {
        Objects.requireNonNull(matcher, "matcher cannot be null");
        List<Scenario> failed = new ArrayList<>();
        for (Scenario scenario : SCENARIOS) {
            if (matcher.isMatch(scenario.text(), scenario.pattern()) != scenario.expected()) {
                failed.add(scenario);
            }
        }
        return failed;
    }

    /**
     * @return malformed patterns the compiler accepted; empty when all were rejected
     */
    public static List<String> acceptedMalformedPatterns() {
        List<String> accepted = new ArrayList<>();
        for (String pattern : MALFORMED_PATTERNS) {
            try {
                PatternCompiler.compile(pattern);
                accepted.add(pattern);
            } catch (InvalidPatternException expected) {
                // rejected as required
            }
        }
        return accepted;
    }
}
