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
 * Thrown in cross-validation mode when the two match engines return different results for the
 * same input and pattern.
 *
 * <p>Indicates a defect in an engine, never a property of the input.
 *
 * @since 1.0.0
 */
public final class EngineDisagreementException extends WildmatchException {

    private final String pattern;
    private final String input;
    private final boolean primaryResult;
    private final boolean oracleResult;

    public EngineDisagreementException(String pattern, String input, boolean primaryResult, boolean oracleResult) {
        super("Wildmatch: Engines disagree - primary: " + primaryResult + ", oracle: " + oracleResult
            + " (pattern: " + InvalidPatternException.truncate(pattern)
            + ", input: " + InvalidPatternException.truncate(input) + ")");
        this.pattern = pattern;
        this.input = input;
        this.primaryResult = primaryResult;
        this.oracleResult = oracleResult;
    }

    public String getPattern() {
        return pattern;
    }

    public String getInput() {
        return input;
    }

    public boolean getPrimaryResult() {
        return primaryResult;
    }

    public boolean getOracleResult() {
        return oracleResult;
    }
}
