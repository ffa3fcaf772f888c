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

import java.util.Objects;

/**
 * Binds a {@link Pattern} to one input.
 *
 * NOT Thread-Safe: Each Matcher instance must be confined to a single thread.
 * The underlying Pattern CAN be safely shared - only the Matcher cannot.
 *
 * Example:
 * <pre>
 * Pattern shared = Pattern.compile("a*b");
 *
 * Matcher m = shared.matcher("aaab");
 * m.matches();            // true
 * m.reset("aaac").matches();  // false
 * </pre>
 *
 * @since 1.0.0
 */
public final class Matcher {

    private final Pattern pattern;
    private String input;

    Matcher(Pattern pattern, String input) {
        this.pattern = Objects.requireNonNull(pattern);
        this.input = Objects.requireNonNull(input, "input cannot be null");
    }

    /** Tests if the entire current input matches the pattern. */
    public boolean matches() {
        return pattern.matches(input);
    }

    /**
     * Rebinds this matcher to a new input.
     *
     * @param newInput the next input to test
     * @return this matcher
     */
    public Matcher reset(String newInput) {
        this.input = Objects.requireNonNull(newInput, "input cannot be null");
        return this;
    }

    public Pattern pattern() {
        return pattern;
    }

    public String input() {
        return input;
    }
}
