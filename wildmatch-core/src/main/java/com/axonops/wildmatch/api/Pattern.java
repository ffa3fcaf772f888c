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
import com.axonops.wildmatch.engine.AtomSequence;
import com.axonops.wildmatch.engine.BacktrackingMatcher;
import com.axonops.wildmatch.engine.MatchOutcome;
import com.axonops.wildmatch.engine.MemoizedMatcher;
import com.axonops.wildmatch.engine.PatternCompiler;
import com.axonops.wildmatch.exception.EngineDisagreementException;
import com.axonops.wildmatch.exception.InvalidPatternException;
import com.axonops.wildmatch.metrics.MetricNames;
import com.axonops.wildmatch.metrics.WildmatchMetricsRegistry;
import com.axonops.wildmatch.util.PatternHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A compiled wildcard pattern.
 *
 * <p>Supports two metacharacters: {@code '.'} matches any single character and {@code '*'} matches
 * zero or more of the preceding literal or {@code '.'}. Matching is anchored: the entire input must
 * match the entire pattern.
 *
 * Thread-safe: Pattern instances are immutable and can be shared between threads. Every match call
 * owns its own working state.
 *
 * Example:
 * <pre>
 * Pattern pattern = Pattern.compile("mis*is*ip*.");
 * pattern.matches("mississippi");   // true
 * pattern.matches("missouri");      // false
 * </pre>
 *
 * @since 1.0.0
 */
public final class Pattern {
    private static final Logger logger = LoggerFactory.getLogger(Pattern.class);

    private final String patternString;
    private final AtomSequence atoms;
    private final WildmatchConfig config;
    private final BacktrackingMatcher backtracking;
    private final MemoizedMatcher memoized;

    private Pattern(String patternString, AtomSequence atoms, WildmatchConfig config) {
        this.patternString = patternString;
        this.atoms = atoms;
        this.config = config;
        this.backtracking = new BacktrackingMatcher(config.traceListener());
        this.memoized = new MemoizedMatcher();
    }

    public static Pattern compile(String pattern) {
        return compile(pattern, WildmatchConfig.DEFAULT);
    }

    /**
     * Compiles a pattern with the given configuration.
     *
     * <p>The pattern is validated whichever engine is configured, so a malformed pattern always
     * fails here and never at match time.
     *
     * @param pattern pattern string (empty matches only the empty string)
     * @param config engine, validation, tracing and metrics settings
     * @return compiled pattern
     * @throws InvalidPatternException if a {@code '*'} has no preceding literal or {@code '.'}
     * @throws NullPointerException if pattern or config is null
     */
    public static Pattern compile(String pattern, WildmatchConfig config) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Objects.requireNonNull(config, "config cannot be null");

        WildmatchMetricsRegistry metrics = config.metricsRegistry();
        String hash = PatternHasher.hash(pattern);

        long startNanos = System.nanoTime();
        AtomSequence atoms;
        try {
            atoms = PatternCompiler.compile(pattern, config.collapseRedundantAtoms());
        } catch (InvalidPatternException e) {
            metrics.incrementCounter(MetricNames.ERRORS_COMPILATION_FAILED);
            logger.debug("Wildmatch: Pattern compilation failed - hash: {}, index: {}", hash, e.getIndex());
            throw e;
        }
        long durationNanos = System.nanoTime() - startNanos;

        metrics.recordTimer(MetricNames.PATTERNS_COMPILATION_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.PATTERNS_COMPILED);
        if (atoms.collapsedCount() > 0) {
            metrics.incrementCounter(MetricNames.PATTERNS_ATOMS_COLLAPSED, atoms.collapsedCount());
        }

        logger.trace("Wildmatch: Pattern compiled - hash: {}, length: {}, atoms: {}, collapsed: {}, engine: {}, timeNs: {}",
            hash, pattern.length(), atoms.size(), atoms.collapsedCount(), config.engine(), durationNanos);

        return new Pattern(pattern, atoms, config);
    }

    public Matcher matcher(String input) {
        return new Matcher(this, input);
    }

    /**
     * Tests if the entire input matches this pattern.
     *
     * @param input the string to test
     * @return true if the whole input matches
     * @throws NullPointerException if input is null
     * @throws EngineDisagreementException in cross-validation mode, if the engines disagree
     */
    public boolean matches(String input) {
        Objects.requireNonNull(input, "input cannot be null");

        long startNanos = System.nanoTime();
        boolean result = evaluate(input);
        long durationNanos = System.nanoTime() - startNanos;

        WildmatchMetricsRegistry metrics = config.metricsRegistry();
        metrics.incrementCounter(MetricNames.MATCHING_OPERATIONS);
        metrics.recordTimer(MetricNames.MATCHING_LATENCY, durationNanos);

        return result;
    }

    // ========== Bulk Operations ==========

    /**
     * Tests multiple inputs against this pattern.
     *
     * @param inputs array of input strings
     * @return boolean array parallel to inputs
     * @throws NullPointerException if inputs or any element is null
     */
    public boolean[] matchAll(String[] inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");

        long startNanos = System.nanoTime();
        boolean[] results = new boolean[inputs.length];
        for (int i = 0; i < inputs.length; i++) {
            results[i] = evaluate(Objects.requireNonNull(inputs[i], "inputs cannot contain null"));
        }
        recordBulk(inputs.length, System.nanoTime() - startNanos);
        return results;
    }

    /**
     * Tests multiple inputs against this pattern.
     *
     * @param inputs collection of input strings (iteration order defines result order)
     * @return boolean array parallel to the collection's iteration order
     * @throws NullPointerException if inputs or any element is null
     */
    public boolean[] matchAll(Collection<String> inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        return matchAll(inputs.toArray(new String[0]));
    }

    /**
     * Returns the inputs that fully match this pattern, in iteration order.
     *
     * @param inputs collection to filter
     * @return new list containing only matching strings
     */
    public List<String> filter(Collection<String> inputs) {
        return filter(inputs, true);
    }

    /**
     * Returns the inputs that do NOT match this pattern, in iteration order.
     *
     * @param inputs collection to filter
     * @return new list containing only non-matching strings
     */
    public List<String> filterNot(Collection<String> inputs) {
        return filter(inputs, false);
    }

    private List<String> filter(Collection<String> inputs, boolean keepMatches) {
        Objects.requireNonNull(inputs, "inputs cannot be null");

        long startNanos = System.nanoTime();
        List<String> kept = new ArrayList<>();
        for (String input : inputs) {
            if (evaluate(Objects.requireNonNull(input, "inputs cannot contain null")) == keepMatches) {
                kept.add(input);
            }
        }
        recordBulk(inputs.size(), System.nanoTime() - startNanos);
        return kept;
    }

    // ========== Accessors ==========

    /** The source pattern string. */
    public String pattern() {
        return patternString;
    }

    /** Compiled atoms used by the backtracking engine. */
    public AtomSequence atoms() {
        return atoms;
    }

    public WildmatchConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return patternString;
    }

    // ========== Internals ==========

    private boolean evaluate(String input) {
        MatchEngine engine = config.engine();
        boolean result = run(engine, input);

        if (config.crossValidate()) {
            boolean oracleResult = run(engine.oracle(), input);
            WildmatchMetricsRegistry metrics = config.metricsRegistry();
            metrics.incrementCounter(MetricNames.MATCHING_CROSS_VALIDATIONS);

            if (oracleResult != result) {
                metrics.incrementCounter(MetricNames.ERRORS_ENGINE_DISAGREEMENT);
                logger.error("Wildmatch: Engine disagreement - pattern: {}, input: {}, {}: {}, {}: {}",
                    PatternHasher.hashWithLength(patternString), PatternHasher.hashWithLength(input),
                    engine, result, engine.oracle(), oracleResult);
                throw new EngineDisagreementException(patternString, input, result, oracleResult);
            }
        }
        return result;
    }

    private boolean run(MatchEngine engine, String input) {
        WildmatchMetricsRegistry metrics = config.metricsRegistry();
        long startNanos = System.nanoTime();

        switch (engine) {
            case BACKTRACKING -> {
                MatchOutcome outcome = backtracking.run(input, atoms);
                metrics.recordTimer(MetricNames.MATCHING_BACKTRACKING_LATENCY, System.nanoTime() - startNanos);
                if (outcome.backtracks() > 0) {
                    metrics.incrementCounter(MetricNames.MATCHING_BACKTRACKS, outcome.backtracks());
                }
                return outcome.matched();
            }
            case MEMOIZED -> {
                boolean matched = memoized.isMatch(input, patternString);
                metrics.recordTimer(MetricNames.MATCHING_MEMOIZED_LATENCY, System.nanoTime() - startNanos);
                return matched;
            }
            default -> throw new IllegalStateException("Unknown engine: " + engine);
        }
    }

    private void recordBulk(int items, long durationNanos) {
        WildmatchMetricsRegistry metrics = config.metricsRegistry();
        metrics.incrementCounter(MetricNames.MATCHING_BULK_OPERATIONS);
        metrics.incrementCounter(MetricNames.MATCHING_BULK_ITEMS, items);
        metrics.recordTimer(MetricNames.MATCHING_BULK_LATENCY, durationNanos);
    }
}
