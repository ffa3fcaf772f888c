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

package com.axonops.wildmatch.metrics;

/**
 * Metric name constants for wildmatch-java instrumentation.
 *
 * <h2>Metric Categories</h2>
 *
 * <ul>
 *   <li><b>Pattern Compilation (3 metrics)</b> - compile counts, latency, collapsed atoms
 *   <li><b>Matching (6 metrics)</b> - operations, latency per engine, backtracking work,
 *       cross-validation runs
 *   <li><b>Bulk Matching (3 metrics)</b> - {@code matchAll}/{@code filter} calls and items
 *   <li><b>Errors (2 metrics)</b> - malformed patterns and engine disagreements
 * </ul>
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - latency histogram with percentiles (suffix: {@code .latency})
 * </ul>
 *
 * <h2>Monitoring Recommendations</h2>
 *
 * <ul>
 *   <li><b>Backtracking cost:</b> MATCHING_BACKTRACKS / MATCHING_OPERATIONS - a steadily rising
 *       ratio means patterns with long chains of distinct repeat atoms; consider the memoized
 *       engine for them
 *   <li><b>Engine disagreements:</b> ERRORS_ENGINE_DISAGREEMENT must stay at zero
 * </ul>
 *
 * @since 1.0.0
 * @see com.axonops.wildmatch.api.Pattern
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Pattern Compilation Metrics (3)
  // ========================================

  /**
   * Total patterns compiled successfully.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String PATTERNS_COMPILED = "patterns.compiled.total.count";

  /**
   * Pattern compilation latency histogram.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   *
   * <p><b>Recorded:</b> For each successful compilation
   */
  public static final String PATTERNS_COMPILATION_LATENCY = "patterns.compilation.latency";

  /**
   * Redundant repeat atoms dropped by the compiler (e.g. the second {@code a*} of {@code a*a*}).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String PATTERNS_ATOMS_COLLAPSED = "patterns.atoms.collapsed.total.count";

  // ========================================
  // Matching Metrics (6)
  // ========================================

  /**
   * Total single-input match operations, any engine.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_OPERATIONS = "matching.operations.total.count";

  /**
   * Match latency, any engine.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String MATCHING_LATENCY = "matching.latency";

  /**
   * Match latency of the backtracking engine.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String MATCHING_BACKTRACKING_LATENCY = "matching.backtracking.latency";

  /**
   * Match latency of the memoized engine.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String MATCHING_MEMOIZED_LATENCY = "matching.memoized.latency";

  /**
   * Backtrack entries resumed by the backtracking engine.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> Work spent undoing greedy repetition; grows quickly on adversarial
   * inputs
   */
  public static final String MATCHING_BACKTRACKS = "matching.backtracks.total.count";

  /**
   * Matches also checked against the second engine (cross-validation mode only).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_CROSS_VALIDATIONS = "matching.cross_validations.total.count";

  // ========================================
  // Bulk Matching Metrics (3)
  // ========================================

  /**
   * Total bulk calls ({@code matchAll}, {@code filter}, {@code filterNot}).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_BULK_OPERATIONS = "matching.bulk.operations.total.count";

  /**
   * Total inputs processed by bulk calls.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_BULK_ITEMS = "matching.bulk.items.total.count";

  /**
   * Latency of a whole bulk call.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String MATCHING_BULK_LATENCY = "matching.bulk.latency";

  // ========================================
  // Error Metrics (2)
  // ========================================

  /**
   * Patterns rejected as malformed.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_COMPILATION_FAILED = "errors.compilation.failed.total.count";

  /**
   * Cross-validation runs where the engines returned different results.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> Must be zero; anything else is an engine defect
   */
  public static final String ERRORS_ENGINE_DISAGREEMENT = "errors.engine_disagreement.total.count";
}
