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

package com.axonops.wildmatch.config;

import com.axonops.wildmatch.api.MatchEngine;
import com.axonops.wildmatch.engine.MatchTraceListener;
import com.axonops.wildmatch.metrics.NoOpMetricsRegistry;
import com.axonops.wildmatch.metrics.WildmatchMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for compiled patterns: engine choice, validation, tracing and metrics.
 *
 * <p>Immutable configuration using Java 17 records. A config is passed explicitly to {@link
 * com.axonops.wildmatch.api.Pattern#compile(String, WildmatchConfig)}; there is no global
 * configuration.
 *
 * <h2>Engines</h2>
 *
 * <ul>
 *   <li><b>BACKTRACKING</b> (default) - compiled atoms, explicit state machine. Fast for typical
 *       patterns, exponential worst case on long chains of distinct repeat atoms.
 *   <li><b>MEMOIZED</b> - table-driven matching over raw indices. O(n&middot;m) time and space for
 *       every input.
 * </ul>
 *
 * <h2>Configuration Examples</h2>
 *
 * <h3>Default</h3>
 *
 * <pre>{@code
 * Pattern p = Pattern.compile("c*a*b*");   // uses WildmatchConfig.DEFAULT
 * }</pre>
 *
 * <h3>Untrusted Patterns</h3>
 *
 * <pre>{@code
 * WildmatchConfig config = WildmatchConfig.builder()
 *     .engine(MatchEngine.MEMOIZED)
 *     .build();
 * }</pre>
 *
 * <h3>Verifying The Backtracking Engine</h3>
 *
 * <pre>{@code
 * WildmatchConfig config = WildmatchConfig.builder()
 *     .crossValidate(true)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.wildmatch"))
 *     .build();
 * }</pre>
 *
 * @param engine engine used by {@code Pattern.matches}
 * @param crossValidate also run the other engine on every match and fail on disagreement
 * @param collapseRedundantAtoms let the compiler drop redundant adjacent repeat atoms
 * @param traceListener observer of backtracking state transitions ({@link MatchTraceListener#NO_OP}
 *     for none)
 * @param metricsRegistry metrics implementation (use {@link NoOpMetricsRegistry} for zero overhead)
 * @since 1.0.0
 * @see com.axonops.wildmatch.metrics.MetricNames
 */
public record WildmatchConfig(
    MatchEngine engine,
    boolean crossValidate,
    boolean collapseRedundantAtoms,
    MatchTraceListener traceListener,
    WildmatchMetricsRegistry metricsRegistry) {

  /**
   * Default configuration: backtracking engine, no cross-validation, redundant atoms collapsed, no
   * tracing, metrics disabled.
   */
  public static final WildmatchConfig DEFAULT =
      new WildmatchConfig(
          MatchEngine.BACKTRACKING,
          false, // No cross-validation
          true, // Collapse a*a* and friends
          MatchTraceListener.NO_OP,
          NoOpMetricsRegistry.INSTANCE // Metrics disabled (zero overhead)
          );

  /** Compact constructor with validation. */
  public WildmatchConfig {
    Objects.requireNonNull(engine, "engine cannot be null");
    Objects.requireNonNull(traceListener, "traceListener cannot be null");
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
  }

  /**
   * Creates a builder for custom configuration, starting from {@link #DEFAULT}.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder starting from this configuration's values. */
  public Builder toBuilder() {
    return new Builder()
        .engine(engine)
        .crossValidate(crossValidate)
        .collapseRedundantAtoms(collapseRedundantAtoms)
        .traceListener(traceListener)
        .metricsRegistry(metricsRegistry);
  }

  /**
   * Builder for custom configuration.
   *
   * <p>All fields start with the values of {@link #DEFAULT}.
   */
  public static class Builder {
    private MatchEngine engine = MatchEngine.BACKTRACKING;
    private boolean crossValidate = false;
    private boolean collapseRedundantAtoms = true;
    private MatchTraceListener traceListener = MatchTraceListener.NO_OP;
    private WildmatchMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Select the engine used for matching.
     *
     * <p><b>Default: BACKTRACKING</b>
     *
     * @param engine match engine (must not be null)
     * @return this builder
     */
    public Builder engine(MatchEngine engine) {
      this.engine = Objects.requireNonNull(engine, "engine cannot be null");
      return this;
    }

    /**
     * Run both engines on every match and throw {@link
     * com.axonops.wildmatch.exception.EngineDisagreementException} if they differ.
     *
     * <p><b>Default: disabled</b>. Roughly doubles matching cost.
     *
     * @param enabled true to cross-validate
     * @return this builder
     */
    public Builder crossValidate(boolean enabled) {
      this.crossValidate = enabled;
      return this;
    }

    /**
     * Enable or disable collapsing of redundant adjacent repeat atoms at compile time.
     *
     * <p><b>Default: enabled</b>. Disabling only makes sense for testing the compiler.
     *
     * @param enabled true to collapse
     * @return this builder
     */
    public Builder collapseRedundantAtoms(boolean enabled) {
      this.collapseRedundantAtoms = enabled;
      return this;
    }

    /**
     * Observer called on every backtracking state transition.
     *
     * <p>Example: {@code .traceListener(LoggingTraceListener.INSTANCE)}
     *
     * @param traceListener listener (must not be null)
     * @return this builder
     * @throws NullPointerException if traceListener is null
     */
    public Builder traceListener(MatchTraceListener traceListener) {
      this.traceListener = Objects.requireNonNull(traceListener, "traceListener cannot be null");
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * <p><b>Default: {@link NoOpMetricsRegistry} (zero overhead)</b>
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(WildmatchMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated immutable configuration
     */
    public WildmatchConfig build() {
      return new WildmatchConfig(
          engine, crossValidate, collapseRedundantAtoms, traceListener, metricsRegistry);
    }
  }
}
