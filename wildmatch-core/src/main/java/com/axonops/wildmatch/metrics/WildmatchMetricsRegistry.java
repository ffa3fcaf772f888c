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
 * Metrics sink used by wildmatch-java.
 *
 * <p>Keeps the library independent of any particular metrics system. Ships with
 * {@link NoOpMetricsRegistry} (default) and {@link DropwizardMetricsAdapter}.
 *
 * <p><strong>Metric Types (following Dropwizard patterns):</strong>
 * <ul>
 *   <li><strong>Counter:</strong> monotonically increasing count</li>
 *   <li><strong>Timer:</strong> durations in nanoseconds, kept as a histogram</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> All implementations must be thread-safe; patterns are shared
 * between threads and report from all of them.
 *
 * @since 1.0.0
 * @see MetricNames
 */
public interface WildmatchMetricsRegistry {

    /**
     * Increment a counter by 1.
     *
     * @param name metric name (e.g., "patterns.compiled.total.count")
     */
    void incrementCounter(String name);

    /**
     * Increment a counter by a specific delta.
     *
     * @param name metric name (e.g., "matching.backtracks.total.count")
     * @param delta amount to increment (must be non-negative)
     */
    void incrementCounter(String name, long delta);

    /**
     * Record a timer measurement in nanoseconds.
     *
     * @param name metric name (e.g., "matching.latency")
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);
}
