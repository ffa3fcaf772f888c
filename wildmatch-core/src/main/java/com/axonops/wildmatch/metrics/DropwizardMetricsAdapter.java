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

import com.codahale.metrics.MetricRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Dropwizard Metrics adapter for wildmatch-java.
 *
 * <p>Delegates every metric to a Dropwizard {@link MetricRegistry}, so pattern compilation and
 * matching show up alongside the host application's own metrics.
 *
 * <p><strong>Thread Safety:</strong> MetricRegistry and all Dropwizard metric types are
 * thread-safe, and so is this adapter.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * WildmatchConfig config = WildmatchConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "com.myapp.wildmatch"))
 *     .build();
 * Pattern pattern = Pattern.compile("mis*is*p*.", config);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements WildmatchMetricsRegistry {

    /** Metric prefix used when none is given. */
    public static final String DEFAULT_PREFIX = "com.axonops.wildmatch";

    private final MetricRegistry registry;
    private final String prefix;

    /**
     * Creates adapter with default metric prefix: {@value #DEFAULT_PREFIX}
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     * @throws NullPointerException if registry is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates adapter with custom metric prefix.
     *
     * <p>With prefix {@code "com.myapp.wildmatch"}, the compile counter appears as
     * {@code com.myapp.wildmatch.patterns.compiled.total.count}.
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     * @param prefix the metric name prefix
     * @throws NullPointerException if registry or prefix is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(metricName(name)).inc();
    }

    @Override
    public void incrementCounter(String name, long delta) {
        registry.counter(metricName(name)).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(metricName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    public String prefix() {
        return prefix;
    }

    private String metricName(String name) {
        return MetricRegistry.name(prefix, name);
    }
}
