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

package com.axonops.wildmatch.dropwizard;

import com.axonops.wildmatch.config.WildmatchConfig;
import com.axonops.wildmatch.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for WildmatchConfig with Dropwizard Metrics integration.
 *
 * <p>Works with any application that already owns a {@link MetricRegistry}: pass it in and every
 * pattern compiled with the returned config reports into it.
 *
 * <p><strong>Usage Examples:</strong>
 * <pre>{@code
 * // Existing application registry:
 * WildmatchConfig config = WildmatchMetricsConfig.withMetrics(appRegistry, "com.myapp.wildmatch");
 * Pattern p = Pattern.compile("user.*", config);
 *
 * // Keep other settings, add metrics:
 * WildmatchConfig base = WildmatchConfig.builder().engine(MatchEngine.MEMOIZED).build();
 * WildmatchConfig config = WildmatchMetricsConfig.withMetrics(base, appRegistry, "com.myapp.wildmatch");
 * }</pre>
 *
 * <p><strong>JMX Exposure:</strong> This class sets up a JmxReporter for the provided registry (if
 * not already configured), so all wildmatch metrics are visible via JMX.
 *
 * @since 1.0.0
 */
public final class WildmatchMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(WildmatchMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private WildmatchMetricsConfig() {
        // Utility class
    }

    /**
     * Creates WildmatchConfig with Dropwizard Metrics integration and automatic JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return default configuration with metrics enabled
     */
    public static WildmatchConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(WildmatchConfig.DEFAULT, registry, metricPrefix, true);
    }

    /**
     * Creates WildmatchConfig with Dropwizard Metrics integration.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return default configuration with metrics enabled
     */
    public static WildmatchConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return withMetrics(WildmatchConfig.DEFAULT, registry, metricPrefix, enableJmx);
    }

    /**
     * Creates WildmatchConfig with Dropwizard Metrics using the default prefix
     * {@value DropwizardMetricsAdapter#DEFAULT_PREFIX}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return default configuration with metrics enabled
     */
    public static WildmatchConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Adds Dropwizard Metrics to an existing configuration, keeping its engine, validation and
     * tracing settings.
     *
     * @param base configuration to copy
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return copy of {@code base} reporting into {@code registry}
     */
    public static WildmatchConfig withMetrics(WildmatchConfig base, MetricRegistry registry, String metricPrefix,
                                              boolean enableJmx) {
        Objects.requireNonNull(base, "base cannot be null");
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return base.toBuilder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .build();
    }

    /**
     * Ensures JmxReporter is registered for the given MetricRegistry.
     *
     * <p>Idempotent: only the first registry seen gets a reporter.
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("Wildmatch: Registering JmxReporter for metrics");
                jmxReporter = JmxReporter.forRegistry(registry).build();
                jmxReporter.start();
                logger.info("Wildmatch: JmxReporter started - metrics available via JMX");
            } catch (Exception e) {
                // Not fatal: the registry may already be exposed
                logger.warn("Wildmatch: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    static synchronized boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /** Stops the JMX reporter started by this class, if any. */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("Wildmatch: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
