package com.axonops.wildmatch.config;

import com.axonops.wildmatch.api.MatchEngine;
import com.axonops.wildmatch.engine.LoggingTraceListener;
import com.axonops.wildmatch.engine.MatchTraceListener;
import com.axonops.wildmatch.metrics.DropwizardMetricsAdapter;
import com.axonops.wildmatch.metrics.NoOpMetricsRegistry;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class WildmatchConfigTest {

    @Test
    void testDefaults() {
        WildmatchConfig config = WildmatchConfig.DEFAULT;

        assertThat(config.engine()).isEqualTo(MatchEngine.BACKTRACKING);
        assertThat(config.crossValidate()).isFalse();
        assertThat(config.collapseRedundantAtoms()).isTrue();
        assertThat(config.traceListener()).isSameAs(MatchTraceListener.NO_OP);
        assertThat(config.metricsRegistry()).isSameAs(NoOpMetricsRegistry.INSTANCE);
    }

    @Test
    void testBuilderStartsFromDefaults() {
        assertThat(WildmatchConfig.builder().build()).isEqualTo(WildmatchConfig.DEFAULT);
    }

    @Test
    void testBuilderOverrides() {
        DropwizardMetricsAdapter metrics = new DropwizardMetricsAdapter(new MetricRegistry());

        WildmatchConfig config = WildmatchConfig.builder()
            .engine(MatchEngine.MEMOIZED)
            .crossValidate(true)
            .collapseRedundantAtoms(false)
            .traceListener(LoggingTraceListener.INSTANCE)
            .metricsRegistry(metrics)
            .build();

        assertThat(config.engine()).isEqualTo(MatchEngine.MEMOIZED);
        assertThat(config.crossValidate()).isTrue();
        assertThat(config.collapseRedundantAtoms()).isFalse();
        assertThat(config.traceListener()).isSameAs(LoggingTraceListener.INSTANCE);
        assertThat(config.metricsRegistry()).isSameAs(metrics);
    }

    @Test
    void testToBuilderCopiesValues() {
        WildmatchConfig original = WildmatchConfig.builder().engine(MatchEngine.MEMOIZED).crossValidate(true).build();
        WildmatchConfig copy = original.toBuilder().collapseRedundantAtoms(false).build();

        assertThat(copy.engine()).isEqualTo(MatchEngine.MEMOIZED);
        assertThat(copy.crossValidate()).isTrue();
        assertThat(copy.collapseRedundantAtoms()).isFalse();
        assertThat(original.collapseRedundantAtoms()).isTrue();
    }

    @Test
    void testNullsRejected() {
        assertThatThrownBy(() -> WildmatchConfig.builder().engine(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessage("engine cannot be null");
        assertThatThrownBy(() -> WildmatchConfig.builder().traceListener(null))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> WildmatchConfig.builder().metricsRegistry(null))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new WildmatchConfig(MatchEngine.BACKTRACKING, false, true, null,
            NoOpMetricsRegistry.INSTANCE))
            .isInstanceOf(NullPointerException.class)
            .hasMessage("traceListener cannot be null");
    }
}
