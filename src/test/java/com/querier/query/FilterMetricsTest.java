package com.querier.query;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Test suite for FilterMetrics
 */
@DisplayName("FilterMetrics Tests")
class FilterMetricsTest {

    private FilterMetrics filterMetrics;
    private MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        filterMetrics = new FilterMetrics(meterRegistry);
        filterMetrics.init();
    }

    @Test
    @DisplayName("Should register all meters on startup")
    void shouldRegisterAllMeters() {
        assertThat(meterRegistry.find("querier.filter.compiled").counter()).isNotNull();
        assertThat(meterRegistry.find("querier.filter.failed").counter()).isNotNull();
        assertThat(meterRegistry.find("querier.filter.passthrough").counter()).isNotNull();
        assertThat(meterRegistry.find("querier.prometheus.subquery.cache.hits").counter()).isNotNull();
        assertThat(meterRegistry.find("querier.prometheus.subquery.cache.misses").counter()).isNotNull();
        assertThat(meterRegistry.find("querier.prometheus.target.label.deferred").counter()).isNotNull();
        assertThat(meterRegistry.find("querier.prometheus.target.label.batches").counter()).isNotNull();
        assertThat(meterRegistry.find("querier.backing.store.lookup.latency").timer()).isNotNull();
    }

    @Test
    @DisplayName("Should count compiled, failed and passed-through filters")
    void shouldCountFilters() {
        filterMetrics.recordFilterCompiled();
        filterMetrics.recordFilterCompiled();
        filterMetrics.recordCompilationFailed();
        filterMetrics.recordPassThrough();

        assertThat(filterMetrics.getFiltersCompiled().count()).isEqualTo(2.0);
        assertThat(filterMetrics.getCompilationsFailed().count()).isEqualTo(1.0);
        assertThat(filterMetrics.getPassThroughFilters().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should calculate cache hit rate")
    void shouldCalculateCacheHitRate() {
        assertThat(filterMetrics.getCacheHitRate()).isEqualTo(0.0);

        filterMetrics.recordCacheHit();
        filterMetrics.recordCacheHit();
        filterMetrics.recordCacheMiss();

        assertThat(filterMetrics.getCacheHitRate()).isCloseTo(66.67, within(0.01));
    }

    @Test
    @DisplayName("Should record backing-store lookup latency")
    void shouldRecordLookupLatency() {
        Timer.Sample sample = filterMetrics.startLookupTimer();
        filterMetrics.recordLookupLatency(sample);

        assertThat(filterMetrics.getLookupLatency().count()).isEqualTo(1L);
    }
}
