package com.querier.query;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for filter compilation
 * Tracks compiled and failed filters, remote-read subquery cache hit rates,
 * backing-store lookup latency and deferred target-label resolution
 */
@Component
public class FilterMetrics {

    private final MeterRegistry meterRegistry;

    private Counter filtersCompiled;
    private Counter compilationsFailed;
    private Counter passThroughFilters;
    private Counter cacheHits;
    private Counter cacheMisses;
    private Counter targetLabelsDeferred;
    private Counter targetLabelBatches;
    private Timer lookupLatency;

    public FilterMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        filtersCompiled = Counter.builder("querier.filter.compiled")
            .description("Total number of predicates compiled")
            .register(meterRegistry);

        compilationsFailed = Counter.builder("querier.filter.failed")
            .description("Total number of filter compilations that failed")
            .register(meterRegistry);

        passThroughFilters = Counter.builder("querier.filter.passthrough")
            .description("Predicates emitted verbatim for tags unknown to the taxonomy")
            .register(meterRegistry);

        cacheHits = Counter.builder("querier.prometheus.subquery.cache.hits")
            .description("Remote-read subquery cache hits")
            .register(meterRegistry);

        cacheMisses = Counter.builder("querier.prometheus.subquery.cache.misses")
            .description("Remote-read subquery cache misses, stale entries included")
            .register(meterRegistry);

        targetLabelsDeferred = Counter.builder("querier.prometheus.target.label.deferred")
            .description("Target-label filters queued for batched resolution")
            .register(meterRegistry);

        targetLabelBatches = Counter.builder("querier.prometheus.target.label.batches")
            .description("Batched target-label resolution queries executed")
            .register(meterRegistry);

        lookupLatency = Timer.builder("querier.backing.store.lookup.latency")
            .description("Latency of backing-store lookups issued during compilation")
            .publishPercentiles(0.5, 0.95, 0.99)
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);
    }

    public void recordFilterCompiled() {
        filtersCompiled.increment();
    }

    public void recordCompilationFailed() {
        compilationsFailed.increment();
    }

    public void recordPassThrough() {
        passThroughFilters.increment();
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordTargetLabelDeferred() {
        targetLabelsDeferred.increment();
    }

    public void recordTargetLabelBatch() {
        targetLabelBatches.increment();
    }

    public Timer.Sample startLookupTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordLookupLatency(Timer.Sample sample) {
        sample.stop(lookupLatency);
    }

    /**
     * Calculate cache hit rate as a percentage
     * @return cache hit rate (0-100) or 0 if no cache lookups
     */
    public double getCacheHitRate() {
        double hits = cacheHits.count();
        double total = hits + cacheMisses.count();
        if (total == 0) {
            return 0.0;
        }
        return (hits / total) * 100.0;
    }

    // Getter methods for testing
    public Counter getFiltersCompiled() {
        return filtersCompiled;
    }

    public Counter getCompilationsFailed() {
        return compilationsFailed;
    }

    public Counter getPassThroughFilters() {
        return passThroughFilters;
    }

    public Counter getCacheHits() {
        return cacheHits;
    }

    public Counter getCacheMisses() {
        return cacheMisses;
    }

    public Counter getTargetLabelsDeferred() {
        return targetLabelsDeferred;
    }

    public Counter getTargetLabelBatches() {
        return targetLabelBatches;
    }

    public Timer getLookupLatency() {
        return lookupLatency;
    }
}
