package com.querier.prometheus;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Process-wide cache of resolved app-label filters, keyed by the verbatim
 * text of the original comparison.
 *
 * Size-bounded; staleness is checked against the entry timestamp on lookup,
 * stale entries stay in place until overwritten or evicted for size.
 */
@Component
public class PrometheusSubqueryCache {

    private static final Logger logger = LoggerFactory.getLogger(PrometheusSubqueryCache.class);

    private final Cache<String, SubqueryCacheEntry> cache;
    private final Clock clock;
    private final Duration timeout;

    public PrometheusSubqueryCache(
            @Value("${querier.prometheus.id-subquery-lru-entries:8192}") long maxEntries,
            @Value("${querier.prometheus.id-subquery-lru-timeout-seconds:60}") long timeoutSeconds,
            Clock clock) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .build();
        this.clock = clock;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        logger.info("Prometheus subquery cache initialized: maxEntries={}, timeout={}", maxEntries, timeout);
    }

    /**
     * Cached filter for the original filter text, unless absent or stale
     */
    public Optional<String> getFresh(String originFilter) {
        SubqueryCacheEntry entry = cache.getIfPresent(originFilter);
        if (entry == null) {
            return Optional.empty();
        }
        Duration age = Duration.between(entry.getTime(), clock.instant());
        if (age.compareTo(timeout) >= 0) {
            logger.debug("Stale subquery cache entry for {} (age {})", originFilter, age);
            return Optional.empty();
        }
        return Optional.of(entry.getFilter());
    }

    public void put(String originFilter, String filter) {
        cache.put(originFilter, new SubqueryCacheEntry(Instant.now(clock), filter));
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
