package com.querier.config;

import com.querier.tag.DefaultTagTaxonomy;
import com.querier.tag.TagDescriptionRegistry;
import com.querier.tag.TagRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;

/**
 * Startup wiring of the tag taxonomy, the clock used by the subquery cache
 * and the fallback meter registry
 */
@Configuration
public class QuerierConfig {
    private static final Logger logger = LoggerFactory.getLogger(QuerierConfig.class);

    @Value("${querier.tag.descriptions:tag-descriptions.yaml}")
    private String tagDescriptions;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * In-process registry, used unless an exporting registry is configured
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * Enum dictionary descriptions, loaded once from the classpath
     */
    @Bean
    public TagDescriptionRegistry tagDescriptionRegistry() {
        try (InputStream input = new ClassPathResource(tagDescriptions).getInputStream()) {
            return TagDescriptionRegistry.load(input);
        } catch (IOException e) {
            logger.error("Failed to load tag descriptions from {}", tagDescriptions, e);
            throw new IllegalStateException("Tag description loading failed: " + tagDescriptions, e);
        }
    }

    @Bean
    public TagRegistry tagRegistry(TagDescriptionRegistry tagDescriptionRegistry) {
        return DefaultTagTaxonomy.build(tagDescriptionRegistry);
    }
}
