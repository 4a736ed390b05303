package com.querier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the querier filter compiler.
 *
 * Compiles tag-aware WHERE/HAVING clauses of the observability query
 * language into ClickHouse SQL: virtual tags are resolved against the tag
 * taxonomy, Prometheus labels against the metric registry, and remote-read
 * label lookups are served from a shared subquery cache.
 *
 * @version 1.0.0
 */
@SpringBootApplication
public class QuerierApplication {

    /**
     * Main entry point for the querier application.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(QuerierApplication.class, args);
    }
}
