package com.querier.storage;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.concurrent.TimeUnit;

/**
 * Read-only ClickHouse connection for the lookups a filter compilation
 * issues against the {@code flow_tag} dictionaries: app-label value ids
 * and batched target-label resolution.
 *
 * A lookup blocks the compiling query, so the pool stays small and every
 * statement is bounded by {@code querier.storage.clickhouse.lookup-timeout-seconds}.
 */
@Configuration
public class ClickHouseConfig {
    private static final Logger logger = LoggerFactory.getLogger(ClickHouseConfig.class);

    @Value("${querier.storage.clickhouse.url:jdbc:clickhouse://localhost:8123/flow_tag}")
    private String url;

    @Value("${querier.storage.clickhouse.username:default}")
    private String username;

    @Value("${querier.storage.clickhouse.password:}")
    private String password;

    @Value("${querier.storage.clickhouse.pool.size:4}")
    private int poolSize;

    @Value("${querier.storage.clickhouse.lookup-timeout-seconds:10}")
    private int lookupTimeoutSeconds;

    /**
     * Connections open lazily so the querier starts while ClickHouse is down;
     * the first lookup then fails as a backing-store error.
     */
    @Bean(name = "clickHouseDataSource")
    public DataSource clickHouseDataSource() {
        HikariConfig config = new HikariConfig();
        config.setPoolName("querier-flow-tag-lookup");
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        config.setDriverClassName("com.clickhouse.jdbc.ClickHouseDriver");
        config.setReadOnly(true);

        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(0);
        config.setConnectionTimeout(TimeUnit.SECONDS.toMillis(lookupTimeoutSeconds));
        config.setInitializationFailTimeout(-1);

        config.addDataSourceProperty("socket_timeout", String.valueOf(TimeUnit.SECONDS.toMillis(lookupTimeoutSeconds)));

        HikariDataSource dataSource = new HikariDataSource(config);
        logger.info("Flow tag lookup pool ready: url={}, size={}, timeout={}s", url, poolSize, lookupTimeoutSeconds);
        return dataSource;
    }

    @Bean(name = "clickHouseJdbcTemplate")
    public JdbcTemplate clickHouseJdbcTemplate(@Qualifier("clickHouseDataSource") DataSource clickHouseDataSource) {
        JdbcTemplate template = new JdbcTemplate(clickHouseDataSource);
        template.setQueryTimeout(lookupTimeoutSeconds);
        return template;
    }
}
