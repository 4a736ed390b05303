package com.querier.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Query client issuing lookup statements against ClickHouse
 */
@Repository
public class ClickHouseQueryClient implements QueryClient {
    private static final Logger logger = LoggerFactory.getLogger(ClickHouseQueryClient.class);

    private final JdbcTemplate jdbcTemplate;

    public ClickHouseQueryClient(@Qualifier("clickHouseJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<List<Object>> query(String sql) {
        long startQuery = System.currentTimeMillis();
        List<List<Object>> rows = jdbcTemplate.query(sql, new PositionalRowMapper());
        long duration = System.currentTimeMillis() - startQuery;

        logger.debug("Lookup returned {} rows in {} ms: {}", rows.size(), duration, sql);
        return rows;
    }

    /**
     * Row mapper keeping column values in select-list order
     */
    static class PositionalRowMapper implements RowMapper<List<Object>> {
        @Override
        public List<Object> mapRow(ResultSet rs, int rowNum) throws SQLException {
            ResultSetMetaData metaData = rs.getMetaData();
            int columns = metaData.getColumnCount();
            List<Object> row = new ArrayList<>(columns);
            for (int i = 1; i <= columns; i++) {
                row.add(rs.getObject(i));
            }
            return row;
        }
    }
}
