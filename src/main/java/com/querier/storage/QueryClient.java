package com.querier.storage;

import java.util.List;

/**
 * Synchronous access to the backing column store.
 *
 * Implementations surface transport and syntax errors as Spring
 * {@link org.springframework.dao.DataAccessException}s.
 */
public interface QueryClient {

    /**
     * @param sql statement to execute
     * @return rows of positional column values, in result order
     */
    List<List<Object>> query(String sql);
}
