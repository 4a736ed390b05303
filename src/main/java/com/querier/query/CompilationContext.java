package com.querier.query;

import com.querier.prometheus.TargetLabelFilter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-statement compilation state: the active database and table, the
 * {@code AS} alias map, the remote-read flag and the queue of target-label
 * filters deferred for batched resolution.
 *
 * Created fresh for every compiled statement and never shared between threads.
 */
public class CompilationContext {
    private final String db;
    private final String table;
    private final Map<String, String> aliasMap;
    private final boolean remoteRead;
    private final List<TargetLabelFilter> targetLabelFilters = new ArrayList<>();

    public CompilationContext(String db, String table) {
        this(db, table, Collections.emptyMap(), false);
    }

    public CompilationContext(String db, String table, Map<String, String> aliasMap, boolean remoteRead) {
        this.db = db;
        this.table = table;
        this.aliasMap = aliasMap == null ? new HashMap<>() : new HashMap<>(aliasMap);
        this.remoteRead = remoteRead;
    }

    public String getDb() {
        return db;
    }

    public String getTable() {
        return table;
    }

    /**
     * Canonical tag behind a query alias, or null
     */
    public String resolveAlias(String alias) {
        return aliasMap.get(alias);
    }

    public boolean isRemoteRead() {
        return remoteRead;
    }

    public void addTargetLabelFilter(TargetLabelFilter filter) {
        targetLabelFilters.add(filter);
    }

    public List<TargetLabelFilter> getTargetLabelFilters() {
        return Collections.unmodifiableList(targetLabelFilters);
    }
}
