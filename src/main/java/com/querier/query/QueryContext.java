package com.querier.query;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Represents one parsed statement handed to the statement assembler
 */
public class QueryContext {
    private String db;
    private String table;
    private List<String> selectFields = new ArrayList<>();
    private Expression whereExpression;
    private Expression havingExpression;
    private List<String> groupByFields = new ArrayList<>();
    private Map<String, String> aliasMap = new HashMap<>();
    private boolean remoteRead;
    private int limit = -1;

    public String getDb() {
        return db;
    }

    public void setDb(String db) {
        this.db = db;
    }

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    public List<String> getSelectFields() {
        return selectFields;
    }

    public void setSelectFields(List<String> selectFields) {
        this.selectFields = selectFields;
    }

    public Expression getWhereExpression() {
        return whereExpression;
    }

    public void setWhereExpression(Expression whereExpression) {
        this.whereExpression = whereExpression;
    }

    public Expression getHavingExpression() {
        return havingExpression;
    }

    public void setHavingExpression(Expression havingExpression) {
        this.havingExpression = havingExpression;
    }

    public List<String> getGroupByFields() {
        return groupByFields;
    }

    public void setGroupByFields(List<String> groupByFields) {
        this.groupByFields = groupByFields;
    }

    /**
     * Query alias ({@code AS} name) to canonical tag
     */
    public Map<String, String> getAliasMap() {
        return aliasMap;
    }

    public void setAliasMap(Map<String, String> aliasMap) {
        this.aliasMap = aliasMap;
    }

    public boolean isRemoteRead() {
        return remoteRead;
    }

    public void setRemoteRead(boolean remoteRead) {
        this.remoteRead = remoteRead;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }
}
