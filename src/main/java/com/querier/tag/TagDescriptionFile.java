package com.querier.tag;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML layout of {@code tag-descriptions.yaml}
 */
public class TagDescriptionFile {

    @JsonProperty("string_enums")
    private List<String> stringEnums = new ArrayList<>();

    @JsonProperty("tables")
    private List<TableDescription> tables = new ArrayList<>();

    public List<String> getStringEnums() {
        return stringEnums;
    }

    public void setStringEnums(List<String> stringEnums) {
        this.stringEnums = stringEnums;
    }

    public List<TableDescription> getTables() {
        return tables;
    }

    public void setTables(List<TableDescription> tables) {
        this.tables = tables;
    }

    /**
     * Enum-backed tags of one table; {@code *} as table applies to the whole database
     */
    public static class TableDescription {

        @JsonProperty("db")
        private String db;

        @JsonProperty("table")
        private String table;

        @JsonProperty("enum_tags")
        private Map<String, String> enumTags = new HashMap<>();

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

        public Map<String, String> getEnumTags() {
            return enumTags;
        }

        public void setEnumTags(Map<String, String> enumTags) {
            this.enumTags = enumTags;
        }
    }
}
