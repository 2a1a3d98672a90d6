/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.api.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A fully materialized, read-only table of rows keyed by column name.
 *
 * <p>Cells may be {@code null}. Values are whatever the loader produced: strings from
 * CSV files, {@link java.time.LocalDate} or {@link java.time.LocalDateTime} from
 * in-memory callers. Column presence is what schema checks look at; a column declared
 * in {@link #columns()} may still be null in every row.
 */
public final class SourceTable {

    private final String name;
    private final List<String> columns;
    private final Set<String> columnSet;
    private final List<Map<String, Object>> rows;

    public SourceTable(String name, Collection<String> columns, List<Map<String, Object>> rows) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be blank");
        }
        this.name = name;
        this.columns = List.copyOf(new LinkedHashSet<>(columns));
        this.columnSet = Set.copyOf(this.columns);
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copy.add(Collections.unmodifiableMap(new HashMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<String> columns() {
        return columns;
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columnSet.contains(column);
    }

    /**
     * Returns the subset of {@code required} that this table does not declare, in the given order.
     */
    public List<String> missingColumns(List<String> required) {
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (column != null && !columnSet.contains(column)) {
                missing.add(column);
            }
        }
        return missing;
    }

    @Override
    public String toString() {
        return "SourceTable[" + name + ", columns=" + columns.size() + ", rows=" + rows.size() + ']';
    }

    /**
     * Row-by-row builder, mostly used by tests and in-memory callers.
     */
    public static final class Builder {
        private final String name;
        private final List<String> columns = new ArrayList<>();
        private final List<Map<String, Object>> rows = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder columns(String... names) {
            columns.addAll(Arrays.asList(names));
            return this;
        }

        /**
         * Adds a row whose values are positional against the declared columns.
         */
        public Builder row(Object... values) {
            if (values.length != columns.size()) {
                throw new IllegalArgumentException("Row has " + values.length + " values but table '"
                        + name + "' declares " + columns.size() + " columns");
            }
            Map<String, Object> row = new HashMap<>();
            for (int i = 0; i < values.length; i++) {
                row.put(columns.get(i), values[i]);
            }
            rows.add(row);
            return this;
        }

        public Builder row(Map<String, Object> row) {
            rows.add(row);
            return this;
        }

        public SourceTable build() {
            return new SourceTable(name, columns, rows);
        }
    }
}
