/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.form;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One output sheet: named rows keyed by column, plus the column order. Columns are collected in
 * first-seen order, so two row sets built from the same rows are identical.
 */
public final class RowSet {

    private final String name;
    private final List<String> columns;
    private final List<Map<String, String>> rows;

    private RowSet(String name, List<String> columns, List<Map<String, String>> rows) {
        this.name = name;
        this.columns = List.copyOf(columns);
        this.rows = List.copyOf(rows);
    }

    public String name() {
        return name;
    }

    public List<String> columns() {
        return columns;
    }

    public List<Map<String, String>> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    /**
     * Value of {@code column} in row {@code index}, empty when unset.
     */
    public String value(int index, String column) {
        return rows.get(index).getOrDefault(column, "");
    }

    public List<String> column(String column) {
        List<String> values = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            values.add(row.getOrDefault(column, ""));
        }
        return values;
    }

    /**
     * Unquoted tab separated preview with a header line, for logs and comparisons in tests.
     * Values holding tabs or line breaks are not escaped, so sheet files go through a CSV writer.
     */
    public String toTsv() {
        StringBuilder sb = new StringBuilder(String.join("\t", columns)).append('\n');
        for (Map<String, String> row : rows) {
            List<String> cells = new ArrayList<>(columns.size());
            for (String column : columns) {
                cells.add(row.getOrDefault(column, ""));
            }
            sb.append(String.join("\t", cells)).append('\n');
        }
        return sb.toString();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RowSet other)) return false;
        return name.equals(other.name) && columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, columns, rows);
    }

    @Override
    public String toString() {
        return "RowSet{" + name + ", rows=" + rows.size() + "}";
    }

    public static final class Builder {
        private final String name;
        private final Set<String> columns = new LinkedHashSet<>();
        private final List<Map<String, String>> rows = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name);
        }

        /**
         * Declares columns up front so they lead the column order even when empty.
         */
        public Builder columns(String... names) {
            Collections.addAll(columns, names);
            return this;
        }

        public Builder row(Map<String, String> row) {
            Map<String, String> copy = new LinkedHashMap<>();
            for (Map.Entry<String, String> entry : row.entrySet()) {
                columns.add(entry.getKey());
                copy.put(entry.getKey(), entry.getValue() == null ? "" : entry.getValue());
            }
            rows.add(Collections.unmodifiableMap(copy));
            return this;
        }

        public int size() {
            return rows.size();
        }

        public RowSet build() {
            return new RowSet(name, new ArrayList<>(columns), rows);
        }
    }
}
