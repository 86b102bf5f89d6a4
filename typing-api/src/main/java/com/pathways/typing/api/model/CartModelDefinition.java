/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON representation of a fitted recursive-partitioning tree.
 * This is a simple Data Transfer Object (DTO) used only for loading.
 *
 * <p>{@code csplit} rows hold one flag per level of the split variable: 1 sends the level to
 * the left child, 3 to the right child and 2 marks a level absent at that node.
 */
public record CartModelDefinition(
        @JsonProperty("variables") List<String> variables,
        @JsonProperty("ylevels") List<String> ylevels,
        @JsonProperty("xlevels") Map<String, List<String>> xlevels,
        @JsonProperty("csplit") List<List<Integer>> csplit,
        @JsonProperty("nodes") List<NodeRecord> nodes
) {
    /**
     * DTO for one row of the node table.
     *
     * <p>{@code var} indexes {@code variables} (null for a leaf); {@code ncat} is -1 when
     * {@code var < index} goes left, 1 when {@code var >= index} goes left, and the number of
     * levels for a categorical split whose {@code index} is a 1-based {@code csplit} row.
     * {@code yval} is a 1-based index into {@code ylevels}.
     */
    public record NodeRecord(
            @JsonProperty("id") Integer id,
            @JsonProperty("n") Integer n,
            @JsonProperty("var") Integer var,
            @JsonProperty("ncat") Integer ncat,
            @JsonProperty("index") Double index,
            @JsonProperty("yval") Integer yval,
            @JsonProperty("yprob") List<Double> yprob
    ) {
        public boolean isLeaf() {
            return var == null;
        }

        public Integer n() {
            return n != null ? n : 0;
        }
    }

    public Map<String, List<String>> xlevels() {
        return xlevels != null ? xlevels : Map.of();
    }

    public List<List<Integer>> csplit() {
        return csplit != null ? csplit : List.of();
    }
}
