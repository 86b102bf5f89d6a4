/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.form;

import com.pathways.typing.api.model.DecisionTree;

import java.util.Map;

/**
 * Result of a form compilation: the form sheets, the flow diagram of the final tree, the tree
 * itself and per-run statistics.
 */
public record CompiledForm(FormDocument form, String diagram, DecisionTree tree, Map<String, Object> stats) {

    public CompiledForm {
        stats = stats == null ? Map.of() : Map.copyOf(stats);
    }
}
