/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.rpart;

import com.pathways.typing.api.model.ClassDistribution;
import com.pathways.typing.api.model.SplitRule;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

import java.util.List;
import java.util.Map;

/**
 * Typed view of one serialized tree, keyed by the original node ids.
 *
 * @param splits split rule of every non-terminal node
 * @param distributions class distribution of every node
 * @param variables candidate variable universe in declaration order
 * @param levels declared levels of each categorical variable
 * @param classes outcome class labels
 */
public record ParsedCartModel(
        Int2ObjectMap<SplitRule> splits,
        Int2ObjectMap<ClassDistribution> distributions,
        List<String> variables,
        Map<String, List<String>> levels,
        List<String> classes
) {
    public ParsedCartModel {
        splits = Int2ObjectMaps.unmodifiable(new Int2ObjectOpenHashMap<>(splits));
        distributions = Int2ObjectMaps.unmodifiable(new Int2ObjectOpenHashMap<>(distributions));
        variables = List.copyOf(variables);
        levels = Map.copyOf(levels);
        classes = List.copyOf(classes);
    }

    public boolean contains(int nodeId) {
        return distributions.containsKey(nodeId);
    }

    public int nodeCount() {
        return distributions.size();
    }
}
