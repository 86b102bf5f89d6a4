/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.rpart;

import com.pathways.typing.api.exceptions.MalformedModelException;
import com.pathways.typing.api.model.CartModelDefinition;
import com.pathways.typing.api.model.CategoricalSplit;
import com.pathways.typing.api.model.ClassDistribution;
import com.pathways.typing.api.model.Comparison;
import com.pathways.typing.api.model.NumericSplit;
import com.pathways.typing.api.model.SplitRule;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Decodes the flat node, level and category-membership tables of a fitted tree into typed
 * split rules and class distributions.
 *
 * <p>Polarity: the left child is the branch where the decoded rule holds.
 * <ul>
 *   <li>{@code ncat = -1}: {@code var < index} goes left</li>
 *   <li>{@code ncat = 1}: {@code var >= index} goes left</li>
 *   <li>{@code ncat >= 2}: row {@code index} of {@code csplit} lists, per level, 1 (left),
 *       3 (right) or 2 (level not present at this node)</li>
 * </ul>
 * Nothing is coerced: any inconsistency raises {@link MalformedModelException}.
 */
public class SplitParser {

    private static final Logger logger = Logger.getLogger(SplitParser.class.getName());

    private static final int GOES_LEFT = 1;
    private static final int ABSENT = 2;
    private static final int GOES_RIGHT = 3;

    public ParsedCartModel parse(CartModelDefinition definition) {
        if (definition == null) {
            throw new MalformedModelException("Model definition cannot be null", "model");
        }
        List<String> variables = requireNames(definition.variables(), "variables");
        List<String> classes = requireNames(definition.ylevels(), "ylevels");
        List<CartModelDefinition.NodeRecord> nodes = requireTable(definition.nodes(), "nodes");

        Int2ObjectMap<SplitRule> splits = new Int2ObjectOpenHashMap<>();
        Int2ObjectMap<ClassDistribution> distributions = new Int2ObjectOpenHashMap<>();
        Map<String, List<String>> usedLevels = new LinkedHashMap<>();

        for (CartModelDefinition.NodeRecord node : nodes) {
            if (node == null || node.id() == null || node.id() < 1) {
                throw new MalformedModelException("Node record without a positive id", "node");
            }
            int id = node.id();
            if (distributions.containsKey(id)) {
                throw new MalformedModelException("Duplicate node id " + id, String.valueOf(id));
            }
            distributions.put(id, parseDistribution(node, classes));
            if (!node.isLeaf()) {
                SplitRule rule = parseSplit(node, variables, definition);
                splits.put(id, rule);
                if (rule instanceof CategoricalSplit categorical) {
                    usedLevels.put(categorical.variable(), definition.xlevels().get(categorical.variable()));
                }
            }
        }

        logger.fine(String.format("Parsed %d nodes (%d splits) over %d variables",
                distributions.size(), splits.size(), variables.size()));
        return new ParsedCartModel(splits, distributions, variables, declaredLevels(definition, usedLevels), classes);
    }

    private Map<String, List<String>> declaredLevels(CartModelDefinition definition,
                                                     Map<String, List<String>> usedLevels) {
        Map<String, List<String>> levels = new LinkedHashMap<>(usedLevels);
        definition.xlevels().forEach((variable, values) -> {
            if (values != null) {
                levels.putIfAbsent(variable, values);
            }
        });
        return levels;
    }

    private ClassDistribution parseDistribution(CartModelDefinition.NodeRecord node, List<String> classes) {
        Integer yval = node.yval();
        if (yval == null || yval < 1 || yval > classes.size()) {
            throw new MalformedModelException(
                    "Node " + node.id() + " has class index " + yval + " outside 1.." + classes.size(),
                    String.valueOf(node.id()));
        }
        Map<String, Double> probabilities = new LinkedHashMap<>();
        if (node.yprob() != null) {
            if (node.yprob().size() != classes.size()) {
                throw new MalformedModelException(
                        "Node " + node.id() + " has " + node.yprob().size() + " class probabilities for "
                                + classes.size() + " classes", String.valueOf(node.id()));
            }
            for (int i = 0; i < classes.size(); i++) {
                Double probability = node.yprob().get(i);
                if (probability == null) {
                    throw new MalformedModelException("Node " + node.id() + " has an empty probability for class '"
                            + classes.get(i) + "'", String.valueOf(node.id()));
                }
                probabilities.put(classes.get(i), probability);
            }
        }
        if (node.n() < 0) {
            throw new MalformedModelException("Node " + node.id() + " has a negative sample count",
                    String.valueOf(node.id()));
        }
        return new ClassDistribution(classes.get(yval - 1), node.n(), probabilities);
    }

    private SplitRule parseSplit(CartModelDefinition.NodeRecord node, List<String> variables,
                                 CartModelDefinition definition) {
        String nodeId = String.valueOf(node.id());
        int var = node.var();
        if (var < 0 || var >= variables.size()) {
            throw new MalformedModelException(
                    "Node " + nodeId + " references variable index " + var + " outside 0.." + (variables.size() - 1),
                    nodeId);
        }
        String variable = variables.get(var);
        if (node.ncat() == null || node.index() == null) {
            throw new MalformedModelException("Split node " + nodeId + " lacks ncat or index", nodeId);
        }
        int ncat = node.ncat();
        double index = node.index();
        if (ncat == -1) {
            return new NumericSplit(variable, Comparison.LESS_THAN, requireFinite(index, nodeId));
        }
        if (ncat == 1) {
            return new NumericSplit(variable, Comparison.GREATER_THAN_OR_EQUAL, requireFinite(index, nodeId));
        }
        if (ncat < 2) {
            throw new MalformedModelException("Split node " + nodeId + " has invalid ncat " + ncat, nodeId);
        }
        return parseCategorical(nodeId, variable, ncat, index, definition);
    }

    private CategoricalSplit parseCategorical(String nodeId, String variable, int ncat, double index,
                                              CartModelDefinition definition) {
        List<String> levels = definition.xlevels().get(variable);
        if (levels == null || levels.isEmpty()) {
            throw new MalformedModelException("Categorical variable '" + variable + "' has no declared levels", variable);
        }
        if (ncat != levels.size()) {
            throw new MalformedModelException("Split node " + nodeId + " declares " + ncat + " categories but '"
                    + variable + "' has " + levels.size() + " levels", nodeId);
        }
        int row = (int) index;
        if (row != index || row < 1 || row > definition.csplit().size()) {
            throw new MalformedModelException("Split node " + nodeId + " references csplit row " + index
                    + " outside 1.." + definition.csplit().size(), nodeId);
        }
        List<Integer> flags = definition.csplit().get(row - 1);
        if (flags == null || flags.size() < levels.size()) {
            throw new MalformedModelException("csplit row " + row + " has " + (flags == null ? 0 : flags.size())
                    + " flags for " + levels.size() + " levels of '" + variable + "'", nodeId);
        }
        List<String> left = new ArrayList<>();
        List<String> right = new ArrayList<>();
        for (int i = 0; i < levels.size(); i++) {
            Integer flag = flags.get(i);
            if (flag == null) {
                throw new MalformedModelException("csplit row " + row + " has an empty flag", nodeId);
            }
            switch (flag) {
                case GOES_LEFT -> left.add(levels.get(i));
                case GOES_RIGHT -> right.add(levels.get(i));
                case ABSENT -> {
                }
                default -> throw new MalformedModelException(
                        "csplit row " + row + " has unknown flag " + flag, nodeId);
            }
        }
        if (left.isEmpty() || right.isEmpty()) {
            throw new MalformedModelException("Categorical split of node " + nodeId + " on '" + variable
                    + "' leaves one side empty", nodeId);
        }
        return new CategoricalSplit(variable, left, right);
    }

    private static double requireFinite(double value, String nodeId) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new MalformedModelException("Split node " + nodeId + " has a non-finite threshold", nodeId);
        }
        return value;
    }

    private static List<String> requireNames(List<String> table, String name) {
        requireTable(table, name);
        for (int i = 0; i < table.size(); i++) {
            if (table.get(i) == null) {
                throw new MalformedModelException("Model table '" + name + "' has an empty entry at position " + i,
                        name);
            }
        }
        return table;
    }

    private static <T> List<T> requireTable(List<T> table, String name) {
        if (table == null || table.isEmpty()) {
            throw new MalformedModelException("Model table '" + name + "' is missing or empty", name);
        }
        return table;
    }
}
