/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rooted decision tree over an ordered strata universe and a candidate variable universe.
 *
 * <p>Every traversal uses an explicit stack. Children are visited in their stored order, so
 * {@link #preorder()} is deterministic.
 */
public final class DecisionTree {

    private final TreeNode root;
    private final List<Stratum> strata;
    private final List<String> variables;
    private final Map<String, List<String>> levels;
    private final Int2ObjectMap<TreeNode> index = new Int2ObjectOpenHashMap<>();

    public DecisionTree(TreeNode root, List<Stratum> strata, List<String> variables) {
        this(root, strata, variables, Map.of());
    }

    public DecisionTree(TreeNode root, List<Stratum> strata, List<String> variables,
                        Map<String, List<String>> levels) {
        this.root = Objects.requireNonNull(root, "Tree root cannot be null");
        if (root.parent() != null) {
            throw new IllegalArgumentException("Tree root " + root.id() + " is attached to another node");
        }
        this.strata = List.copyOf(strata);
        this.variables = List.copyOf(variables);
        Map<String, List<String>> levelCopy = new LinkedHashMap<>();
        levels.forEach((variable, values) -> levelCopy.put(variable, List.copyOf(values)));
        this.levels = Collections.unmodifiableMap(levelCopy);
        reindex();
    }

    public TreeNode root() {
        return root;
    }

    public List<Stratum> strata() {
        return strata;
    }

    public List<String> variables() {
        return variables;
    }

    /**
     * Declared levels of the categorical variables.
     */
    public Map<String, List<String>> levels() {
        return levels;
    }

    /**
     * Rebuilds the id index after structural edits.
     *
     * @throws IllegalStateException when two nodes share an id
     */
    public void reindex() {
        index.clear();
        for (TreeNode node : preorder()) {
            TreeNode previous = index.put(node.id(), node);
            if (previous != null) {
                throw new IllegalStateException("Duplicate node id " + node.id());
            }
        }
    }

    public TreeNode node(int id) {
        return index.get(id);
    }

    public TreeNode requireNode(int id) {
        TreeNode node = index.get(id);
        if (node == null) {
            throw new IllegalArgumentException("No node with id " + id);
        }
        return node;
    }

    public Int2ObjectMap<TreeNode> index() {
        return Int2ObjectMaps.unmodifiable(index);
    }

    public int size() {
        return index.size();
    }

    public int nextId() {
        int max = 0;
        for (int id : index.keySet()) {
            max = Math.max(max, id);
        }
        return max + 1;
    }

    public List<TreeNode> preorder() {
        return preorder(root);
    }

    public static List<TreeNode> preorder(TreeNode start) {
        List<TreeNode> order = new ArrayList<>();
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            order.add(node);
            List<TreeNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return order;
    }

    /**
     * Positions where at least one stratum ends.
     */
    public List<TreeNode> leaves() {
        List<TreeNode> leaves = new ArrayList<>();
        for (TreeNode node : preorder()) {
            if (node.hasOutcome()) {
                leaves.add(node);
            }
        }
        return leaves;
    }

    /**
     * Nodes that carry a question and were not collapsed into another occurrence.
     */
    public List<TreeNode> questionNodes() {
        List<TreeNode> nodes = new ArrayList<>();
        for (TreeNode node : preorder()) {
            if (node.hasQuestion() && !node.isDuplicate()) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    public DecisionTree copy() {
        return new DecisionTree(root.deepCopy(), strata, variables, levels);
    }

    /**
     * Renumbers nodes 1..n in pre-order, rewriting every id reference (relevance atoms,
     * duplicate links, aliases).
     */
    public void renumber() {
        List<TreeNode> order = preorder();
        Int2IntOpenHashMap mapping = new Int2IntOpenHashMap(order.size());
        mapping.defaultReturnValue(-1);
        for (int i = 0; i < order.size(); i++) {
            mapping.put(order.get(i).id(), i + 1);
        }
        for (TreeNode node : order) {
            node.remapIds(id -> {
                int mapped = mapping.get(id);
                return mapped < 0 ? id : mapped;
            });
        }
        reindex();
    }

    /**
     * Gives a detached subtree fresh ids starting at {@code firstId}; references between nodes of
     * the subtree follow, references to outside nodes are kept.
     *
     * @return the next unused id
     */
    public static int assignIds(TreeNode subtree, int firstId) {
        List<TreeNode> order = preorder(subtree);
        Int2IntOpenHashMap mapping = new Int2IntOpenHashMap(order.size());
        mapping.defaultReturnValue(-1);
        int next = firstId;
        for (TreeNode node : order) {
            mapping.put(node.id(), next++);
        }
        for (TreeNode node : order) {
            node.remapIds(id -> {
                int mapped = mapping.get(id);
                return mapped < 0 ? id : mapped;
            });
        }
        return next;
    }

    @Override
    public String toString() {
        return "DecisionTree{strata=" + strata + ", nodes=" + index.size() + "}";
    }
}
