/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.rpart;

import com.pathways.typing.api.exceptions.IncompleteTreeException;
import com.pathways.typing.api.model.Branch;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.Origin;
import com.pathways.typing.api.model.SplitRule;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.api.model.TreeNode;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * Rebuilds the explicit tree of one stratum from a parsed model.
 *
 * <p>The serialized tree numbers the children of node {@code id} as {@code 2·id} (left) and
 * {@code 2·id+1} (right). That arithmetic is used here only; the resulting tree holds explicit
 * child references and keeps the original ids.
 */
public class TreeBuilder {

    private static final Logger logger = Logger.getLogger(TreeBuilder.class.getName());

    public static final int ROOT_ID = 1;

    /**
     * Builds the tree of {@code stratum}.
     *
     * @throws IncompleteTreeException when the root is missing or a split node lacks a child
     */
    public DecisionTree build(ParsedCartModel model, Stratum stratum) {
        if (!model.contains(ROOT_ID)) {
            throw new IncompleteTreeException("Model of stratum '" + stratum + "' has no root node", String.valueOf(ROOT_ID));
        }
        IntSet visited = new IntOpenHashSet();
        TreeNode root = createNode(model, stratum, ROOT_ID);
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            int id = node.id();
            visited.add(id);
            long leftId = 2L * id;
            long rightId = leftId + 1;
            SplitRule rule = model.splits().get(id);

            if (rule == null) {
                node.addTerminalStratum(stratum);
                if (exists(model, leftId) || exists(model, rightId)) {
                    logger.fine(String.format("Ignoring children of terminal node %d in stratum %s", id, stratum));
                }
                continue;
            }
            if (!exists(model, leftId) || !exists(model, rightId)) {
                throw new IncompleteTreeException("Split node " + id + " of stratum '" + stratum
                        + "' does not have both children", String.valueOf(id));
            }
            node.putSplit(stratum, rule);
            TreeNode left = node.addChild(Branch.HOLDS, createNode(model, stratum, (int) leftId));
            TreeNode right = node.addChild(Branch.FAILS, createNode(model, stratum, (int) rightId));
            stack.push(right);
            stack.push(left);
        }

        if (visited.size() < model.nodeCount()) {
            logger.fine(String.format("Stratum %s: %d node records are not reachable from the root",
                    stratum, model.nodeCount() - visited.size()));
        }
        DecisionTree tree = new DecisionTree(root, List.of(stratum), model.variables(), model.levels());
        logger.fine(String.format("Built tree of stratum %s with %d nodes and %d leaves",
                stratum, tree.size(), tree.leaves().size()));
        return tree;
    }

    private static boolean exists(ParsedCartModel model, long id) {
        return id <= Integer.MAX_VALUE && model.contains((int) id);
    }

    private static TreeNode createNode(ParsedCartModel model, Stratum stratum, int id) {
        TreeNode node = new TreeNode(id);
        node.addStratum(stratum);
        node.putDistribution(stratum, model.distributions().get(id));
        node.addOrigin(new Origin(stratum, id));
        return node;
    }
}
