/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.merge;

import com.pathways.typing.api.exceptions.MergeConflictException;
import com.pathways.typing.api.model.Branch;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.SplitRule;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.api.model.TreeNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Merges stratum trees into one tree whose nodes carry per-stratum split rules.
 *
 * <p>Trees are folded left to right with a lock-step walk over corresponding positions:
 * <ul>
 *   <li>both sides terminal: one leaf, terminal for both strata</li>
 *   <li>both sides split on the same variable: one node with a rule per stratum (thresholds
 *       may differ); HOLDS children are merged with HOLDS children, FAILS with FAILS</li>
 *   <li>one side terminal: the splitting side's structure survives and the terminal side is
 *       recorded as a terminal stratum of the position</li>
 *   <li>both sides split on different variables: the earlier tree's split survives and the later
 *       tree's subtree hangs off the same position as an {@link Branch#ALTERNATIVE} child</li>
 * </ul>
 * Nodes of the merged tree are numbered in pre-order and carry no relevance yet.
 */
public class TreeMerger {

    private static final Logger logger = Logger.getLogger(TreeMerger.class.getName());

    private record Work(TreeNode first, TreeNode second, TreeNode parent, Branch edge) {
    }

    /**
     * Merges the given trees in order.
     *
     * @throws MergeConflictException when the trees declare different variable universes or
     *                                disagree on the kind or levels of a variable
     */
    public DecisionTree merge(List<DecisionTree> trees) {
        if (trees == null || trees.isEmpty()) {
            throw new IllegalArgumentException("At least one tree is required");
        }
        checkCompatible(trees);

        TreeNode root = trees.get(0).root().deepCopy();
        Set<Stratum> strata = new LinkedHashSet<>(trees.get(0).strata());
        Map<String, List<String>> levels = new LinkedHashMap<>(trees.get(0).levels());
        for (int i = 1; i < trees.size(); i++) {
            DecisionTree next = trees.get(i);
            root = mergePair(root, next.root());
            strata.addAll(next.strata());
            next.levels().forEach(levels::putIfAbsent);
        }

        // stratum trees reuse the same ids; relevance of the inputs no longer applies
        int nextId = 1;
        for (TreeNode node : DecisionTree.preorder(root)) {
            node.setId(nextId++);
            node.setRelevance(null);
        }
        DecisionTree merged = new DecisionTree(root, List.copyOf(strata), trees.get(0).variables(), levels);
        logger.info(String.format("Merged %d trees over strata %s into %d nodes (%d leaf positions)",
                trees.size(), strata, merged.size(), merged.leaves().size()));
        return merged;
    }

    public DecisionTree merge(DecisionTree first, DecisionTree second) {
        return merge(List.of(first, second));
    }

    private TreeNode mergePair(TreeNode firstRoot, TreeNode secondRoot) {
        TreeNode mergedRoot = null;
        Deque<Work> stack = new ArrayDeque<>();
        stack.push(new Work(firstRoot, secondRoot, null, Branch.ROOT));

        while (!stack.isEmpty()) {
            Work work = stack.pop();
            List<Work> children = new ArrayList<>();
            TreeNode merged = mergeNodes(work.first(), work.second(), children);
            if (work.parent() == null) {
                mergedRoot = merged;
            } else {
                work.parent().addChild(work.edge(), merged);
            }
            for (int i = children.size() - 1; i >= 0; i--) {
                Work child = children.get(i);
                stack.push(new Work(child.first(), child.second(), merged, child.edge()));
            }
        }
        return mergedRoot;
    }

    /**
     * Builds the merged node of one position and collects the work items of its children in
     * output order. Either side may be null, in which case the other side is copied.
     */
    private TreeNode mergeNodes(TreeNode first, TreeNode second, List<Work> children) {
        if (first == null || second == null) {
            TreeNode only = first != null ? first : second;
            TreeNode copy = only.shallowCopy();
            for (TreeNode child : only.children()) {
                children.add(new Work(child, null, null, child.branch()));
            }
            return copy;
        }

        TreeNode merged = new TreeNode(first.id());
        first.strata().forEach(merged::addStratum);
        second.strata().forEach(merged::addStratum);
        merged.addOrigins(first.origins());
        merged.addOrigins(second.origins());
        first.distributions().forEach(merged::putDistribution);
        second.distributions().forEach((stratum, distribution) -> {
            if (!first.distributions().containsKey(stratum)) {
                merged.putDistribution(stratum, distribution);
            }
        });
        first.terminalStrata().forEach(merged::addTerminalStratum);

        Optional<String> firstVariable = first.variable();
        Optional<String> secondVariable = second.variable();

        if (!first.isSplit() || !second.isSplit() || firstVariable.equals(secondVariable)) {
            second.terminalStrata().forEach(merged::addTerminalStratum);
            first.splits().forEach(merged::putSplit);
            second.splits().forEach((stratum, rule) -> {
                SplitRule existing = first.splits().get(stratum);
                if (existing != null && !existing.equals(rule)) {
                    throw new MergeConflictException("Stratum '" + stratum + "' splits node " + first.id()
                            + " as '" + existing.describe() + "' and '" + rule.describe() + "'", stratum.name());
                }
                merged.putSplit(stratum, rule);
            });
            pairBranch(first, second, Branch.HOLDS, children);
            pairBranch(first, second, Branch.FAILS, children);
            addAlternatives(first, children);
            addAlternatives(second, children);
            return merged;
        }

        logger.fine(String.format("Strata %s and %s split on different variables at node %d; keeping %s",
                first.splits().keySet(), second.splits().keySet(), first.id(), firstVariable.orElse("?")));
        first.splits().forEach(merged::putSplit);
        pairBranch(first, null, Branch.HOLDS, children);
        pairBranch(first, null, Branch.FAILS, children);
        addAlternatives(first, children);
        children.add(new Work(second, null, null, Branch.ALTERNATIVE));
        return merged;
    }

    private static void pairBranch(TreeNode first, TreeNode second, Branch edge, List<Work> children) {
        TreeNode left = first.child(edge).orElse(null);
        TreeNode right = second == null ? null : second.child(edge).orElse(null);
        if (left != null || right != null) {
            children.add(new Work(left, right, null, edge));
        }
    }

    private static void addAlternatives(TreeNode node, List<Work> children) {
        for (TreeNode child : node.children()) {
            if (child.branch().kind() == Branch.Kind.ALTERNATIVE) {
                children.add(new Work(child, null, null, Branch.ALTERNATIVE));
            }
        }
    }

    private void checkCompatible(List<DecisionTree> trees) {
        DecisionTree reference = trees.get(0);
        Set<String> universe = new LinkedHashSet<>(reference.variables());
        Map<String, Boolean> categorical = new LinkedHashMap<>();
        Map<String, List<String>> levels = new LinkedHashMap<>();

        for (DecisionTree tree : trees) {
            if (!universe.equals(new LinkedHashSet<>(tree.variables()))) {
                Set<String> difference = new LinkedHashSet<>(universe);
                difference.addAll(tree.variables());
                difference.removeIf(v -> universe.contains(v) && tree.variables().contains(v));
                throw new MergeConflictException("Strata " + reference.strata() + " and " + tree.strata()
                        + " declare different variables: " + difference, String.join(",", difference));
            }
            for (Map.Entry<String, List<String>> entry : tree.levels().entrySet()) {
                List<String> known = levels.putIfAbsent(entry.getKey(), entry.getValue());
                if (known != null && !known.equals(entry.getValue())) {
                    throw new MergeConflictException("Variable '" + entry.getKey() + "' has levels " + known
                            + " in one stratum and " + entry.getValue() + " in another", entry.getKey());
                }
            }
            for (TreeNode node : tree.preorder()) {
                for (SplitRule rule : node.splits().values()) {
                    Boolean known = categorical.putIfAbsent(rule.variable(), rule.isCategorical());
                    if (known != null && known != rule.isCategorical()) {
                        throw new MergeConflictException("Variable '" + rule.variable()
                                + "' is split as both numeric and categorical", rule.variable());
                    }
                }
            }
        }
    }
}
