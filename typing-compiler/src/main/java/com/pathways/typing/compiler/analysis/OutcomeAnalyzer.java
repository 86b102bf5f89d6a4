/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.analysis;

import com.pathways.typing.api.model.Conjunction;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.api.model.TreeNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Determines which (stratum, segment) outcomes a compiled tree can still produce.
 *
 * <p>An outcome is reachable when its position has a satisfiable relevance path for the stratum
 * and every question that path reads is itself reachable for that stratum.
 *
 * <h2>Usage</h2>
 * <pre>
 * OutcomeAnalyzer analyzer = new OutcomeAnalyzer();
 * OutcomeReport before = analyzer.analyze(tree);
 * OutcomeReport after = analyzer.analyze(collapsed);
 * if (!before.reachable().equals(after.reachable())) { ... }
 * </pre>
 */
public class OutcomeAnalyzer {

    public OutcomeReport analyze(DecisionTree tree) {
        Set<ReachableOutcome> reachable = new LinkedHashSet<>();
        List<ReachableOutcome> unreachable = new ArrayList<>();
        for (TreeNode node : tree.leaves()) {
            for (Stratum stratum : node.terminalStrata()) {
                ReachableOutcome outcome = new ReachableOutcome(stratum,
                        node.distributions().get(stratum).predictedClass());
                if (isReachable(tree, node, stratum)) {
                    reachable.add(outcome);
                } else {
                    unreachable.add(outcome);
                }
            }
        }
        return new OutcomeReport(reachable, unreachable);
    }

    private static boolean isReachable(DecisionTree tree, TreeNode node, Stratum stratum) {
        if (node.relevance() == null) {
            return true;
        }
        for (Conjunction path : node.relevance().paths(stratum)) {
            if (!path.isSatisfiable()) {
                continue;
            }
            boolean sourcesAsked = path.atoms().stream().allMatch(atom -> {
                TreeNode source = tree.node(atom.sourceNodeId());
                return source != null && !source.isDuplicate() && source.questionRelevance() != null
                        && !source.questionRelevance().paths(stratum).isEmpty();
            });
            if (sourcesAsked) {
                return true;
            }
        }
        return false;
    }

    /**
     * A segment a stratum can end in.
     */
    public record ReachableOutcome(Stratum stratum, String segment) {
        @Override
        public String toString() {
            return stratum + ":" + segment;
        }
    }

    /**
     * Result of an outcome analysis.
     *
     * @param reachable distinct reachable outcomes in pre-order of first appearance
     * @param unreachable leaf outcomes whose every path is contradictory or reads a question
     *                    that is never asked
     */
    public record OutcomeReport(Set<ReachableOutcome> reachable, List<ReachableOutcome> unreachable) {
        public OutcomeReport {
            reachable = Set.copyOf(reachable);
            unreachable = List.copyOf(unreachable);
        }
    }
}
