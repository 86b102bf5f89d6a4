/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.relevance;

import com.pathways.typing.api.ITreeTransform;
import com.pathways.typing.api.model.Atom;
import com.pathways.typing.api.model.Branch;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.MembershipAtom;
import com.pathways.typing.api.model.Relevance;
import com.pathways.typing.api.model.SplitRule;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.api.model.TreeNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Annotates every node with the conjunction of the branch conditions on its path.
 *
 * <p>The root is always relevant. A {@link Branch#HOLDS} or {@link Branch#FAILS} edge adds the
 * parent's rule (or its negation) for each stratum that splits at the parent; a
 * {@link Branch.Kind#CHOICE} edge adds "the parent's question was answered with this choice"
 * for every stratum; an {@link Branch#ALTERNATIVE} edge only narrows the strata. A second test
 * of the same variable on one path replaces the earlier one (see
 * {@link com.pathways.typing.api.model.Conjunction#and(Atom)}).
 */
public class RelevanceCompiler implements ITreeTransform {

    private static final Logger logger = Logger.getLogger(RelevanceCompiler.class.getName());

    @Override
    public DecisionTree apply(DecisionTree input) {
        DecisionTree tree = input.copy();
        TreeNode root = tree.root();
        root.setRelevance(Relevance.always(tree.strata()).restrictTo(root.strata()));
        root.setQuestionRelevance(null);

        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        int atoms = 0;
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            List<TreeNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                TreeNode child = children.get(i);
                child.setRelevance(childRelevance(node, child));
                child.setQuestionRelevance(null);
                atoms += child.branch().kind() == Branch.Kind.ALTERNATIVE ? 0 : 1;
                stack.push(child);
            }
        }
        logger.fine(String.format("Compiled relevance of %d nodes (%d edge conditions)", tree.size(), atoms));
        return tree;
    }

    private static Relevance childRelevance(TreeNode parent, TreeNode child) {
        Relevance inherited = parent.relevance().restrictTo(child.strata());
        Branch edge = child.branch();
        return switch (edge.kind()) {
            case HOLDS, FAILS -> {
                Map<Stratum, Atom> atoms = new LinkedHashMap<>();
                for (Map.Entry<Stratum, SplitRule> entry : parent.splits().entrySet()) {
                    atoms.put(entry.getKey(), entry.getValue().atomFor(edge, parent.id()));
                }
                yield inherited.and(atoms);
            }
            case CHOICE -> {
                if (!parent.hasQuestion()) {
                    throw new IllegalStateException("Choice node " + parent.id() + " has no question");
                }
                yield inherited.andAll(new MembershipAtom(parent.id(), parent.question().name(), List.of(edge.choice())));
            }
            case ALTERNATIVE -> inherited;
            case ROOT -> throw new IllegalStateException("Node " + child.id() + " is attached as a root");
        };
    }
}
