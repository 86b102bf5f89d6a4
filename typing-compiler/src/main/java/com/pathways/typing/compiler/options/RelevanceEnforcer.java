/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.options;

import com.pathways.typing.api.ITreeTransform;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.Relevance;
import com.pathways.typing.api.model.TreeNode;

/**
 * Normalizes every relevance to the form the emitter writes: contradictory and redundant
 * conjunctions removed, and no stratum that cannot reach the parent. Idempotent.
 */
public class RelevanceEnforcer implements ITreeTransform {

    @Override
    public DecisionTree apply(DecisionTree input) {
        DecisionTree tree = input.copy();
        for (TreeNode node : tree.preorder()) {
            if (node.relevance() == null) {
                throw new IllegalStateException("Relevance of node " + node.id() + " has not been compiled");
            }
            Relevance enforced = node.relevance().normalize();
            if (node.parent() != null) {
                enforced = enforced.restrictTo(node.parent().relevance().strata());
            }
            node.setRelevance(enforced);
            if (node.hasQuestionRelevanceOverride()) {
                node.setQuestionRelevance(node.questionRelevance().normalize());
            }
        }
        return tree;
    }

    @Override
    public String name() {
        return "enforce-relevance";
    }
}
