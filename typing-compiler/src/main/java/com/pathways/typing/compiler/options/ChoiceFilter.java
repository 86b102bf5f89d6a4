/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.options;

import com.pathways.typing.api.ITreeTransform;
import com.pathways.typing.api.model.Atom;
import com.pathways.typing.api.model.Conjunction;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.MembershipAtom;
import com.pathways.typing.api.model.Question;
import com.pathways.typing.api.model.Relevance;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.api.model.TreeNode;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Offers only the choices a select question can still take given its own relevance.
 *
 * <p>When every path to a question already constrains its variable (an ancestor asked the same
 * question and split on it), choices outside the allowed levels are dropped. The question itself
 * is kept, even with no choice left.
 */
public class ChoiceFilter implements ITreeTransform {

    private static final Logger logger = Logger.getLogger(ChoiceFilter.class.getName());

    @Override
    public DecisionTree apply(DecisionTree input) {
        DecisionTree tree = input.copy();
        int restricted = 0;
        for (TreeNode node : tree.preorder()) {
            if (!node.hasQuestion() || !node.question().isSelect() || node.relevance() == null) {
                continue;
            }
            Set<String> allowed = allowedValues(node);
            if (allowed == null) {
                continue;
            }
            Question question = node.question();
            Question filtered = question.withAvailableChoices(allowed);
            if (!filtered.offeredChoices().equals(question.offeredChoices())) {
                restricted++;
            }
            node.setQuestion(filtered);
        }
        logger.fine(String.format("Restricted the choices of %d questions", restricted));
        return tree;
    }

    /**
     * Union over the paths of the values allowed on each path, or null when some path does not
     * constrain the question's variable.
     */
    private static Set<String> allowedValues(TreeNode node) {
        String variable = node.question().name();
        Set<String> allowed = new LinkedHashSet<>();
        boolean constrained = false;
        Relevance relevance = node.questionRelevance();
        for (Stratum stratum : relevance.strata()) {
            for (Conjunction path : relevance.paths(stratum)) {
                List<Atom> atoms = path.atomsOn(variable);
                Set<String> pathValues = null;
                for (Atom atom : atoms) {
                    if (atom instanceof MembershipAtom membership) {
                        if (pathValues == null) {
                            pathValues = new LinkedHashSet<>(membership.values());
                        } else {
                            pathValues.retainAll(membership.values());
                        }
                    }
                }
                if (pathValues == null) {
                    return null;
                }
                constrained = true;
                allowed.addAll(pathValues);
            }
        }
        return constrained ? allowed : null;
    }

    @Override
    public String name() {
        return "choice-filter";
    }
}
