/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.options;

import com.pathways.typing.api.ITreeTransform;
import com.pathways.typing.api.config.HideOption;
import com.pathways.typing.api.exceptions.ConfigReferenceException;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.TreeNode;

/**
 * Hides one choice of a question, or the whole question.
 *
 * <p>A hidden question stays in the tree so that relevance reading its answer still evaluates;
 * the form carries it as a calculated field pinned to the configured value.
 */
public class HideTransform implements ITreeTransform {

    private final HideOption option;

    public HideTransform(HideOption option) {
        this.option = option;
    }

    @Override
    public DecisionTree apply(DecisionTree input) {
        DecisionTree tree = input.copy();
        for (TreeNode node : OptionTransforms.boundTo(tree, option.question(), HideOption.KIND)) {
            if (option.hidesChoice()) {
                if (!node.question().choiceValues().contains(option.choice())) {
                    throw new ConfigReferenceException("hide option references unknown choice '" + option.choice()
                            + "' of '" + option.question() + "'", option.question() + ":" + option.choice());
                }
                node.setQuestion(node.question().withHiddenChoice(option.choice()));
            } else {
                node.setQuestion(node.question().hiddenAs(option.value() == null ? "" : option.value()));
            }
        }
        return tree;
    }

    @Override
    public String name() {
        return option.hidesChoice() ? "hide(" + option.question() + ":" + option.choice() + ")"
                : "hide(" + option.question() + ")";
    }
}
