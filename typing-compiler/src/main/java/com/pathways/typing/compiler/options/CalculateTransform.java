/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.options;

import com.pathways.typing.api.ITreeTransform;
import com.pathways.typing.api.config.CalculateOption;
import com.pathways.typing.api.model.Attachment;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.Question;
import com.pathways.typing.api.model.TreeNode;

import java.util.List;

/**
 * Attaches a calculated field to every occurrence of a question. The tree structure is left
 * untouched; the {@code ${src_question}} placeholder is resolved when the form is emitted.
 */
public class CalculateTransform implements ITreeTransform {

    private final CalculateOption option;

    public CalculateTransform(CalculateOption option) {
        this.option = option;
    }

    @Override
    public DecisionTree apply(DecisionTree input) {
        DecisionTree tree = input.copy();
        List<TreeNode> targets = OptionTransforms.boundTo(tree, option.question(), CalculateOption.KIND);
        Question field = Question.calculate(option.name(), option.calculation());
        for (TreeNode node : targets) {
            node.addAttachment(new Attachment(field, Attachment.Scope.QUESTION));
        }
        return tree;
    }

    @Override
    public String name() {
        return "calculate(" + option.name() + ")";
    }
}
