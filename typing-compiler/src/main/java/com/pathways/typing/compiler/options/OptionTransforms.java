/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.options;

import com.pathways.typing.api.ITreeTransform;
import com.pathways.typing.api.config.CalculateOption;
import com.pathways.typing.api.config.FormConfiguration;
import com.pathways.typing.api.config.HideOption;
import com.pathways.typing.api.config.OptionDefinition;
import com.pathways.typing.api.config.SplitOption;
import com.pathways.typing.api.exceptions.ConfigReferenceException;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.TreeNode;
import com.pathways.typing.compiler.relevance.RelevanceCompiler;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds tree transforms from configured options.
 */
public final class OptionTransforms {

    private OptionTransforms() {
    }

    public static ITreeTransform of(OptionDefinition option, FormConfiguration configuration,
                                    RelevanceCompiler relevanceCompiler) {
        if (option instanceof SplitOption split) {
            return new SplitTransform(split, configuration, relevanceCompiler);
        }
        if (option instanceof CalculateOption calculate) {
            return new CalculateTransform(calculate);
        }
        if (option instanceof HideOption hide) {
            return new HideTransform(hide);
        }
        throw new IllegalArgumentException("Unsupported option kind: " + option.kind());
    }

    /**
     * Structural options in configuration order; hide options are applied separately, after
     * duplicate questions are collapsed.
     */
    public static List<ITreeTransform> structural(FormConfiguration configuration, RelevanceCompiler relevanceCompiler) {
        List<ITreeTransform> transforms = new ArrayList<>();
        for (OptionDefinition option : configuration.options()) {
            if (!(option instanceof HideOption)) {
                transforms.add(of(option, configuration, relevanceCompiler));
            }
        }
        return transforms;
    }

    public static List<ITreeTransform> hiding(FormConfiguration configuration) {
        List<ITreeTransform> transforms = new ArrayList<>();
        for (OptionDefinition option : configuration.options()) {
            if (option instanceof HideOption hide) {
                transforms.add(new HideTransform(hide));
            }
        }
        return transforms;
    }

    /**
     * Nodes bound to {@code question}, in pre-order, including collapsed duplicates.
     *
     * @throws ConfigReferenceException when the tree never asks the question
     */
    static List<TreeNode> boundTo(DecisionTree tree, String question, String optionKind) {
        List<TreeNode> nodes = new ArrayList<>();
        for (TreeNode node : tree.preorder()) {
            if (node.hasQuestion() && node.question().name().equals(question)) {
                nodes.add(node);
            }
        }
        if (nodes.isEmpty()) {
            throw new ConfigReferenceException(
                    optionKind + " option references question '" + question + "' which the tree never asks", question);
        }
        return nodes;
    }
}
