/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.options;

import com.pathways.typing.api.ITreeTransform;
import com.pathways.typing.api.config.ChoiceDefinition;
import com.pathways.typing.api.config.FormConfiguration;
import com.pathways.typing.api.config.QuestionDefinition;
import com.pathways.typing.api.config.SplitOption;
import com.pathways.typing.api.model.Branch;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.Question;
import com.pathways.typing.api.model.TreeNode;
import com.pathways.typing.compiler.relevance.RelevanceCompiler;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Asks a single-choice question in front of every occurrence of a question and repeats the
 * occurrence's subtree once per choice.
 *
 * <p>The occurrence is replaced by a choice node bound to the split question. Each choice gets a
 * deep copy of the original subtree under a {@link Branch.Kind#CHOICE} edge; when the option
 * maps the choice to another question, the copy's root asks that question instead. Nested
 * occurrences are expanded first, so every copy is fully expanded. Relevance is recompiled.
 */
public class SplitTransform implements ITreeTransform {

    private static final Logger logger = Logger.getLogger(SplitTransform.class.getName());

    private final SplitOption option;
    private final FormConfiguration configuration;
    private final RelevanceCompiler relevanceCompiler;

    public SplitTransform(SplitOption option, FormConfiguration configuration, RelevanceCompiler relevanceCompiler) {
        this.option = option;
        this.configuration = configuration;
        this.relevanceCompiler = relevanceCompiler;
    }

    @Override
    public DecisionTree apply(DecisionTree input) {
        DecisionTree tree = input.copy();
        QuestionDefinition splitDefinition = configuration.requireQuestion(option.splitQuestion());
        List<ChoiceDefinition> choices = configuration.choices(splitDefinition.name());
        Question splitQuestion = Question.of(splitDefinition, choices);
        Map<String, String> rebinding = option.questionsByChoice();
        for (String rebound : rebinding.values()) {
            configuration.requireQuestion(rebound);
        }

        List<TreeNode> targets = OptionTransforms.boundTo(tree, option.question(), SplitOption.KIND);
        TreeNode root = tree.root();
        int nextId = tree.nextId();

        for (int t = targets.size() - 1; t >= 0; t--) {
            TreeNode target = targets.get(t);
            TreeNode choiceNode = new TreeNode(nextId++);
            target.strata().forEach(choiceNode::addStratum);
            choiceNode.addOrigins(target.origins());
            choiceNode.setQuestion(splitQuestion);

            for (ChoiceDefinition choice : choices) {
                TreeNode copy = target.deepCopy();
                nextId = DecisionTree.assignIds(copy, nextId);
                String replacement = rebinding.get(choice.value());
                if (replacement != null && copy.hasQuestion()) {
                    QuestionDefinition definition = configuration.requireQuestion(replacement);
                    copy.setQuestion(Question.of(definition, configuration.choices(definition.name())));
                }
                choiceNode.addChild(Branch.choice(choice.value()), copy);
            }

            if (target.parent() == null) {
                root = choiceNode;
            } else {
                target.parent().replaceChild(target, choiceNode);
            }
        }

        DecisionTree expanded = new DecisionTree(root, tree.strata(), tree.variables(), tree.levels());
        expanded.renumber();
        logger.fine(String.format("Split %d occurrences of '%s' on '%s' (%d choices): %d -> %d nodes",
                targets.size(), option.question(), option.splitQuestion(), choices.size(), input.size(),
                expanded.size()));
        return relevanceCompiler.apply(expanded);
    }

    @Override
    public String name() {
        return "split(" + option.question() + " by " + option.splitQuestion() + ")";
    }
}
