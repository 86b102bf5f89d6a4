/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.options;

import com.pathways.typing.api.ITreeTransform;
import com.pathways.typing.api.config.FormConfiguration;
import com.pathways.typing.api.config.QuestionDefinition;
import com.pathways.typing.api.exceptions.ConfigReferenceException;
import com.pathways.typing.api.model.ClassDistribution;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.Outcome;
import com.pathways.typing.api.model.Question;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.api.model.TreeNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Binds the configured question of each split variable to the nodes splitting on it, and the
 * predicted class of each ending stratum to an outcome.
 */
public class QuestionBinder implements ITreeTransform {

    private static final Logger logger = Logger.getLogger(QuestionBinder.class.getName());

    private final FormConfiguration configuration;

    public QuestionBinder(FormConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * @throws ConfigReferenceException when a split variable has no configured question, or the
     *                                  strata of one node split on different variables
     */
    @Override
    public DecisionTree apply(DecisionTree input) {
        DecisionTree tree = input.copy();
        int questions = 0;
        int outcomes = 0;
        for (TreeNode node : tree.preorder()) {
            if (node.isSplit()) {
                String variable = node.variable().orElseThrow(() -> new ConfigReferenceException(
                        "Node " + node.id() + " splits on several variables: " + node.splits(),
                        String.valueOf(node.id())));
                QuestionDefinition definition = configuration.requireQuestion(variable);
                node.setQuestion(Question.of(definition, configuration.choices(definition.name())));
                questions++;
            }
            if (node.hasOutcome()) {
                Map<Stratum, String> classes = new LinkedHashMap<>();
                for (Stratum stratum : node.terminalStrata()) {
                    ClassDistribution distribution = node.distributions().get(stratum);
                    if (distribution == null) {
                        throw new IllegalStateException("Node " + node.id() + " ends stratum " + stratum
                                + " without a class distribution");
                    }
                    classes.put(stratum, distribution.predictedClass());
                }
                node.setOutcome(new Outcome(classes));
                outcomes++;
            }
        }
        logger.fine(String.format("Bound %d questions and %d outcomes", questions, outcomes));
        return tree;
    }
}
