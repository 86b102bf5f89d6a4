/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.analysis;

import com.pathways.typing.api.config.FormConfiguration;
import com.pathways.typing.api.config.QuestionDefinition;
import com.pathways.typing.api.exceptions.ConfigReferenceException;
import com.pathways.typing.api.model.CategoricalSplit;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.SplitRule;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.api.model.TreeNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Checks a form configuration against the stratum trees it will be compiled with.
 *
 * <p>For every variable a tree splits on:
 * <ul>
 *   <li>a question with the variable's name must be configured</li>
 *   <li>a categorical variable must be asked as a select question whose choices cover every
 *       level the tree routes</li>
 *   <li>a numeric variable must be asked as an integer or decimal question</li>
 * </ul>
 * The configuration's own cross references are checked first.
 */
public class ConfigurationValidator {

    private static final Logger logger = Logger.getLogger(ConfigurationValidator.class.getName());

    public ValidationReport validate(FormConfiguration configuration, List<DecisionTree> trees) {
        configuration.validate();
        List<Problem> problems = new ArrayList<>();
        Set<String> checked = new LinkedHashSet<>();

        for (DecisionTree tree : trees) {
            for (TreeNode node : tree.preorder()) {
                for (Map.Entry<Stratum, SplitRule> entry : node.splits().entrySet()) {
                    SplitRule rule = entry.getValue();
                    String key = entry.getKey() + "/" + rule.variable() + "/" + rule;
                    if (checked.add(key)) {
                        check(configuration, entry.getKey(), rule, problems);
                    }
                }
            }
        }
        if (problems.isEmpty()) {
            logger.info(String.format("Configuration is consistent with %d trees", trees.size()));
        } else {
            problems.forEach(p -> logger.warning(p.toString()));
        }
        return new ValidationReport(problems);
    }

    private static void check(FormConfiguration configuration, Stratum stratum, SplitRule rule, List<Problem> problems) {
        String variable = rule.variable();
        QuestionDefinition definition = configuration.question(variable).orElse(null);
        if (definition == null) {
            problems.add(new Problem(stratum, variable, "no question configured"));
            return;
        }
        if (rule instanceof CategoricalSplit categorical) {
            if (!definition.type().isSelect()) {
                problems.add(new Problem(stratum, variable,
                        "categorical split but question type is " + definition.type().formName()));
                return;
            }
            List<String> values = configuration.choiceValues(definition.name());
            Set<String> missing = new LinkedHashSet<>(categorical.left());
            missing.addAll(categorical.right());
            missing.removeAll(values);
            if (!missing.isEmpty()) {
                problems.add(new Problem(stratum, variable, "levels without a choice: " + missing));
            }
        } else if (!definition.type().isNumeric()) {
            problems.add(new Problem(stratum, variable,
                    "numeric split but question type is " + definition.type().formName()));
        }
    }

    /**
     * One inconsistency between a tree and the configuration.
     */
    public record Problem(Stratum stratum, String variable, String message) {
        @Override
        public String toString() {
            return stratum + ": '" + variable + "': " + message;
        }
    }

    public record ValidationReport(List<Problem> problems) {
        public ValidationReport {
            problems = List.copyOf(problems);
        }

        public boolean isValid() {
            return problems.isEmpty();
        }

        /**
         * @throws ConfigReferenceException naming the variable of the first problem
         */
        public void requireValid() {
            if (!problems.isEmpty()) {
                Problem first = problems.get(0);
                throw new ConfigReferenceException("Invalid configuration: " + first
                        + (problems.size() > 1 ? " (and " + (problems.size() - 1) + " more)" : ""), first.variable());
            }
        }
    }
}
