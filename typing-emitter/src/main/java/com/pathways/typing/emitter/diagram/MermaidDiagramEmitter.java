/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.emitter.diagram;

import com.pathways.typing.api.config.ChoiceDefinition;
import com.pathways.typing.api.model.Attachment;
import com.pathways.typing.api.model.Branch;
import com.pathways.typing.api.model.ClassDistribution;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.Question;
import com.pathways.typing.api.model.SplitRule;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.api.model.TreeNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Renders a tree as a Mermaid flowchart.
 *
 * <p>All node declarations come first, then all edges, both in pre-order, so the same tree always
 * gives the same text. Split edges read {@code yes}/{@code no} unless condition labels are
 * requested or the strata split the position differently, in which case each stratum's condition
 * is listed. Alternative subtrees hang off dotted edges labelled with their strata.
 */
public class MermaidDiagramEmitter {

    private static final Logger logger = Logger.getLogger(MermaidDiagramEmitter.class.getName());

    static final String HEADER = "flowchart TD";
    private static final String INDENT = "    ";
    private static final String LINE_BREAK = "<br>";

    private final DiagramOptions options;

    public MermaidDiagramEmitter() {
        this(DiagramOptions.defaults());
    }

    public MermaidDiagramEmitter(DiagramOptions options) {
        this.options = options;
    }

    public String emit(DecisionTree tree) {
        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        List<TreeNode> order = tree.preorder();
        for (TreeNode node : order) {
            sb.append(INDENT).append(nodeId(node)).append("[\"").append(escape(label(node, tree.strata()))).append("\"]\n");
        }
        int edges = 0;
        for (TreeNode node : order) {
            for (TreeNode child : node.children()) {
                String arrow = child.branch().kind() == Branch.Kind.ALTERNATIVE ? "-.->" : "-->";
                sb.append(INDENT).append(nodeId(node)).append(' ').append(arrow)
                        .append("|\"").append(escape(edgeLabel(node, child, tree.strata()))).append("\"| ")
                        .append(nodeId(child)).append('\n');
                edges++;
            }
        }
        logger.fine(String.format("Rendered diagram with %d nodes and %d edges", order.size(), edges));
        return sb.toString();
    }

    private String label(TreeNode node, List<Stratum> strata) {
        List<String> lines = new ArrayList<>();
        if (node.isSplit()) {
            lines.add(splitLabel(node, strata));
        } else if (node.hasQuestion()) {
            lines.add(questionLabel(node.question()));
        }
        if (node.hasOutcome()) {
            lines.add(outcomeLabel(node, strata));
            if (!options.skipNotes()) {
                for (Attachment attachment : node.attachments()) {
                    if (attachment.scope() == Attachment.Scope.OUTCOME) {
                        lines.add(attachment.question().label());
                    }
                }
            }
        }
        String text = String.join(LINE_BREAK, lines);
        return options.addNodeId() ? "(" + node.id() + ") " + text : text;
    }

    private String splitLabel(TreeNode node, List<Stratum> strata) {
        if (options.useQuestionLabels() && node.hasQuestion()) {
            return node.question().label();
        }
        Set<String> rules = new LinkedHashSet<>();
        Set<String> variables = new LinkedHashSet<>();
        for (Stratum stratum : strata) {
            SplitRule rule = node.splits().get(stratum);
            if (rule != null) {
                rules.add(rule.describe());
                variables.add(rule.variable());
            }
        }
        return rules.size() == 1 ? rules.iterator().next() : String.join(" / ", variables);
    }

    private String questionLabel(Question question) {
        return options.useQuestionLabels() ? question.label() : question.name();
    }

    private static String outcomeLabel(TreeNode node, List<Stratum> strata) {
        Map<Stratum, String> classes = new LinkedHashMap<>();
        for (Stratum stratum : strata) {
            if (!node.isTerminalFor(stratum)) {
                continue;
            }
            String predicted = node.outcome() != null ? node.outcome().classFor(stratum) : null;
            if (predicted == null) {
                ClassDistribution distribution = node.distributions().get(stratum);
                predicted = distribution == null ? "?" : distribution.predictedClass();
            }
            classes.put(stratum, predicted);
        }
        Set<String> distinct = new LinkedHashSet<>(classes.values());
        if (distinct.size() == 1 && classes.keySet().equals(node.strata())) {
            return distinct.iterator().next();
        }
        List<String> parts = new ArrayList<>();
        classes.forEach((stratum, predicted) -> parts.add(stratum.name() + ": " + predicted));
        return String.join(LINE_BREAK, parts);
    }

    private String edgeLabel(TreeNode parent, TreeNode child, List<Stratum> strata) {
        Branch branch = child.branch();
        switch (branch.kind()) {
            case CHOICE:
                return choiceLabel(parent, branch.choice());
            case ALTERNATIVE:
                List<String> names = new ArrayList<>();
                for (Stratum stratum : strata) {
                    if (child.strata().contains(stratum)) {
                        names.add(stratum.name());
                    }
                }
                return String.join(", ", names);
            case HOLDS:
            case FAILS:
                return conditionLabel(parent, branch, strata);
            default:
                throw new IllegalStateException("Node " + child.id() + " hangs from a " + branch + " edge");
        }
    }

    private String conditionLabel(TreeNode parent, Branch branch, List<Stratum> strata) {
        Map<Stratum, String> conditions = new LinkedHashMap<>();
        Set<SplitRule> rules = new LinkedHashSet<>();
        for (Stratum stratum : strata) {
            SplitRule rule = parent.splits().get(stratum);
            if (rule != null) {
                conditions.put(stratum, rule.atomFor(branch, parent.id()).describe());
                rules.add(rule);
            }
        }
        if (rules.size() == 1 && !options.addChoiceLabels()) {
            return branch.kind() == Branch.Kind.HOLDS ? "yes" : "no";
        }
        Set<String> distinct = new LinkedHashSet<>(conditions.values());
        if (distinct.size() == 1) {
            return distinct.iterator().next();
        }
        List<String> parts = new ArrayList<>();
        conditions.forEach((stratum, condition) -> parts.add(stratum.name() + ": " + condition));
        return String.join(LINE_BREAK, parts);
    }

    private String choiceLabel(TreeNode parent, String value) {
        if (options.addChoiceLabels() && parent.hasQuestion()) {
            for (ChoiceDefinition choice : parent.question().choices()) {
                if (choice.value().equals(value)) {
                    return choice.label();
                }
            }
        }
        return value;
    }

    private static String nodeId(TreeNode node) {
        return "n" + node.id();
    }

    static String escape(String text) {
        return text.replace("\"", "#quot;");
    }
}
