/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.optimization;

import com.pathways.typing.api.ITreeTransform;
import com.pathways.typing.api.config.QuestionType;
import com.pathways.typing.api.exceptions.DuplicateResolutionException;
import com.pathways.typing.api.model.Attachment;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.Question;
import com.pathways.typing.api.model.Relevance;
import com.pathways.typing.api.model.TreeNode;
import com.pathways.typing.compiler.analysis.OutcomeAnalyzer;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Collapses occurrences of the same question in different branches into one occurrence.
 *
 * <p>Occurrences are grouped by (question name, type, choice values). The first occurrence in
 * pre-order becomes canonical:
 * <ul>
 *   <li>its question relevance becomes the OR of the group's question relevance; the
 *       relevance of the position itself, which also governs its outcomes, is unchanged</li>
 *   <li>its offered choices become the union of the group's</li>
 *   <li>the other occurrences are marked as duplicates of it and recorded as its aliases</li>
 *   <li>every relevance atom reading a duplicate reads the canonical occurrence instead</li>
 * </ul>
 * An occurrence nested below another member of its group adds nothing to the OR, since its
 * relevance implies the ancestor's.
 *
 * <p>The set of reachable (stratum, segment) outcomes must be the same before and after;
 * {@link DuplicateResolutionException} is thrown otherwise, when members of a group
 * disagree on hidden state or calculated fields, and when the merged relevance reads a field
 * asked after the canonical occurrence.
 */
public class DuplicateQuestionCollapser implements ITreeTransform {

    private static final Logger logger = Logger.getLogger(DuplicateQuestionCollapser.class.getName());

    private final OutcomeAnalyzer outcomeAnalyzer;

    public DuplicateQuestionCollapser() {
        this(new OutcomeAnalyzer());
    }

    public DuplicateQuestionCollapser(OutcomeAnalyzer outcomeAnalyzer) {
        this.outcomeAnalyzer = outcomeAnalyzer;
    }

    private record GroupKey(String name, QuestionType type, List<String> choices) {
    }

    @Override
    public DecisionTree apply(DecisionTree input) {
        DecisionTree tree = input.copy();
        Set<OutcomeAnalyzer.ReachableOutcome> before = outcomeAnalyzer.analyze(tree).reachable();

        Map<GroupKey, List<TreeNode>> groups = new LinkedHashMap<>();
        for (TreeNode node : tree.questionNodes()) {
            Question question = node.question();
            if (question.type() == QuestionType.CALCULATE || question.type() == QuestionType.NOTE) {
                continue;
            }
            GroupKey key = new GroupKey(question.name(), question.type(), question.choiceValues());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(node);
        }

        int collapsedGroups = 0;
        int collapsedNodes = 0;
        for (Map.Entry<GroupKey, List<TreeNode>> entry : groups.entrySet()) {
            List<TreeNode> members = entry.getValue();
            if (members.size() < 2) {
                continue;
            }
            collapse(tree, members);
            collapsedGroups++;
            collapsedNodes += members.size() - 1;
        }

        Set<OutcomeAnalyzer.ReachableOutcome> after = outcomeAnalyzer.analyze(tree).reachable();
        if (!before.equals(after)) {
            throw new DuplicateResolutionException("Collapsing duplicate questions changes reachable outcomes from "
                    + before + " to " + after, "outcomes");
        }
        logger.fine(String.format("Collapsed %d duplicate question groups (%d occurrences removed)",
                collapsedGroups, collapsedNodes));
        return tree;
    }

    private static void collapse(DecisionTree tree, List<TreeNode> members) {
        TreeNode canonical = members.get(0);
        Relevance relevance = canonical.questionRelevance();
        Question question = canonical.question();

        for (TreeNode member : members.subList(1, members.size())) {
            checkAgreement(canonical, member);
            if (!hasAncestorIn(member, members)) {
                relevance = relevance.or(member.questionRelevance());
            }
            question = question.widenAvailableChoices(member.question());
        }
        relevance = relevance.normalize();
        checkAskedBefore(tree, canonical, relevance, members);

        for (TreeNode member : members.subList(1, members.size())) {
            canonical.addAlias(member.id());
            member.setDuplicateOf(canonical.id());
        }
        canonical.setQuestionRelevance(relevance);
        canonical.setQuestion(question);

        for (TreeNode member : members.subList(1, members.size())) {
            for (TreeNode node : tree.preorder()) {
                if (node.relevance() != null) {
                    node.setRelevance(node.relevance().rewriteSource(member.id(), canonical.id()));
                }
                if (node.hasQuestionRelevanceOverride()) {
                    node.setQuestionRelevance(node.questionRelevance().rewriteSource(member.id(), canonical.id()));
                }
            }
        }
        logger.fine(String.format("Question '%s' at nodes %s collapsed into node %d",
                question.name(), members.stream().map(TreeNode::id).toList(), canonical.id()));
    }

    /**
     * The canonical occurrence keeps its position, so every field its merged relevance reads must
     * be asked before it.
     */
    private static void checkAskedBefore(DecisionTree tree, TreeNode canonical, Relevance relevance,
                                         List<TreeNode> members) {
        Int2IntMap positions = new Int2IntOpenHashMap();
        int position = 0;
        for (TreeNode node : tree.preorder()) {
            positions.put(node.id(), position++);
        }
        int canonicalPosition = positions.get(canonical.id());
        for (int source : relevance.references()) {
            if (positions.get(source) >= canonicalPosition) {
                String name = canonical.question().name();
                throw new DuplicateResolutionException("Occurrences " + members.stream().map(TreeNode::id).toList()
                        + " of question '" + name + "' cannot be merged: the merged relevance reads node " + source
                        + ", which is asked after node " + canonical.id(), name);
            }
        }
    }

    private static boolean hasAncestorIn(TreeNode node, List<TreeNode> members) {
        for (TreeNode current = node.parent(); current != null; current = current.parent()) {
            if (members.contains(current)) {
                return true;
            }
        }
        return false;
    }

    private static void checkAgreement(TreeNode canonical, TreeNode member) {
        Question a = canonical.question();
        Question b = member.question();
        String problem = null;
        if (a.hidden() != b.hidden() || !Objects.equals(a.pinnedValue(), b.pinnedValue())) {
            problem = "hidden state";
        } else if (!a.hiddenChoices().equals(b.hiddenChoices())) {
            problem = "hidden choices";
        } else if (!questionAttachments(canonical).equals(questionAttachments(member))) {
            problem = "calculated fields";
        }
        if (problem != null) {
            throw new DuplicateResolutionException("Occurrences " + canonical.id() + " and " + member.id()
                    + " of question '" + a.name() + "' disagree on " + problem, a.name());
        }
    }

    private static List<Attachment> questionAttachments(TreeNode node) {
        return node.attachments().stream()
                .filter(a -> a.scope() == Attachment.Scope.QUESTION)
                .toList();
    }

    @Override
    public String name() {
        return "deduplicate-questions";
    }
}
