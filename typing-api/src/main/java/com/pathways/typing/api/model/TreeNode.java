/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntUnaryOperator;

/**
 * One position of a (possibly merged) decision tree.
 *
 * <p>A position is reached by {@link #strata()}. Strata listed in {@link #splits()} ask a
 * question here and continue into the {@link Branch#HOLDS}/{@link Branch#FAILS} children;
 * strata listed in {@link #terminalStrata()} end here. Nodes created by a split option have
 * no split rules and one {@link Branch.Kind#CHOICE} child per choice.
 *
 * <p>Nodes are owned by exactly one {@link DecisionTree}; transforms work on a
 * {@link DecisionTree#copy() copy}.
 */
public final class TreeNode {

    private int id;
    private Branch branch = Branch.ROOT;
    private TreeNode parent;
    private final Set<Stratum> strata = new LinkedHashSet<>();
    private final Map<Stratum, SplitRule> splits = new LinkedHashMap<>();
    private final Map<Stratum, ClassDistribution> distributions = new LinkedHashMap<>();
    private final Set<Stratum> terminalStrata = new LinkedHashSet<>();
    private final List<Origin> origins = new ArrayList<>();
    private final List<TreeNode> children = new ArrayList<>();
    private final List<Attachment> attachments = new ArrayList<>();
    private final IntList aliases = new IntArrayList();
    private Relevance relevance;
    private Relevance questionRelevance;
    private Question question;
    private Outcome outcome;
    private int duplicateOf;

    public TreeNode(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public void setId(int id) {
        this.id = id;
    }

    /**
     * Edge from the parent to this node; {@link Branch#ROOT} for a detached node.
     */
    public Branch branch() {
        return branch;
    }

    public TreeNode parent() {
        return parent;
    }

    public Set<Stratum> strata() {
        return Collections.unmodifiableSet(strata);
    }

    public void addStratum(Stratum stratum) {
        strata.add(Objects.requireNonNull(stratum));
    }

    public void retainStrata(Collection<Stratum> kept) {
        strata.retainAll(kept);
        splits.keySet().retainAll(kept);
        terminalStrata.retainAll(kept);
    }

    public Map<Stratum, SplitRule> splits() {
        return Collections.unmodifiableMap(splits);
    }

    public void putSplit(Stratum stratum, SplitRule rule) {
        strata.add(stratum);
        splits.put(stratum, Objects.requireNonNull(rule));
    }

    public void clearSplits() {
        splits.clear();
    }

    public boolean isSplit() {
        return !splits.isEmpty();
    }

    /**
     * Variable tested here, when every splitting stratum tests the same one.
     */
    public Optional<String> variable() {
        Set<String> variables = new LinkedHashSet<>();
        for (SplitRule rule : splits.values()) {
            variables.add(rule.variable());
        }
        return variables.size() == 1 ? Optional.of(variables.iterator().next()) : Optional.empty();
    }

    public Map<Stratum, ClassDistribution> distributions() {
        return Collections.unmodifiableMap(distributions);
    }

    public void putDistribution(Stratum stratum, ClassDistribution distribution) {
        distributions.put(stratum, Objects.requireNonNull(distribution));
    }

    public Set<Stratum> terminalStrata() {
        return Collections.unmodifiableSet(terminalStrata);
    }

    public void addTerminalStratum(Stratum stratum) {
        strata.add(stratum);
        terminalStrata.add(stratum);
    }

    public boolean isTerminalFor(Stratum stratum) {
        return terminalStrata.contains(stratum);
    }

    public boolean hasOutcome() {
        return !terminalStrata.isEmpty();
    }

    /**
     * Strata for which the bound question is asked at this position.
     */
    public Set<Stratum> questionStrata() {
        if (splits.isEmpty()) {
            Set<Stratum> asking = new LinkedHashSet<>(strata);
            asking.removeAll(terminalStrata);
            return Collections.unmodifiableSet(asking);
        }
        return Collections.unmodifiableSet(splits.keySet());
    }

    public List<Origin> origins() {
        return Collections.unmodifiableList(origins);
    }

    public void addOrigin(Origin origin) {
        origins.add(Objects.requireNonNull(origin));
    }

    public void addOrigins(Collection<Origin> added) {
        origins.addAll(added);
    }

    public List<TreeNode> children() {
        return Collections.unmodifiableList(children);
    }

    public TreeNode addChild(Branch edge, TreeNode child) {
        attach(edge, child);
        children.add(child);
        return child;
    }

    public void replaceChild(TreeNode existing, TreeNode replacement) {
        int index = children.indexOf(existing);
        if (index < 0) {
            throw new IllegalArgumentException("Node " + existing.id + " is not a child of " + id);
        }
        attach(existing.branch, replacement);
        children.set(index, replacement);
        existing.parent = null;
    }

    public void clearChildren() {
        for (TreeNode child : children) {
            child.parent = null;
        }
        children.clear();
    }

    private void attach(Branch edge, TreeNode child) {
        if (child.parent != null) {
            throw new IllegalStateException("Node " + child.id + " already belongs to node " + child.parent.id);
        }
        child.parent = this;
        child.branch = Objects.requireNonNull(edge);
    }

    public Optional<TreeNode> child(Branch edge) {
        for (TreeNode child : children) {
            if (child.branch.equals(edge)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public Optional<TreeNode> left() {
        return child(Branch.HOLDS);
    }

    public Optional<TreeNode> right() {
        return child(Branch.FAILS);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public Relevance relevance() {
        return relevance;
    }

    public void setRelevance(Relevance relevance) {
        this.relevance = relevance;
    }

    /**
     * Condition under which the bound question is shown: the node's relevance restricted to
     * {@link #questionStrata()}, unless an explicit condition was set (e.g. the OR of collapsed
     * duplicate occurrences).
     */
    public Relevance questionRelevance() {
        if (questionRelevance != null) {
            return questionRelevance;
        }
        return relevance == null ? null : relevance.restrictTo(questionStrata());
    }

    public boolean hasQuestionRelevanceOverride() {
        return questionRelevance != null;
    }

    public void setQuestionRelevance(Relevance questionRelevance) {
        this.questionRelevance = questionRelevance;
    }

    public Question question() {
        return question;
    }

    public void setQuestion(Question question) {
        this.question = question;
    }

    public boolean hasQuestion() {
        return question != null;
    }

    public Outcome outcome() {
        return outcome;
    }

    public void setOutcome(Outcome outcome) {
        this.outcome = outcome;
    }

    public List<Attachment> attachments() {
        return Collections.unmodifiableList(attachments);
    }

    public void addAttachment(Attachment attachment) {
        attachments.add(Objects.requireNonNull(attachment));
    }

    public void clearAttachments() {
        attachments.clear();
    }

    /**
     * Id of the canonical occurrence this node was collapsed into, or 0.
     */
    public int duplicateOf() {
        return duplicateOf;
    }

    public void setDuplicateOf(int canonicalId) {
        this.duplicateOf = canonicalId;
    }

    public boolean isDuplicate() {
        return duplicateOf != 0;
    }

    public IntList aliases() {
        return IntLists.unmodifiable(aliases);
    }

    public void addAlias(int nodeId) {
        if (!aliases.contains(nodeId)) {
            aliases.add(nodeId);
        }
    }

    void remapIds(IntUnaryOperator mapping) {
        id = mapping.applyAsInt(id);
        if (duplicateOf != 0) {
            duplicateOf = mapping.applyAsInt(duplicateOf);
        }
        for (int i = 0; i < aliases.size(); i++) {
            aliases.set(i, mapping.applyAsInt(aliases.getInt(i)));
        }
        if (relevance != null) {
            relevance = relevance.remapSources(mapping);
        }
        if (questionRelevance != null) {
            questionRelevance = questionRelevance.remapSources(mapping);
        }
    }

    /**
     * Copy of this node without its children or parent link.
     */
    public TreeNode shallowCopy() {
        TreeNode copy = new TreeNode(id);
        copy.strata.addAll(strata);
        copy.splits.putAll(splits);
        copy.distributions.putAll(distributions);
        copy.terminalStrata.addAll(terminalStrata);
        copy.origins.addAll(origins);
        copy.attachments.addAll(attachments);
        copy.aliases.addAll(aliases);
        copy.relevance = relevance;
        copy.questionRelevance = questionRelevance;
        copy.question = question;
        copy.outcome = outcome;
        copy.duplicateOf = duplicateOf;
        return copy;
    }

    /**
     * Detached deep copy of the subtree rooted here. Ids are kept; the caller renumbers.
     */
    public TreeNode deepCopy() {
        TreeNode rootCopy = shallowCopy();
        Deque<TreeNode[]> stack = new ArrayDeque<>();
        stack.push(new TreeNode[]{this, rootCopy});
        while (!stack.isEmpty()) {
            TreeNode[] pair = stack.pop();
            for (TreeNode child : pair[0].children) {
                TreeNode childCopy = child.shallowCopy();
                pair[1].addChild(child.branch, childCopy);
                stack.push(new TreeNode[]{child, childCopy});
            }
        }
        return rootCopy;
    }

    @Override
    public String toString() {
        return "TreeNode{id=" + id + ", branch=" + branch + ", strata=" + strata + ", splits=" + splits
                + ", terminal=" + terminalStrata + "}";
    }
}
