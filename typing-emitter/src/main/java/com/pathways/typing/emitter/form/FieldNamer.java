/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.emitter.form;

import com.pathways.typing.api.model.Attachment;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.Outcome;
import com.pathways.typing.api.model.TreeNode;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Assigns a unique form field name to every emitted question and attachment of a tree.
 *
 * <p>A name emitted once keeps its configured form. A name emitted several times, or clashing
 * with a reserved, outcome or already assigned name, is suffixed with the node id
 * ({@code hh_size_7}); when that still clashes a counter follows ({@code segment_note_7_2}). Collapsed duplicates resolve to the
 * field of their canonical occurrence.
 */
public final class FieldNamer {

    private record Slot(TreeNode node, int attachment) {
    }

    private final DecisionTree tree;
    private final Int2ObjectMap<String> questionFields = new Int2ObjectOpenHashMap<>();
    private final Int2ObjectMap<Int2ObjectMap<String>> attachmentFields = new Int2ObjectOpenHashMap<>();

    private FieldNamer(DecisionTree tree) {
        this.tree = tree;
    }

    /**
     * @param reserved names already taken by other rows of the form
     */
    public static FieldNamer assign(DecisionTree tree, Collection<String> reserved) {
        FieldNamer namer = new FieldNamer(tree);
        namer.assignAll(reserved);
        return namer;
    }

    private void assignAll(Collection<String> reserved) {
        List<Slot> slots = new ArrayList<>();
        Object2IntOpenHashMap<String> uses = new Object2IntOpenHashMap<>();
        for (String name : reserved) {
            uses.addTo(name, 1);
        }
        for (TreeNode node : tree.preorder()) {
            if (node.hasQuestion() && !node.isDuplicate()) {
                slots.add(new Slot(node, -1));
                uses.addTo(node.question().name(), 1);
            }
            if (node.hasOutcome()) {
                uses.addTo(Outcome.fieldName(node.id()), 1);
            }
            List<Attachment> attachments = node.attachments();
            for (int i = 0; i < attachments.size(); i++) {
                if (node.isDuplicate() && attachments.get(i).scope() == Attachment.Scope.QUESTION) {
                    continue;
                }
                slots.add(new Slot(node, i));
                uses.addTo(attachments.get(i).question().name(), 1);
            }
        }

        Set<String> taken = new HashSet<>(reserved);
        for (TreeNode node : tree.preorder()) {
            if (node.hasOutcome()) {
                taken.add(Outcome.fieldName(node.id()));
            }
        }
        for (Slot slot : slots) {
            TreeNode node = slot.node();
            String base = slot.attachment() < 0 ? node.question().name()
                    : node.attachments().get(slot.attachment()).question().name();
            String field = base;
            if (uses.getInt(base) > 1 || taken.contains(base)) {
                String suffixed = base + "_" + node.id();
                field = suffixed;
                int counter = 2;
                while (taken.contains(field)) {
                    field = suffixed + "_" + counter++;
                }
            }
            taken.add(field);
            if (slot.attachment() < 0) {
                questionFields.put(node.id(), field);
            } else {
                Int2ObjectMap<String> fields = attachmentFields.get(node.id());
                if (fields == null) {
                    fields = new Int2ObjectOpenHashMap<>();
                    attachmentFields.put(node.id(), fields);
                }
                fields.put(slot.attachment(), field);
            }
        }
    }

    /**
     * Field holding the answer of the question bound to {@code nodeId}.
     *
     * @throws IllegalStateException when the node asks no question
     */
    public String questionField(int nodeId) {
        TreeNode node = tree.requireNode(nodeId);
        if (node.isDuplicate()) {
            return questionField(node.duplicateOf());
        }
        String field = questionFields.get(nodeId);
        if (field == null) {
            throw new IllegalStateException("Node " + nodeId + " asks no question");
        }
        return field;
    }

    public String attachmentField(int nodeId, int index) {
        Int2ObjectMap<String> fields = attachmentFields.get(nodeId);
        String field = fields == null ? null : fields.get(index);
        if (field == null) {
            throw new IllegalStateException("Node " + nodeId + " emits no attachment " + index);
        }
        return field;
    }
}
