/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.options;

import com.pathways.typing.api.ITreeTransform;
import com.pathways.typing.api.config.FormConfiguration;
import com.pathways.typing.api.config.Labels;
import com.pathways.typing.api.config.SegmentDefinition;
import com.pathways.typing.api.exceptions.ConfigReferenceException;
import com.pathways.typing.api.model.Attachment;
import com.pathways.typing.api.model.DecisionTree;
import com.pathways.typing.api.model.Question;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.api.model.TreeNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds a note announcing the segment to every outcome. Strata ending in the same segment share
 * one note. Only attachments are added, so the order of siblings never changes.
 */
public class SegmentNoteTransform implements ITreeTransform {

    public static final String NOTE_NAME = "segment_note";

    private final FormConfiguration configuration;

    public SegmentNoteTransform(FormConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * @throws ConfigReferenceException when a predicted class has no segment row
     */
    @Override
    public DecisionTree apply(DecisionTree input) {
        DecisionTree tree = input.copy();
        for (TreeNode node : tree.leaves()) {
            if (node.outcome() == null) {
                throw new IllegalStateException("Outcome of node " + node.id() + " is not bound");
            }
            Map<SegmentDefinition, List<Stratum>> notes = new LinkedHashMap<>();
            for (Stratum stratum : node.outcome().strata()) {
                String segmentClass = node.outcome().classFor(stratum);
                SegmentDefinition segment = configuration.segment(stratum, segmentClass)
                        .orElseThrow(() -> new ConfigReferenceException("No segment configured for class '"
                                + segmentClass + "' of stratum '" + stratum + "'", segmentClass));
                notes.computeIfAbsent(segment, k -> new ArrayList<>()).add(stratum);
            }
            notes.forEach((segment, strata) -> {
                Map<String, String> labels = segment.labels().isEmpty() ? Labels.of(segment.value()) : segment.labels();
                List<Stratum> scope = strata.size() == node.outcome().strata().size() ? List.of() : strata;
                node.addAttachment(new Attachment(Question.note(NOTE_NAME, labels), Attachment.Scope.OUTCOME, scope));
            });
        }
        return tree;
    }

    @Override
    public String name() {
        return "segment-notes";
    }
}
