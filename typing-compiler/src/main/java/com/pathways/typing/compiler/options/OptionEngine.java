/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.options;

import com.pathways.typing.api.ITreeTransform;
import com.pathways.typing.api.model.DecisionTree;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies an ordered list of tree transforms. The first failing transform aborts the run;
 * later transforms are not attempted.
 */
public class OptionEngine {

    private static final Logger logger = Logger.getLogger(OptionEngine.class.getName());

    private final List<ITreeTransform> transforms;

    public OptionEngine(List<ITreeTransform> transforms) {
        this.transforms = List.copyOf(transforms);
    }

    public DecisionTree apply(DecisionTree tree) {
        DecisionTree current = tree;
        for (int i = 0; i < transforms.size(); i++) {
            ITreeTransform transform = transforms.get(i);
            try {
                current = transform.apply(current);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, String.format("Option pass %d/%d (%s) failed: %s",
                        i + 1, transforms.size(), transform.name(), e.getMessage()));
                throw e;
            }
            logger.fine(String.format("Applied option pass %d/%d: %s", i + 1, transforms.size(), transform.name()));
        }
        return current;
    }

    public List<ITreeTransform> transforms() {
        return transforms;
    }

    public int size() {
        return transforms.size();
    }
}
