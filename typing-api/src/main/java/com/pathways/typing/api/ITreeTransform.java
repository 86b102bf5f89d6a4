/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api;

import com.pathways.typing.api.model.DecisionTree;

/**
 * A compilation pass over a decision tree. Implementations never modify their input and
 * return a new tree.
 */
@FunctionalInterface
public interface ITreeTransform {

    DecisionTree apply(DecisionTree tree);

    /**
     * Short name used in logs and trace spans.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
