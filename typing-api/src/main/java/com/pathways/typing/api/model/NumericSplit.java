/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import java.util.Objects;

public record NumericSplit(String variable, Comparison comparison, double threshold) implements SplitRule {

    public NumericSplit {
        Objects.requireNonNull(variable, "Variable cannot be null");
        Objects.requireNonNull(comparison, "Comparison cannot be null");
        if (Double.isNaN(threshold) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("Threshold of '" + variable + "' must be finite");
        }
    }

    @Override
    public boolean isCategorical() {
        return false;
    }

    @Override
    public NumericAtom holds(int sourceNodeId) {
        return new NumericAtom(sourceNodeId, variable, comparison, threshold);
    }

    @Override
    public NumericAtom fails(int sourceNodeId) {
        return holds(sourceNodeId).negate();
    }

    @Override
    public String toString() {
        return describe();
    }
}
