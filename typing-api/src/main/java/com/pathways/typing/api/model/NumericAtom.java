/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import java.util.Objects;

public record NumericAtom(
        int sourceNodeId,
        String variable,
        Comparison comparison,
        double threshold
) implements Atom {

    public NumericAtom {
        Objects.requireNonNull(variable, "Variable cannot be null");
        Objects.requireNonNull(comparison, "Comparison cannot be null");
    }

    public NumericAtom negate() {
        return new NumericAtom(sourceNodeId, variable, comparison.negate(), threshold);
    }

    @Override
    public NumericAtom withSource(int nodeId) {
        return new NumericAtom(nodeId, variable, comparison, threshold);
    }

    @Override
    public boolean test(Object answer) {
        if (answer instanceof Number number) {
            return comparison.test(number.doubleValue(), threshold);
        }
        if (answer instanceof String text) {
            try {
                return comparison.test(Double.parseDouble(text.trim()), threshold);
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return false;
    }

    @Override
    public String describe() {
        return variable + " " + comparison.symbol() + " " + Thresholds.format(threshold);
    }
}
