/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Categorical split: levels in {@link #left()} go to the HOLDS branch, levels in
 * {@link #right()} to the FAILS branch.
 */
public record CategoricalSplit(String variable, List<String> left, List<String> right) implements SplitRule {

    public CategoricalSplit {
        Objects.requireNonNull(variable, "Variable cannot be null");
        left = List.copyOf(left);
        right = List.copyOf(right);
        if (left.isEmpty() || right.isEmpty()) {
            throw new IllegalArgumentException("Categorical split on '" + variable + "' needs levels on both sides");
        }
        if (!Collections.disjoint(left, right)) {
            throw new IllegalArgumentException("Categorical split on '" + variable + "' sends a level both ways");
        }
    }

    @Override
    public boolean isCategorical() {
        return true;
    }

    @Override
    public MembershipAtom holds(int sourceNodeId) {
        return new MembershipAtom(sourceNodeId, variable, left);
    }

    @Override
    public MembershipAtom fails(int sourceNodeId) {
        return new MembershipAtom(sourceNodeId, variable, right);
    }

    @Override
    public String toString() {
        return describe();
    }
}
