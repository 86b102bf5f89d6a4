/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

/**
 * The test at a non-terminal node.
 *
 * <p>Polarity: the LEFT child ({@link Branch#HOLDS}) is reached when the rule holds and the
 * RIGHT child ({@link Branch#FAILS}) when it fails. For rpart models this means the left
 * child receives the cases rpart itself sends left.
 */
public interface SplitRule {

    String variable();

    boolean isCategorical();

    /**
     * Atom describing the left branch, reading the answer of {@code sourceNodeId}.
     */
    Atom holds(int sourceNodeId);

    /**
     * Atom describing the right branch, reading the answer of {@code sourceNodeId}.
     */
    Atom fails(int sourceNodeId);

    default Atom atomFor(Branch branch, int sourceNodeId) {
        return switch (branch.kind()) {
            case HOLDS -> holds(sourceNodeId);
            case FAILS -> fails(sourceNodeId);
            default -> throw new IllegalArgumentException("Split rules only label HOLDS/FAILS branches, got " + branch);
        };
    }

    default String describe() {
        return holds(0).describe();
    }
}
