/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import java.util.Objects;

/**
 * The edge a node hangs from, relative to its parent.
 *
 * <ul>
 *   <li>{@link Kind#HOLDS} - left child of a split, reached when the split rule holds</li>
 *   <li>{@link Kind#FAILS} - right child of a split, reached when the rule fails</li>
 *   <li>{@link Kind#CHOICE} - branch of a choice node, reached when {@link #choice()} is selected</li>
 *   <li>{@link Kind#ALTERNATIVE} - another stratum's subtree attached at the parent's position</li>
 * </ul>
 */
public record Branch(Kind kind, String choice) {

    public enum Kind {
        ROOT, HOLDS, FAILS, CHOICE, ALTERNATIVE
    }

    public static final Branch ROOT = new Branch(Kind.ROOT, null);
    public static final Branch HOLDS = new Branch(Kind.HOLDS, null);
    public static final Branch FAILS = new Branch(Kind.FAILS, null);
    public static final Branch ALTERNATIVE = new Branch(Kind.ALTERNATIVE, null);

    public Branch {
        Objects.requireNonNull(kind, "Branch kind cannot be null");
        if (kind == Kind.CHOICE) {
            Objects.requireNonNull(choice, "Choice branch requires a choice value");
        } else if (choice != null) {
            throw new IllegalArgumentException("Only choice branches carry a choice value");
        }
    }

    public static Branch choice(String value) {
        return new Branch(Kind.CHOICE, value);
    }

    @Override
    public String toString() {
        return kind == Kind.CHOICE ? "CHOICE(" + choice + ")" : kind.name();
    }
}
