/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import java.util.Map;

/**
 * An atomic comparison inside a relevance expression.
 *
 * Every atom reads the answer recorded at a specific tree node ({@link #sourceNodeId()}),
 * so that the form emitter can reference the right field when the same variable is asked
 * in several branches.
 */
public interface Atom {

    int sourceNodeId();

    String variable();

    /**
     * Returns a copy of this atom that reads the answer of another node.
     */
    Atom withSource(int nodeId);

    /**
     * Evaluates this atom against a single answer; a missing answer never satisfies an atom.
     */
    boolean test(Object answer);

    /**
     * Evaluates this atom against answers keyed by variable.
     */
    default boolean test(Map<String, ?> answers) {
        return test(answers.get(variable()));
    }

    /**
     * Human readable form, e.g. {@code hh_size < 4.5}.
     */
    String describe();
}
