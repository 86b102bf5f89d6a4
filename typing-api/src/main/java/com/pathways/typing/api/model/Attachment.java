/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Extra row emitted alongside a tree position: a calculated field following the bound question
 * ({@link Scope#QUESTION}) or a note shown with the outcome ({@link Scope#OUTCOME}).
 * An empty {@code strata} list applies to every stratum of the scope.
 */
public record Attachment(Question question, Scope scope, List<Stratum> strata) {

    public enum Scope {
        QUESTION, OUTCOME
    }

    public Attachment {
        Objects.requireNonNull(question, "Attachment question cannot be null");
        Objects.requireNonNull(scope, "Attachment scope cannot be null");
        strata = strata == null ? List.of() : List.copyOf(strata);
    }

    public Attachment(Question question, Scope scope) {
        this(question, scope, List.of());
    }
}
