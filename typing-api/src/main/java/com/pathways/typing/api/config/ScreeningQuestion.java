/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.config;

import java.util.Objects;

/**
 * A question asked before the typing questions, with its own relevance expression written
 * directly in form syntax.
 */
public record ScreeningQuestion(QuestionDefinition definition, String relevance) {

    public ScreeningQuestion {
        Objects.requireNonNull(definition, "Screening question definition cannot be null");
        relevance = relevance == null ? "" : relevance.trim();
    }
}
