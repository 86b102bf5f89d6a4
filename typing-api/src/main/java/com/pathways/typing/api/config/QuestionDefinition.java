/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.config;

import java.util.Map;
import java.util.Objects;

/**
 * One row of the questions table: how a tree variable is asked.
 */
public record QuestionDefinition(
        String name,
        QuestionType type,
        Map<String, String> labels,
        Map<String, String> hints,
        String listName
) {
    public QuestionDefinition {
        Objects.requireNonNull(name, "Question name cannot be null");
        Objects.requireNonNull(type, "Question type cannot be null for " + name);
        labels = Labels.copyOf(labels);
        hints = Labels.copyOf(hints);
        if (listName == null || listName.isBlank()) {
            listName = name;
        }
    }

    public QuestionDefinition(String name, QuestionType type, Map<String, String> labels) {
        this(name, type, labels, Map.of(), null);
    }
}
