/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.config;

import java.util.Map;
import java.util.Objects;

/**
 * One configured choice of a select question.
 */
public record ChoiceDefinition(String value, Map<String, String> labels) {

    public ChoiceDefinition {
        Objects.requireNonNull(value, "Choice value cannot be null");
        labels = Labels.copyOf(labels);
    }

    public String label() {
        return Labels.firstText(labels, value);
    }
}
