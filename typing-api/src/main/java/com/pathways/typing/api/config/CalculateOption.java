/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Adds a calculated field next to every occurrence of {@link #question()}. The expression may
 * refer to the occurrence as <code>${src_question}</code>.
 */
public record CalculateOption(
        @JsonProperty("src_question") String question,
        @JsonProperty("name") String name,
        @JsonProperty("calculation") String calculation
) implements OptionDefinition {

    public static final String KIND = "calculate";

    public CalculateOption {
        Objects.requireNonNull(question, "calculate option requires src_question");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("calculate option on '" + question + "' requires a name");
        }
        if (calculation == null || calculation.isBlank()) {
            throw new IllegalArgumentException("calculate option '" + name + "' requires a calculation");
        }
    }

    @Override
    public String kind() {
        return KIND;
    }
}
