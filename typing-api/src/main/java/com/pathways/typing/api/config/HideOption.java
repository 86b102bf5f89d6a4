/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Hides one choice of {@link #question()} or, when {@link #choice()} is null, the question
 * itself. A hidden question keeps its place in the form as a calculated field pinned to
 * {@link #value()}.
 */
public record HideOption(
        @JsonProperty("src_question") String question,
        @JsonProperty("choice") String choice,
        @JsonProperty("value") String value
) implements OptionDefinition {

    public static final String KIND = "hide";

    public HideOption {
        Objects.requireNonNull(question, "hide option requires src_question");
    }

    public boolean hidesChoice() {
        return choice != null && !choice.isBlank();
    }

    @Override
    public String kind() {
        return KIND;
    }
}
