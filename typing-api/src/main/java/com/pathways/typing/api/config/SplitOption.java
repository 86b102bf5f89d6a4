/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Asks {@link #splitQuestion()} before {@link #question()} and duplicates the subtree once per
 * choice. {@link #questionsByChoice()} optionally asks a different question in a branch.
 */
public record SplitOption(
        @JsonProperty("src_question") String question,
        @JsonProperty("split_question") String splitQuestion,
        @JsonProperty("questions") Map<String, String> questionsByChoice
) implements OptionDefinition {

    public static final String KIND = "split";

    public SplitOption {
        Objects.requireNonNull(question, "split option requires src_question");
        Objects.requireNonNull(splitQuestion, "split option requires split_question");
        questionsByChoice = questionsByChoice == null ? Map.of() : new LinkedHashMap<>(questionsByChoice);
    }

    @Override
    public String kind() {
        return KIND;
    }
}
