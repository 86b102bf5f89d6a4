/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON form of the configuration workbook: one list of rows per table, each row keyed by its
 * column header ({@code name}, {@code type}, {@code label::English (en)}, ...).
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ConfigurationDocument(
        @JsonProperty("questions") List<Map<String, String>> questions,
        @JsonProperty("choices") List<Map<String, String>> choices,
        @JsonProperty("options") List<OptionRow> options,
        @JsonProperty("segments") List<Map<String, String>> segments,
        @JsonProperty("settings") Map<String, String> settings,
        @JsonProperty("screening_questions") List<Map<String, String>> screeningQuestions,
        @JsonProperty("screening_choices") List<Map<String, String>> screeningChoices
) {
    public ConfigurationDocument {
        questions = questions == null ? List.of() : questions;
        choices = choices == null ? List.of() : choices;
        options = options == null ? List.of() : options;
        segments = segments == null ? List.of() : segments;
        settings = settings == null ? Map.of() : settings;
        screeningQuestions = screeningQuestions == null ? List.of() : screeningQuestions;
        screeningChoices = screeningChoices == null ? List.of() : screeningChoices;
    }

    /**
     * One row of the options table: the option kind and its parameters.
     */
    public record OptionRow(
            @JsonProperty("option") String option,
            @JsonProperty("config") Map<String, Object> config
    ) {
        public OptionRow {
            config = config == null ? Map.of() : config;
        }
    }
}
