/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Question types understood by the form emitter, named as in XLSForm.
 */
public enum QuestionType {
    INTEGER("integer"),
    DECIMAL("decimal"),
    SELECT_ONE("select_one"),
    SELECT_MULTIPLE("select_multiple"),
    TEXT("text"),
    DATE("date"),
    NOTE("note"),
    CALCULATE("calculate");

    private final String formName;

    QuestionType(String formName) {
        this.formName = formName;
    }

    @JsonValue
    public String formName() {
        return formName;
    }

    public boolean isSelect() {
        return this == SELECT_ONE || this == SELECT_MULTIPLE;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL;
    }

    /**
     * Numeric, single-choice and free-text questions must be answered; everything else is optional.
     */
    public boolean isRequiredByDefault() {
        return this == INTEGER || this == DECIMAL || this == SELECT_ONE || this == TEXT;
    }

    @JsonCreator
    public static QuestionType fromString(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Question type cannot be empty");
        }
        String normalized = text.trim().toLowerCase();
        for (QuestionType type : values()) {
            if (type.formName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown question type: " + text);
    }
}
