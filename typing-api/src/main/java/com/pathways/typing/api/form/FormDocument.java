/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.form;

import java.util.Objects;

/**
 * The three sheets of a compiled form.
 */
public record FormDocument(RowSet survey, RowSet choices, RowSet settings) {

    public static final String SURVEY = "survey";
    public static final String CHOICES = "choices";
    public static final String SETTINGS = "settings";

    public FormDocument {
        Objects.requireNonNull(survey, "survey rows cannot be null");
        Objects.requireNonNull(choices, "choice rows cannot be null");
        Objects.requireNonNull(settings, "settings rows cannot be null");
    }
}
