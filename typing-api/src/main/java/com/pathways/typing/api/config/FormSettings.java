/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Free-form key/value settings of the form, with typed accessors for the keys the compiler
 * itself interprets.
 */
public final class FormSettings {

    public static final String FORM_TITLE = "form_title";
    public static final String FORM_ID = "form_id";
    public static final String VERSION = "version";
    public static final String DEFAULT_LANGUAGE = "default_language";
    public static final String TYPING_GROUP_LABEL = "typing_group_label";
    public static final String TYPING_GROUP_RELEVANT = "typing_group_relevant";
    public static final String STRATA_FIELD = "strata_field";

    private static final String DEFAULT_STRATA_FIELD = "strata";
    private static final String DEFAULT_TYPING_GROUP_LABEL = "Typing";

    private final Map<String, String> values;

    public FormSettings(Map<String, String> values) {
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static FormSettings empty() {
        return new FormSettings(Map.of());
    }

    public String get(String key) {
        return values.get(key);
    }

    public Map<String, String> asMap() {
        return values;
    }

    /**
     * Name of the form field holding the respondent's stratum.
     */
    public String strataField() {
        String field = values.get(STRATA_FIELD);
        return field == null || field.isBlank() ? DEFAULT_STRATA_FIELD : field.trim();
    }

    /**
     * Label columns of the typing group. Settings keys {@code typing_group_label::<lang>} become
     * {@code label::<lang>}; defaults to "Typing" in the default language.
     */
    public Map<String, String> typingGroupLabels() {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(Labels.LABEL + "::" + Labels.DEFAULT_LANGUAGE, DEFAULT_TYPING_GROUP_LABEL);
        for (Map.Entry<String, String> entry : values.entrySet()) {
            if (entry.getKey().startsWith(TYPING_GROUP_LABEL) && entry.getValue() != null && !entry.getValue().isBlank()) {
                String column = Labels.LABEL + entry.getKey().substring(TYPING_GROUP_LABEL.length());
                labels.put(column, entry.getValue());
            }
        }
        return Collections.unmodifiableMap(labels);
    }

    public String typingGroupRelevance() {
        String relevance = values.get(TYPING_GROUP_RELEVANT);
        return relevance == null ? "" : relevance.trim();
    }

    /**
     * Entries written to the settings sheet: everything except the keys consumed by the compiler.
     */
    public Map<String, String> sheetEntries() {
        Map<String, String> entries = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String key = entry.getKey();
            if (key.startsWith(TYPING_GROUP_LABEL) || key.equals(TYPING_GROUP_RELEVANT) || key.equals(STRATA_FIELD)) {
                continue;
            }
            entries.put(key, entry.getValue() == null ? "" : entry.getValue());
        }
        return entries;
    }

    @Override
    public String toString() {
        return "FormSettings" + values;
    }
}
