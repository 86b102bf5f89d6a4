/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for localized text columns such as {@code label::English (en)}.
 * Column order is significant for emitted row sets, so copies keep insertion order.
 */
public final class Labels {

    public static final String LABEL = "label";
    public static final String HINT = "hint";
    public static final String DEFAULT_LANGUAGE = "English (en)";

    private Labels() {
    }

    public static Map<String, String> copyOf(Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    public static Map<String, String> of(String text) {
        return copyOf(Map.of(LABEL + "::" + DEFAULT_LANGUAGE, text));
    }

    /**
     * First non-blank text of the given labels, or {@code fallback} when there is none.
     */
    public static String firstText(Map<String, String> labels, String fallback) {
        for (String text : labels.values()) {
            if (text != null && !text.isBlank()) {
                return text;
            }
        }
        return fallback;
    }
}
