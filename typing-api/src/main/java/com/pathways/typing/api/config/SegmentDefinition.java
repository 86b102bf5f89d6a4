/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.config;

import com.pathways.typing.api.model.Stratum;

import java.util.Map;
import java.util.Objects;

/**
 * Label of a predicted class ("segment"). A {@code null} stratum applies to every stratum.
 */
public record SegmentDefinition(Stratum stratum, String value, Map<String, String> labels) {

    public SegmentDefinition {
        Objects.requireNonNull(value, "Segment value cannot be null");
        labels = Labels.copyOf(labels);
    }

    public boolean appliesTo(Stratum candidate) {
        return stratum == null || stratum.equals(candidate);
    }
}
