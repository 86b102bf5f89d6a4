/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;

/**
 * Predicted class of every stratum that ends at a tree position.
 */
public record Outcome(Map<Stratum, String> classes) {

    public static final String FIELD_PREFIX = "segment_";

    public Outcome {
        Objects.requireNonNull(classes, "Outcome classes cannot be null");
        if (classes.isEmpty()) {
            throw new IllegalArgumentException("An outcome needs at least one stratum");
        }
        classes = Collections.unmodifiableMap(new LinkedHashMap<>(classes));
    }

    public static String fieldName(int nodeId) {
        return FIELD_PREFIX + nodeId;
    }

    public boolean isUniform() {
        return new LinkedHashSet<>(classes.values()).size() == 1;
    }

    public String classFor(Stratum stratum) {
        return classes.get(stratum);
    }

    public Collection<Stratum> strata() {
        return classes.keySet();
    }
}
