/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import java.util.Map;
import java.util.Objects;

/**
 * Predicted class of a tree node together with its sample count and, when the
 * serialized model carries them, the per-class probabilities.
 */
public record ClassDistribution(
        String predictedClass,
        int sampleCount,
        Map<String, Double> probabilities
) {
    public ClassDistribution {
        Objects.requireNonNull(predictedClass, "Predicted class cannot be null");
        if (sampleCount < 0) {
            throw new IllegalArgumentException("Sample count cannot be negative: " + sampleCount);
        }
        probabilities = probabilities == null ? Map.of() : Map.copyOf(probabilities);
    }

    public ClassDistribution(String predictedClass, int sampleCount) {
        this(predictedClass, sampleCount, Map.of());
    }
}
