/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import java.math.BigDecimal;

/**
 * Formatting of split thresholds for labels and form expressions.
 */
public final class Thresholds {

    private Thresholds() {
    }

    /**
     * Formats a threshold without a trailing {@code .0}: 4.0 becomes "4", 4.5 stays "4.5".
     */
    public static String format(double threshold) {
        if (Double.isNaN(threshold) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("Threshold must be finite, got: " + threshold);
        }
        return BigDecimal.valueOf(threshold).stripTrailingZeros().toPlainString();
    }
}
