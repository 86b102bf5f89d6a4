/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

/**
 * Comparison operator of a numeric split or relevance atom.
 */
public enum Comparison {
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">=");

    private final String symbol;

    Comparison(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Returns the operator that holds exactly when this one fails.
     */
    public Comparison negate() {
        return switch (this) {
            case LESS_THAN -> GREATER_THAN_OR_EQUAL;
            case LESS_THAN_OR_EQUAL -> GREATER_THAN;
            case GREATER_THAN -> LESS_THAN_OR_EQUAL;
            case GREATER_THAN_OR_EQUAL -> LESS_THAN;
        };
    }

    /**
     * True for {@code <} and {@code <=}, which bound a variable from above.
     */
    public boolean isUpperBound() {
        return this == LESS_THAN || this == LESS_THAN_OR_EQUAL;
    }

    public boolean isStrict() {
        return this == LESS_THAN || this == GREATER_THAN;
    }

    public boolean test(double value, double threshold) {
        return switch (this) {
            case LESS_THAN -> value < threshold;
            case LESS_THAN_OR_EQUAL -> value <= threshold;
            case GREATER_THAN -> value > threshold;
            case GREATER_THAN_OR_EQUAL -> value >= threshold;
        };
    }

    public static Comparison fromSymbol(String symbol) {
        for (Comparison comparison : values()) {
            if (comparison.symbol.equals(symbol)) {
                return comparison;
            }
        }
        throw new IllegalArgumentException("Unknown comparison: " + symbol);
    }
}
