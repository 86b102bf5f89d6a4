/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A population subgroup with its own independently fitted classification tree.
 */
public record Stratum(String name) implements Comparable<Stratum> {

    private static final Pattern VALID_NAME = Pattern.compile("[a-z][a-z0-9_]*");

    public static final Stratum RURAL = new Stratum("rural");
    public static final Stratum URBAN = new Stratum("urban");

    public Stratum {
        Objects.requireNonNull(name, "Stratum name cannot be null");
        if (!VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid stratum name: '" + name + "'");
        }
    }

    public static Stratum of(String name) {
        Objects.requireNonNull(name, "Stratum name cannot be null");
        return new Stratum(name.trim().toLowerCase());
    }

    @Override
    public int compareTo(Stratum other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
