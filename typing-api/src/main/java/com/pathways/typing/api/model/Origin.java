/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.model;

import java.util.Objects;

/**
 * Provenance entry: the stratum tree and node id a merged node was built from.
 */
public record Origin(Stratum stratum, int nodeId) {

    public Origin {
        Objects.requireNonNull(stratum, "Stratum cannot be null");
    }

    @Override
    public String toString() {
        return stratum + "#" + nodeId;
    }
}
