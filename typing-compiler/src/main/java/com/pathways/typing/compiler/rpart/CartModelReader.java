/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.compiler.rpart;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pathways.typing.api.model.CartModelDefinition;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads serialized recursive-partitioning trees from JSON.
 */
public class CartModelReader {

    private final ObjectMapper objectMapper;

    public CartModelReader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public CartModelReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CartModelDefinition read(Path path) throws IOException {
        String content = Files.readString(path);
        return read(content);
    }

    public CartModelDefinition read(String json) throws IOException {
        return objectMapper.readValue(json, CartModelDefinition.class);
    }
}
