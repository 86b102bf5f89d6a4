/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.core.config;

import com.pathways.typing.api.ICartModelSource;
import com.pathways.typing.api.model.CartModelDefinition;
import com.pathways.typing.api.model.Stratum;
import com.pathways.typing.compiler.rpart.CartModelReader;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads stratum models from a directory holding one {@code cart_<stratum>.json} file per stratum.
 */
public class JsonCartModelSource implements ICartModelSource {

    private final Path directory;
    private final CartModelReader reader;

    public JsonCartModelSource(Path directory) {
        this(directory, new CartModelReader());
    }

    public JsonCartModelSource(Path directory, CartModelReader reader) {
        this.directory = directory;
        this.reader = reader;
    }

    public static String fileName(Stratum stratum) {
        return "cart_" + stratum.name() + ".json";
    }

    public Path path(Stratum stratum) {
        return directory.resolve(fileName(stratum));
    }

    @Override
    public CartModelDefinition load(Stratum stratum) throws IOException {
        Path path = path(stratum);
        if (!Files.isRegularFile(path)) {
            throw new FileNotFoundException("No model for stratum '" + stratum + "': " + path);
        }
        return reader.read(path);
    }
}
