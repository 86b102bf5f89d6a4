/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.core.config;

import com.pathways.typing.api.IConfigurationSource;
import com.pathways.typing.api.config.FormConfiguration;

import java.io.IOException;
import java.nio.file.Path;

public class JsonConfigurationSource implements IConfigurationSource {

    private final Path path;
    private final ConfigurationLoader loader;

    public JsonConfigurationSource(Path path) {
        this(path, new ConfigurationLoader());
    }

    public JsonConfigurationSource(Path path, ConfigurationLoader loader) {
        this.path = path;
        this.loader = loader;
    }

    @Override
    public FormConfiguration load() throws IOException {
        return loader.load(path);
    }
}
