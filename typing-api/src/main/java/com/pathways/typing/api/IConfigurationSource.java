/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api;

import com.pathways.typing.api.config.FormConfiguration;

import java.io.IOException;

/**
 * Retrieves the form configuration tables.
 */
public interface IConfigurationSource {

    FormConfiguration load() throws IOException;
}
