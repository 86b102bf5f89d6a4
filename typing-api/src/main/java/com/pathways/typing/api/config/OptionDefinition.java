/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.config;

/**
 * One row of the options table. Each option targets the nodes bound to {@link #question()}.
 */
public interface OptionDefinition {

    /**
     * Option kind as written in the configuration ("split", "calculate", "hide").
     */
    String kind();

    String question();
}
