/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api;

import com.pathways.typing.api.config.FormConfiguration;
import com.pathways.typing.api.form.CompiledForm;
import com.pathways.typing.api.model.CartModelDefinition;
import com.pathways.typing.api.model.Stratum;

import io.opentelemetry.api.trace.Tracer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Contract for compiling stratum trees and a form configuration into a typing form.
 */
public interface IFormCompiler {

    /**
     * Compiles already loaded models. Strata are processed in map iteration order, which
     * decides merge tie-breaks.
     *
     * @param models one fitted tree per stratum
     * @param configuration validated form configuration
     * @return compiled form, diagram and final tree
     */
    CompiledForm compile(Map<Stratum, CartModelDefinition> models, FormConfiguration configuration);

    /**
     * Compiles models and configuration stored as JSON files.
     *
     * @param modelPaths one model file per stratum
     * @param configurationPath configuration file
     * @throws IOException if a file cannot be read
     */
    CompiledForm compile(Map<Stratum, Path> modelPaths, Path configurationPath) throws IOException;

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
