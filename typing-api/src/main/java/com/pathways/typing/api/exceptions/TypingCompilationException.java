/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.exceptions;

/**
 * Base exception for every fatal failure of the typing tool pipeline.
 *
 * This is a RuntimeException so that tree transforms can be expressed as plain
 * functions, while still giving the caller the offending identifier through
 * {@link #getIdentifier()}.
 */
public class TypingCompilationException extends RuntimeException {

    private final String identifier;

    public TypingCompilationException(String message, String identifier) {
        super(message);
        this.identifier = identifier;
    }

    public TypingCompilationException(String message, String identifier, Throwable cause) {
        super(message, cause);
        this.identifier = identifier;
    }

    /**
     * Returns the node id, variable, question or choice that caused the failure.
     */
    public String getIdentifier() {
        return identifier;
    }
}
