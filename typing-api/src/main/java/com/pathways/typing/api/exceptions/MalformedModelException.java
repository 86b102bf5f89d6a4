/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.exceptions;

/**
 * Thrown when the split, level or category tables of a serialized tree are inconsistent.
 */
public class MalformedModelException extends TypingCompilationException {

    public MalformedModelException(String message, String identifier) {
        super(message, identifier);
    }

    public MalformedModelException(String message, String identifier, Throwable cause) {
        super(message, identifier, cause);
    }
}
