/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.exceptions;

/**
 * Thrown when a split node does not have both of its children in the node table.
 */
public class IncompleteTreeException extends TypingCompilationException {

    public IncompleteTreeException(String message, String identifier) {
        super(message, identifier);
    }

    public IncompleteTreeException(String message, String identifier, Throwable cause) {
        super(message, identifier, cause);
    }
}
