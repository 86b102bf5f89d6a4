/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.exceptions;

/**
 * Thrown when a transform or configuration row references a question, choice or segment
 * that does not exist.
 */
public class ConfigReferenceException extends TypingCompilationException {

    public ConfigReferenceException(String message, String identifier) {
        super(message, identifier);
    }

    public ConfigReferenceException(String message, String identifier, Throwable cause) {
        super(message, identifier, cause);
    }
}
