/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.exceptions;

/**
 * Thrown when per-stratum trees cannot be reconciled into one tree, e.g. because they were
 * fitted on different candidate variables.
 */
public class MergeConflictException extends TypingCompilationException {

    public MergeConflictException(String message, String identifier) {
        super(message, identifier);
    }

    public MergeConflictException(String message, String identifier, Throwable cause) {
        super(message, identifier, cause);
    }
}
