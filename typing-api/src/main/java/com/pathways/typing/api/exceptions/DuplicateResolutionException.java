/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api.exceptions;

/**
 * Thrown when collapsing duplicate questions would change the set of reachable outcomes
 * or merge occurrences that disagree.
 */
public class DuplicateResolutionException extends TypingCompilationException {

    public DuplicateResolutionException(String message, String identifier) {
        super(message, identifier);
    }

    public DuplicateResolutionException(String message, String identifier, Throwable cause) {
        super(message, identifier, cause);
    }
}
