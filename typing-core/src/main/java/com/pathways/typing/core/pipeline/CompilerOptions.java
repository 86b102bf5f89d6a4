/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.core.pipeline;

import com.pathways.typing.emitter.diagram.DiagramOptions;

/**
 * Switches of a form compilation.
 *
 * @param mergeDuplicateQuestions ask a question found in several branches only once
 * @param skipUnavailableChoices  offer only the choices that lead somewhere
 * @param enableScreening         emit the screening group before the typing group
 * @param segmentNotes            announce the segment with a note at every outcome
 * @param formDiagram             labels of the diagram of the compiled form
 * @param cartDiagram             labels of the diagram of the bare merged tree
 */
public record CompilerOptions(
        boolean mergeDuplicateQuestions,
        boolean skipUnavailableChoices,
        boolean enableScreening,
        boolean segmentNotes,
        DiagramOptions formDiagram,
        DiagramOptions cartDiagram
) {
    public CompilerOptions {
        formDiagram = formDiagram == null ? DiagramOptions.defaults() : formDiagram;
        cartDiagram = cartDiagram == null ? DiagramOptions.defaults().withNodeIds(true) : cartDiagram;
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(true, false, false, true, null, null);
    }

    public CompilerOptions withMergeDuplicateQuestions(boolean enabled) {
        return new CompilerOptions(enabled, skipUnavailableChoices, enableScreening, segmentNotes, formDiagram, cartDiagram);
    }

    public CompilerOptions withSkipUnavailableChoices(boolean enabled) {
        return new CompilerOptions(mergeDuplicateQuestions, enabled, enableScreening, segmentNotes, formDiagram, cartDiagram);
    }

    public CompilerOptions withScreening(boolean enabled) {
        return new CompilerOptions(mergeDuplicateQuestions, skipUnavailableChoices, enabled, segmentNotes, formDiagram, cartDiagram);
    }

    public CompilerOptions withSegmentNotes(boolean enabled) {
        return new CompilerOptions(mergeDuplicateQuestions, skipUnavailableChoices, enableScreening, enabled, formDiagram, cartDiagram);
    }

    public CompilerOptions withFormDiagram(DiagramOptions options) {
        return new CompilerOptions(mergeDuplicateQuestions, skipUnavailableChoices, enableScreening, segmentNotes, options, cartDiagram);
    }

    public CompilerOptions withCartDiagram(DiagramOptions options) {
        return new CompilerOptions(mergeDuplicateQuestions, skipUnavailableChoices, enableScreening, segmentNotes, formDiagram, options);
    }
}
