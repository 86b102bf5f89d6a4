/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.emitter.diagram;

/**
 * Label options of the flow diagram.
 *
 * @param addNodeId         prefix every node label with its id
 * @param addChoiceLabels   label split edges with their condition instead of yes/no
 * @param useQuestionLabels show the question label instead of the split rule
 * @param skipNotes         leave segment notes out of outcome labels
 */
public record DiagramOptions(boolean addNodeId, boolean addChoiceLabels, boolean useQuestionLabels, boolean skipNotes) {

    public static DiagramOptions defaults() {
        return new DiagramOptions(false, false, false, true);
    }

    public DiagramOptions withNodeIds(boolean enabled) {
        return new DiagramOptions(enabled, addChoiceLabels, useQuestionLabels, skipNotes);
    }

    public DiagramOptions withChoiceLabels(boolean enabled) {
        return new DiagramOptions(addNodeId, enabled, useQuestionLabels, skipNotes);
    }

    public DiagramOptions withQuestionLabels(boolean enabled) {
        return new DiagramOptions(addNodeId, addChoiceLabels, enabled, skipNotes);
    }

    public DiagramOptions withNotes(boolean enabled) {
        return new DiagramOptions(addNodeId, addChoiceLabels, useQuestionLabels, !enabled);
    }
}
