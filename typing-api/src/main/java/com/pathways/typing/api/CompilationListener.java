/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api;

import java.util.Map;

/**
 * Callback interface for compilation stage events.
 *
 * <p>A form compilation runs these stages in order:
 * <ol>
 *   <li>PARSING - Decode every stratum model into split rules and distributions</li>
 *   <li>BUILDING - Rebuild one tree per stratum</li>
 *   <li>MERGING - Merge the stratum trees</li>
 *   <li>BINDING - Bind configured questions and outcome fields</li>
 *   <li>RELEVANCE - Compile per-node relevance</li>
 *   <li>OPTIONS - Apply configured option transforms</li>
 *   <li>DEDUPLICATION - Collapse duplicate questions (optional)</li>
 *   <li>HIDING - Apply hide options</li>
 *   <li>EMISSION - Produce form rows and the flow diagram</li>
 * </ol>
 */
public interface CompilationListener {

    /**
     * Called when a compilation stage starts.
     *
     * @param stageName Name of the stage (e.g., "PARSING", "MERGING")
     * @param stageNumber Current stage number (1-based)
     * @param totalStages Total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a compilation stage completes successfully.
     *
     * @param stageName Name of the stage
     * @param result Result containing duration and stage-specific metrics
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a compilation stage fails. The exception is rethrown afterwards.
     *
     * @param stageName Name of the stage that failed
     * @param error The exception that occurred
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single compilation stage.
     *
     * @param stageName Name of the stage
     * @param durationNanos Duration in nanoseconds
     * @param metrics Stage-specific metrics (e.g., "nodeCount", "duplicateGroups")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
