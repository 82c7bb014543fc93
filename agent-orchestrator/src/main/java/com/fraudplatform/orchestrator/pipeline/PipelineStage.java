package com.fraudplatform.orchestrator.pipeline;

/**
 * Stages of a fraud run, in execution order. Each runs inside its own failure boundary.
 */
public enum PipelineStage {
    LOAD("DATA_LOADED"),
    EXECUTE_AGENTS("AGENTS_COMPLETED"),
    AGGREGATE("SCORES_AGGREGATED"),
    FINALIZE("RUN_FINALIZED");

    private final String completedEvent;

    PipelineStage(String completedEvent) {
        this.completedEvent = completedEvent;
    }

    /** Flow-log event emitted when the stage completes normally. */
    public String completedEvent() {
        return completedEvent;
    }
}
