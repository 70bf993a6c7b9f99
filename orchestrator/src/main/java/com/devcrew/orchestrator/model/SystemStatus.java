package com.devcrew.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall status of the orchestrated workflow.
 *
 * Transitions:
 *   INITIALIZING → RUNNING → COMPLETED
 *   RUNNING → PAUSED   (cancelled between steps, resumable)
 *   any     → ERROR    (run-loop failure, resumable from the last checkpoint)
 */
public enum SystemStatus {
    INITIALIZING,
    RUNNING,
    PAUSED,
    COMPLETED,
    ERROR;

    @JsonValue
    public String wireName() { return name().toLowerCase(); }
}
