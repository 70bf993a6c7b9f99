package com.devcrew.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a Task row.
 *
 * Happy path: CREATED → ASSIGNED → IN_PROGRESS → COMPLETED.
 * A failing test run moves the task to BLOCKED until the error is resolved.
 */
public enum TaskStatus {
    CREATED,
    ASSIGNED,
    IN_PROGRESS,
    COMPLETED,
    BLOCKED,
    ERROR;

    @JsonValue
    public String wireName() { return name().toLowerCase(); }
}
