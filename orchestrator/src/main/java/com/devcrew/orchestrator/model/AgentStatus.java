package com.devcrew.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Runtime status of a single agent.
 *
 * Transitions are caller-driven; any status may follow any other.
 */
public enum AgentStatus {
    IDLE,
    WORKING,
    BLOCKED,
    ERROR;

    @JsonValue
    public String wireName() { return name().toLowerCase(); }
}
