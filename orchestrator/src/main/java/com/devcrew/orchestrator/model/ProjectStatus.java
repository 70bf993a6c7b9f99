package com.devcrew.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle of a Project row. */
public enum ProjectStatus {
    CREATED,     // Row exists, no workflow started yet
    ACTIVE,      // A workflow has been initialised for it
    COMPLETED;   // Every task reached COMPLETED

    @JsonValue
    public String wireName() { return name().toLowerCase(); }
}
