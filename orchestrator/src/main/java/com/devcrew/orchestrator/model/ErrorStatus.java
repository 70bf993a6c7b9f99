package com.devcrew.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorStatus {
    OPEN,
    RESOLVED;

    @JsonValue
    public String wireName() { return name().toLowerCase(); }
}
