package com.devcrew.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of messages exchanged on the bus.
 *
 * The type decides which role handler reacts to a message; a role ignores
 * (but still acknowledges) types outside its dispatch table.
 */
public enum MessageType {
    REQUIREMENTS,
    TASK,
    IMPLEMENTATION,
    UI_IMPLEMENTATION,
    INTEGRATED_SYSTEM,
    TESTED_IMPLEMENTATION,
    DOCUMENTATION,
    ERROR,
    ERROR_RESOLUTION,
    BROADCAST;

    @JsonValue
    public String wireName() { return name().toLowerCase(); }

    @JsonCreator
    public static MessageType fromWireName(String value) {
        for (MessageType type : values()) {
            if (type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + value);
    }
}
