package com.devcrew.orchestrator.workflow;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/** Helpers for reading loosely-typed message payloads. */
public final class Payloads {

    private Payloads() {}

    /**
     * Copy a message payload into a mutable map. Non-map payloads are
     * wrapped as {@code {"value": payload}}; null becomes an empty map.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object payload) {
        if (payload == null) {
            return new LinkedHashMap<>();
        }
        if (payload instanceof Map) {
            return new LinkedHashMap<>((Map<String, Object>) payload);
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("value", payload);
        return wrapped;
    }

    /** Parse a UUID stored as a string value; null for absent or malformed values. */
    public static UUID uuid(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return UUID.fromString(value.toString());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
