package com.devcrew.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * The seven agent roles that make up a DevCrew team.
 *
 * Declaration order is the pipeline order used by the scheduler when it
 * looks for the next role with pending mail.
 *
 * Agent ids are formed as {@code <wireName>_<suffix>}, e.g. {@code ui_ux_3f9a01bc}.
 */
public enum AgentRole {
    PROJECT_MANAGER("project_manager"),   // Parses requirements, breaks down and assigns tasks
    DEVELOPER("developer"),               // Implements back-end tasks
    UI_UX("ui_ux"),                       // Designs interfaces
    INTEGRATION("integration"),           // Wires components together
    TESTING("testing"),                   // Generates and runs tests
    DOCUMENTATION("documentation"),       // Writes technical docs and user guides
    ERROR_HANDLING("error_handling");     // Diagnoses and resolves reported errors

    /** Pseudo sender used for messages injected from outside the team. */
    public static final String SYSTEM_SENDER = "system";

    private final String wireName;

    AgentRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public static List<AgentRole> pipeline() {
        return Arrays.asList(values());
    }

    @JsonCreator
    public static AgentRole fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Role name must not be null");
        }
        for (AgentRole role : values()) {
            if (role.wireName.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown agent role: " + value);
    }

    /**
     * Extract the role from an agent id of the form {@code <role>_<suffix>}.
     *
     * Only the last underscore separates the suffix, so multi-word roles such
     * as {@code project_manager} resolve correctly. The synthetic
     * {@code system} sender maps to {@link #PROJECT_MANAGER}.
     */
    public static AgentRole fromAgentId(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("Agent id must not be blank");
        }
        if (SYSTEM_SENDER.equals(agentId)) {
            return PROJECT_MANAGER;
        }
        int cut = agentId.lastIndexOf('_');
        String prefix = cut > 0 ? agentId.substring(0, cut) : agentId;
        for (AgentRole role : values()) {
            if (role.wireName.equals(prefix) || role.wireName.equals(agentId)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Cannot derive a role from agent id: " + agentId);
    }
}
