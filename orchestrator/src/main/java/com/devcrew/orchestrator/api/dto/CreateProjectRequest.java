package com.devcrew.orchestrator.api.dto;

/**
 * Request body for POST /projects.
 *
 * Required: name, requirements. A project with the same name is reused.
 */
public record CreateProjectRequest(String name, String description, String requirements) {

    public CreateProjectRequest {
        if (description == null) description = "";
    }
}
