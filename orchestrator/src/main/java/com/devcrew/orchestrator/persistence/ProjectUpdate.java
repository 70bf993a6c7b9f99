package com.devcrew.orchestrator.persistence;

import com.devcrew.orchestrator.model.Project;
import com.devcrew.orchestrator.model.ProjectStatus;

/** Partial project update; null fields are left unchanged. */
public record ProjectUpdate(String name, String description, ProjectStatus status) {

    public static ProjectUpdate status(ProjectStatus status) {
        return new ProjectUpdate(null, null, status);
    }

    public static ProjectUpdate description(String description) {
        return new ProjectUpdate(null, description, null);
    }

    void applyTo(Project project) {
        if (name != null)        project.setName(name);
        if (description != null) project.setDescription(description);
        if (status != null)      project.setStatus(status);
        project.touch();
    }
}
