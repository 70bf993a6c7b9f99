package com.devcrew.orchestrator.service;

import com.devcrew.orchestrator.model.Project;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Result of {@link Orchestrator#getProjectStatus}.
 *
 * Task and error counts come straight from the store. agentStatus and
 * systemStatus are live values only for the project the orchestrator has
 * loaded; for any other project agentStatus is empty and systemStatus is
 * {@code "unknown"}. When the report could not be built, error is set and
 * the other parts may be null.
 */
public record ProjectStatusReport(
        UUID                projectId,
        ProjectView         project,
        TaskCounts          tasks,
        ErrorCounts         errors,
        Map<String, String> agentStatus,
        String              systemStatus,
        String              error
) {
    public static final String UNKNOWN = "unknown";
    public static final String NOT_FOUND = "Project not found";

    public record ProjectView(UUID id, String name, String description, String status,
                              Instant createdAt, Instant updatedAt) {
        static ProjectView from(Project p) {
            return new ProjectView(p.getId(), p.getName(), p.getDescription(),
                    p.getStatus().wireName(), p.getCreatedAt(), p.getUpdatedAt());
        }
    }

    public record TaskCounts(int total, int created, int assigned, int inProgress,
                             int completed, int blocked, int error, double completionPercentage) {}

    public record ErrorCounts(int total, int open, int resolved) {}

    @JsonIgnore
    public boolean isNotFound() {
        return NOT_FOUND.equals(error);
    }

    static ProjectStatusReport failed(UUID projectId, String error) {
        return new ProjectStatusReport(projectId, null, null, null, Map.of(), UNKNOWN, error);
    }
}
