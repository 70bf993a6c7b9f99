package com.devcrew.orchestrator.api.dto;

import com.devcrew.orchestrator.model.Project;

import java.time.Instant;
import java.util.UUID;

/** Row view returned by GET /projects. */
public record ProjectResponse(
        UUID    id,
        String  name,
        String  description,
        String  status,
        Instant createdAt,
        Instant updatedAt
) {
    public static ProjectResponse from(Project p) {
        return new ProjectResponse(
                p.getId(),
                p.getName(),
                p.getDescription(),
                p.getStatus().wireName(),
                p.getCreatedAt(),
                p.getUpdatedAt()
        );
    }
}
