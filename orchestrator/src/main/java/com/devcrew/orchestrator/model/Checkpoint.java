package com.devcrew.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Durable snapshot of the workflow accumulators and scheduler pointer.
 *
 * The id is a database sequence, so "latest" means highest id. Two saves
 * within the same clock tick are still strictly ordered.
 *
 * DB table: system_checkpoints
 */
@Entity
@Table(name = "system_checkpoints")
public class Checkpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id")
    private UUID projectId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    // JSON text of a WorkflowState.
    @Column(nullable = false, columnDefinition = "TEXT")
    private String data;

    protected Checkpoint() {}   // required by JPA

    public Checkpoint(UUID projectId, String data) {
        this.projectId = projectId;
        this.data      = data;
    }

    public Long    getId()        { return id; }
    public UUID    getProjectId() { return projectId; }
    public Instant getCreatedAt() { return createdAt; }
    public String  getData()      { return data; }
}
