package com.devcrew.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One unit of work produced by the project manager's task breakdown.
 *
 * assignedAgent holds the role responsible for the task, not a concrete
 * agent id: agent ids change every time a workflow is re-initialised.
 *
 * DB table: tasks
 */
@Entity
@Table(name = "tasks")
public class Task {

    @Id
    private UUID id = UUID.randomUUID();

    @Column(name = "project_id", nullable = false)
    private UUID projectId;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "assigned_agent")
    private AgentRole assignedAgent;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status = TaskStatus.CREATED;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected Task() {}   // required by JPA

    public Task(UUID projectId, String title, String description, AgentRole assignedAgent) {
        this.projectId     = projectId;
        this.title         = title;
        this.description   = description;
        this.assignedAgent = assignedAgent;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID       getId()            { return id; }
    public UUID       getProjectId()     { return projectId; }
    public String     getTitle()         { return title; }
    public String     getDescription()   { return description; }
    public AgentRole  getAssignedAgent() { return assignedAgent; }
    public TaskStatus getStatus()        { return status; }
    public Instant    getCreatedAt()     { return createdAt; }
    public Instant    getUpdatedAt()     { return updatedAt; }

    public void setTitle(String title)                  { this.title = title; }
    public void setDescription(String description)      { this.description = description; }
    public void setAssignedAgent(AgentRole role)        { this.assignedAgent = role; }
    public void setStatus(TaskStatus status)            { this.status = status; }
    public void touch()                                 { this.updatedAt = Instant.now(); }
}
