package com.devcrew.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A software project the crew works on.
 *
 * Projects are looked up by name when a workflow is initialised, so
 * re-initialising "Todo App" reuses the existing row.
 *
 * DB table: projects  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "projects")
public class Project {

    // Assigned on construction so in-memory and JPA stores hand out ids the same way.
    @Id
    private UUID id = UUID.randomUUID();

    @Column(nullable = false, unique = true)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProjectStatus status = ProjectStatus.CREATED;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Project() {}   // required by JPA

    public Project(String name, String description) {
        this.name        = name;
        this.description = description;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()          { return id; }
    public String        getName()        { return name; }
    public String        getDescription() { return description; }
    public ProjectStatus getStatus()      { return status; }
    public Instant       getCreatedAt()   { return createdAt; }
    public Instant       getUpdatedAt()   { return updatedAt; }

    public void setName(String name)                { this.name = name; }
    public void setDescription(String description)  { this.description = description; }
    public void setStatus(ProjectStatus status)     { this.status = status; }

    /** Stores without JPA lifecycle callbacks call this on every update. */
    public void touch()                             { this.updatedAt = Instant.now(); }
}
