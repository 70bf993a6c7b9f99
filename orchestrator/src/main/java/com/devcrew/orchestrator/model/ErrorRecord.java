package com.devcrew.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A persisted error raised during a workflow: either an agent-turn failure
 * or a synthesized TestFailure from the testing role.
 *
 * Opened by the reporter, resolved by the error-handling role.
 *
 * DB table: errors
 */
@Entity
@Table(name = "errors")
public class ErrorRecord {

    @Id
    private UUID id = UUID.randomUUID();

    @Column(name = "task_id")
    private UUID taskId;

    @Column(name = "agent_id", nullable = false)
    private String agentId;

    @Column(name = "error_type", nullable = false)
    private String errorType;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "stack_trace", columnDefinition = "TEXT")
    private String stackTrace;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ErrorStatus status = ErrorStatus.OPEN;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(columnDefinition = "TEXT")
    private String resolution;

    protected ErrorRecord() {}   // required by JPA

    public ErrorRecord(UUID taskId, String agentId, String errorType,
                       String errorMessage, String stackTrace) {
        this.taskId       = taskId;
        this.agentId      = agentId;
        this.errorType    = errorType;
        this.errorMessage = errorMessage;
        this.stackTrace   = stackTrace;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID        getId()           { return id; }
    public UUID        getTaskId()       { return taskId; }
    public String      getAgentId()      { return agentId; }
    public String      getErrorType()    { return errorType; }
    public String      getErrorMessage() { return errorMessage; }
    public String      getStackTrace()   { return stackTrace; }
    public ErrorStatus getStatus()       { return status; }
    public Instant     getCreatedAt()    { return createdAt; }
    public Instant     getResolvedAt()   { return resolvedAt; }
    public String      getResolution()   { return resolution; }

    public void setStatus(ErrorStatus status)       { this.status = status; }
    public void setResolvedAt(Instant resolvedAt)   { this.resolvedAt = resolvedAt; }
    public void setResolution(String resolution)    { this.resolution = resolution; }
}
