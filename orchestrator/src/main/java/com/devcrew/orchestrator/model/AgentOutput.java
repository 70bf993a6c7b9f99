package com.devcrew.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Durable record of something an agent produced: a stage result
 * (analysis, code, test report, ...) or a copy of a message it sent.
 *
 * content is the JSON text of a plain-data tree. taskId is null for
 * outputs that are not tied to a task, such as the initial requirements.
 *
 * DB table: agent_outputs
 */
@Entity
@Table(name = "agent_outputs")
public class AgentOutput {

    @Id
    private UUID id = UUID.randomUUID();

    @Column(name = "task_id")
    private UUID taskId;

    @Column(name = "agent_id", nullable = false)
    private String agentId;

    @Column(name = "output_type", nullable = false)
    private String outputType;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected AgentOutput() {}   // required by JPA

    public AgentOutput(UUID taskId, String agentId, String outputType, String content) {
        this.taskId     = taskId;
        this.agentId    = agentId;
        this.outputType = outputType;
        this.content    = content;
    }

    public UUID    getId()         { return id; }
    public UUID    getTaskId()     { return taskId; }
    public String  getAgentId()    { return agentId; }
    public String  getOutputType() { return outputType; }
    public String  getContent()    { return content; }
    public Instant getCreatedAt()  { return createdAt; }
}
