package com.devcrew.orchestrator.persistence;

import com.devcrew.orchestrator.model.AgentOutput;
import com.devcrew.orchestrator.model.AgentRole;
import com.devcrew.orchestrator.model.ErrorRecord;
import com.devcrew.orchestrator.model.ErrorStatus;
import com.devcrew.orchestrator.model.Project;
import com.devcrew.orchestrator.model.Task;
import com.devcrew.orchestrator.state.WorkflowState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage for projects, tasks, agent outputs, errors and workflow
 * checkpoints.
 *
 * Implementations throw {@link PersistenceException} (or a Spring
 * DataAccessException) when the backing store fails. Update methods return
 * false when the target row does not exist.
 *
 * Content passed to {@link #storeAgentOutput} must be JSON-serializable
 * plain data; it is stored as JSON text.
 */
public interface PersistenceStore {

    // ------------------------------------------------------------------
    // Projects
    // ------------------------------------------------------------------

    UUID createProject(String name, String description);

    Optional<Project> getProject(UUID id);

    Optional<Project> findProjectByName(String name);

    List<Project> getAllProjects();

    boolean updateProject(UUID id, ProjectUpdate update);

    // ------------------------------------------------------------------
    // Tasks
    // ------------------------------------------------------------------

    UUID createTask(UUID projectId, String title, String description, AgentRole assignedAgent);

    Optional<Task> getTask(UUID id);

    /** Tasks of a project in creation order. */
    List<Task> getTasksByProject(UUID projectId);

    boolean updateTask(UUID id, TaskUpdate update);

    // ------------------------------------------------------------------
    // Agent outputs
    // ------------------------------------------------------------------

    UUID storeAgentOutput(UUID taskId, String agentId, String outputType, Object content);

    /** Outputs for a task in creation order; agentId null means any agent. */
    List<AgentOutput> getAgentOutputs(UUID taskId, String agentId);

    // ------------------------------------------------------------------
    // Errors
    // ------------------------------------------------------------------

    UUID storeError(UUID taskId, String agentId, String errorType, String errorMessage, String stackTrace);

    Optional<ErrorRecord> getError(UUID id);

    List<ErrorRecord> getErrorsByTask(UUID taskId);

    /** All errors, or only those with the given status when it is non-null. */
    List<ErrorRecord> getAllErrors(ErrorStatus status);

    /**
     * Change an error's status. Resolving without an explicit resolvedAt
     * stamps the current time.
     */
    boolean updateErrorStatus(UUID id, ErrorStatus status, String resolution, Instant resolvedAt);

    // ------------------------------------------------------------------
    // Checkpoints
    // ------------------------------------------------------------------

    /** @return the checkpoint id; ids increase with every save */
    Long storeCheckpoint(UUID projectId, WorkflowState state);

    /** Highest-id checkpoint across all projects. */
    Optional<WorkflowCheckpoint> getLatestCheckpoint();

    /** Highest-id checkpoint saved for the given project. */
    Optional<WorkflowCheckpoint> getLatestCheckpoint(UUID projectId);

    Optional<WorkflowCheckpoint> getCheckpoint(Long id);
}
