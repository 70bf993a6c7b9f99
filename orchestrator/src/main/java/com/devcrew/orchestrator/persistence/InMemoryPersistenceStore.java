package com.devcrew.orchestrator.persistence;

import com.devcrew.orchestrator.model.*;
import com.devcrew.orchestrator.state.WorkflowState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Heap-only store for local runs ({@code devcrew.persistence.store=memory},
 * see the "memory" profile) and tests.
 *
 * Behaves like the JPA store: JSON columns are kept as encoded text, and
 * checkpoints are decoded on every read, so encoding problems surface the
 * same way. Contents are lost on shutdown.
 */
@Component
@ConditionalOnProperty(prefix = "devcrew.persistence", name = "store", havingValue = "memory")
public class InMemoryPersistenceStore implements PersistenceStore {

    private final Map<UUID, Project>     projects = new LinkedHashMap<>();
    private final Map<UUID, Task>        tasks    = new LinkedHashMap<>();
    private final Map<UUID, AgentOutput> outputs  = new LinkedHashMap<>();
    private final Map<UUID, ErrorRecord> errors   = new LinkedHashMap<>();
    private final NavigableMap<Long, StoredCheckpoint> checkpoints = new TreeMap<>();
    private long checkpointSeq = 0;

    private final ObjectMapper objectMapper;

    public InMemoryPersistenceStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ------------------------------------------------------------------
    // Projects
    // ------------------------------------------------------------------

    @Override
    public synchronized UUID createProject(String name, String description) {
        Project project = new Project(name, description);
        projects.put(project.getId(), project);
        return project.getId();
    }

    @Override
    public synchronized Optional<Project> getProject(UUID id) {
        return Optional.ofNullable(projects.get(id));
    }

    @Override
    public synchronized Optional<Project> findProjectByName(String name) {
        return projects.values().stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    @Override
    public synchronized List<Project> getAllProjects() {
        return new ArrayList<>(projects.values());
    }

    @Override
    public synchronized boolean updateProject(UUID id, ProjectUpdate update) {
        Project project = projects.get(id);
        if (project == null) return false;
        update.applyTo(project);
        return true;
    }

    // ------------------------------------------------------------------
    // Tasks
    // ------------------------------------------------------------------

    @Override
    public synchronized UUID createTask(UUID projectId, String title, String description, AgentRole assignedAgent) {
        Task task = new Task(projectId, title, description, assignedAgent);
        tasks.put(task.getId(), task);
        return task.getId();
    }

    @Override
    public synchronized Optional<Task> getTask(UUID id) {
        return Optional.ofNullable(tasks.get(id));
    }

    @Override
    public synchronized List<Task> getTasksByProject(UUID projectId) {
        return tasks.values().stream().filter(t -> t.getProjectId().equals(projectId)).toList();
    }

    @Override
    public synchronized boolean updateTask(UUID id, TaskUpdate update) {
        Task task = tasks.get(id);
        if (task == null) return false;
        update.applyTo(task);
        return true;
    }

    // ------------------------------------------------------------------
    // Agent outputs
    // ------------------------------------------------------------------

    @Override
    public synchronized UUID storeAgentOutput(UUID taskId, String agentId, String outputType, Object content) {
        AgentOutput output = new AgentOutput(taskId, agentId, outputType, toJson(content));
        outputs.put(output.getId(), output);
        return output.getId();
    }

    @Override
    public synchronized List<AgentOutput> getAgentOutputs(UUID taskId, String agentId) {
        return outputs.values().stream()
                .filter(o -> Objects.equals(o.getTaskId(), taskId))
                .filter(o -> agentId == null || agentId.equals(o.getAgentId()))
                .toList();
    }

    // ------------------------------------------------------------------
    // Errors
    // ------------------------------------------------------------------

    @Override
    public synchronized UUID storeError(UUID taskId, String agentId, String errorType,
                                        String errorMessage, String stackTrace) {
        ErrorRecord error = new ErrorRecord(taskId, agentId, errorType, errorMessage, stackTrace);
        errors.put(error.getId(), error);
        return error.getId();
    }

    @Override
    public synchronized Optional<ErrorRecord> getError(UUID id) {
        return Optional.ofNullable(errors.get(id));
    }

    @Override
    public synchronized List<ErrorRecord> getErrorsByTask(UUID taskId) {
        return errors.values().stream().filter(e -> Objects.equals(e.getTaskId(), taskId)).toList();
    }

    @Override
    public synchronized List<ErrorRecord> getAllErrors(ErrorStatus status) {
        return errors.values().stream().filter(e -> status == null || e.getStatus() == status).toList();
    }

    @Override
    public synchronized boolean updateErrorStatus(UUID id, ErrorStatus status, String resolution, Instant resolvedAt) {
        ErrorRecord error = errors.get(id);
        if (error == null) return false;
        error.setStatus(status);
        if (resolution != null) {
            error.setResolution(resolution);
        }
        if (resolvedAt != null) {
            error.setResolvedAt(resolvedAt);
        } else if (status == ErrorStatus.RESOLVED) {
            error.setResolvedAt(Instant.now());
        }
        return true;
    }

    // ------------------------------------------------------------------
    // Checkpoints
    // ------------------------------------------------------------------

    @Override
    public synchronized Long storeCheckpoint(UUID projectId, WorkflowState state) {
        long id = ++checkpointSeq;
        checkpoints.put(id, new StoredCheckpoint(id, projectId, Instant.now(), toJson(state)));
        return id;
    }

    @Override
    public synchronized Optional<WorkflowCheckpoint> getLatestCheckpoint() {
        Map.Entry<Long, StoredCheckpoint> last = checkpoints.lastEntry();
        return last == null ? Optional.empty() : Optional.of(decode(last.getValue()));
    }

    @Override
    public synchronized Optional<WorkflowCheckpoint> getLatestCheckpoint(UUID projectId) {
        for (StoredCheckpoint c : checkpoints.descendingMap().values()) {
            if (Objects.equals(c.projectId(), projectId)) {
                return Optional.of(decode(c));
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized Optional<WorkflowCheckpoint> getCheckpoint(Long id) {
        StoredCheckpoint c = checkpoints.get(id);
        return c == null ? Optional.empty() : Optional.of(decode(c));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private record StoredCheckpoint(long id, UUID projectId, Instant createdAt, String data) {}

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Could not encode value as JSON: " + e.getOriginalMessage(), e);
        }
    }

    private WorkflowCheckpoint decode(StoredCheckpoint c) {
        try {
            return new WorkflowCheckpoint(c.id(), c.projectId(), c.createdAt(),
                    objectMapper.readValue(c.data(), WorkflowState.class));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Checkpoint " + c.id() + " is not readable: "
                    + e.getOriginalMessage(), e);
        }
    }
}
