package com.devcrew.orchestrator.persistence;

import com.devcrew.orchestrator.model.*;
import com.devcrew.orchestrator.repository.*;
import com.devcrew.orchestrator.state.WorkflowState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed store (schema managed by Flyway, see db/migration).
 *
 * Active unless {@code devcrew.persistence.store} selects another store.
 * JSON columns (agent output content, checkpoint data) are encoded with the
 * application ObjectMapper.
 */
@Component
@ConditionalOnProperty(prefix = "devcrew.persistence", name = "store", havingValue = "jpa", matchIfMissing = true)
public class JpaPersistenceStore implements PersistenceStore {

    private static final Logger log = LoggerFactory.getLogger(JpaPersistenceStore.class);

    private final ProjectRepository     projectRepo;
    private final TaskRepository        taskRepo;
    private final AgentOutputRepository outputRepo;
    private final ErrorRecordRepository errorRepo;
    private final CheckpointRepository  checkpointRepo;
    private final ObjectMapper          objectMapper;

    public JpaPersistenceStore(ProjectRepository projectRepo,
                               TaskRepository taskRepo,
                               AgentOutputRepository outputRepo,
                               ErrorRecordRepository errorRepo,
                               CheckpointRepository checkpointRepo,
                               ObjectMapper objectMapper) {
        this.projectRepo    = projectRepo;
        this.taskRepo       = taskRepo;
        this.outputRepo     = outputRepo;
        this.errorRepo      = errorRepo;
        this.checkpointRepo = checkpointRepo;
        this.objectMapper   = objectMapper;
    }

    // ------------------------------------------------------------------
    // Projects
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public UUID createProject(String name, String description) {
        Project project = projectRepo.save(new Project(name, description));
        log.info("Created project {} ('{}')", project.getId(), name);
        return project.getId();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Project> getProject(UUID id) {
        return projectRepo.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Project> findProjectByName(String name) {
        return projectRepo.findByName(name);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Project> getAllProjects() {
        return projectRepo.findAllByOrderByCreatedAtAsc();
    }

    @Override
    @Transactional
    public boolean updateProject(UUID id, ProjectUpdate update) {
        return projectRepo.findById(id)
                .map(project -> {
                    update.applyTo(project);
                    projectRepo.save(project);
                    return true;
                })
                .orElse(false);
    }

    // ------------------------------------------------------------------
    // Tasks
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public UUID createTask(UUID projectId, String title, String description, AgentRole assignedAgent) {
        return taskRepo.save(new Task(projectId, title, description, assignedAgent)).getId();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Task> getTask(UUID id) {
        return taskRepo.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Task> getTasksByProject(UUID projectId) {
        return taskRepo.findByProjectIdOrderByCreatedAtAsc(projectId);
    }

    @Override
    @Transactional
    public boolean updateTask(UUID id, TaskUpdate update) {
        return taskRepo.findById(id)
                .map(task -> {
                    update.applyTo(task);
                    taskRepo.save(task);
                    return true;
                })
                .orElse(false);
    }

    // ------------------------------------------------------------------
    // Agent outputs
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public UUID storeAgentOutput(UUID taskId, String agentId, String outputType, Object content) {
        AgentOutput output = new AgentOutput(taskId, agentId, outputType, toJson(content));
        return outputRepo.save(output).getId();
    }

    @Override
    @Transactional(readOnly = true)
    public List<AgentOutput> getAgentOutputs(UUID taskId, String agentId) {
        return agentId == null
                ? outputRepo.findByTaskIdOrderByCreatedAtAsc(taskId)
                : outputRepo.findByTaskIdAndAgentIdOrderByCreatedAtAsc(taskId, agentId);
    }

    // ------------------------------------------------------------------
    // Errors
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public UUID storeError(UUID taskId, String agentId, String errorType,
                           String errorMessage, String stackTrace) {
        ErrorRecord saved = errorRepo.save(new ErrorRecord(taskId, agentId, errorType, errorMessage, stackTrace));
        log.info("Stored error {} ({}) from {}", saved.getId(), errorType, agentId);
        return saved.getId();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ErrorRecord> getError(UUID id) {
        return errorRepo.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ErrorRecord> getErrorsByTask(UUID taskId) {
        return errorRepo.findByTaskIdOrderByCreatedAtAsc(taskId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ErrorRecord> getAllErrors(ErrorStatus status) {
        return status == null
                ? errorRepo.findAllByOrderByCreatedAtAsc()
                : errorRepo.findByStatusOrderByCreatedAtAsc(status);
    }

    @Override
    @Transactional
    public boolean updateErrorStatus(UUID id, ErrorStatus status, String resolution, Instant resolvedAt) {
        return errorRepo.findById(id)
                .map(error -> {
                    error.setStatus(status);
                    if (resolution != null) {
                        error.setResolution(resolution);
                    }
                    if (resolvedAt != null) {
                        error.setResolvedAt(resolvedAt);
                    } else if (status == ErrorStatus.RESOLVED) {
                        error.setResolvedAt(Instant.now());
                    }
                    errorRepo.save(error);
                    return true;
                })
                .orElse(false);
    }

    // ------------------------------------------------------------------
    // Checkpoints
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public Long storeCheckpoint(UUID projectId, WorkflowState state) {
        Checkpoint saved = checkpointRepo.save(new Checkpoint(projectId, toJson(state)));
        log.debug("Stored checkpoint {} for project {} ({})", saved.getId(), projectId, state);
        return saved.getId();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WorkflowCheckpoint> getLatestCheckpoint() {
        return checkpointRepo.findTopByOrderByIdDesc().map(this::decode);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WorkflowCheckpoint> getLatestCheckpoint(UUID projectId) {
        return checkpointRepo.findTopByProjectIdOrderByIdDesc(projectId).map(this::decode);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WorkflowCheckpoint> getCheckpoint(Long id) {
        return checkpointRepo.findById(id).map(this::decode);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Could not encode value as JSON: " + e.getOriginalMessage(), e);
        }
    }

    private WorkflowCheckpoint decode(Checkpoint row) {
        try {
            WorkflowState state = objectMapper.readValue(row.getData(), WorkflowState.class);
            return new WorkflowCheckpoint(row.getId(), row.getProjectId(), row.getCreatedAt(), state);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Checkpoint " + row.getId() + " is not readable: "
                    + e.getOriginalMessage(), e);
        }
    }
}
