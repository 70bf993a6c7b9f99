package com.devcrew.orchestrator.service;

import com.devcrew.orchestrator.config.DevCrewProperties;
import com.devcrew.orchestrator.messaging.Message;
import com.devcrew.orchestrator.messaging.MessageBus;
import com.devcrew.orchestrator.messaging.MessageFilter;
import com.devcrew.orchestrator.model.*;
import com.devcrew.orchestrator.persistence.PersistenceStore;
import com.devcrew.orchestrator.persistence.ProjectUpdate;
import com.devcrew.orchestrator.persistence.WorkflowCheckpoint;
import com.devcrew.orchestrator.state.AgentState;
import com.devcrew.orchestrator.state.ErrorReport;
import com.devcrew.orchestrator.state.SystemState;
import com.devcrew.orchestrator.state.WorkflowState;
import com.devcrew.orchestrator.workflow.AgentTurnProcessor;
import com.devcrew.orchestrator.workflow.TurnResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Workflow engine for one live project at a time.
 *
 * <p>State machine over the checkpointed {@code next} pointer: each step runs
 * one agent turn for the role it names, merges the turn's results into the
 * workflow accumulators, picks the next role and saves a checkpoint. A
 * crash between steps loses at most the step in flight.
 *
 * <p>Intended pipeline:
 * <pre>
 *   project_manager → developer → testing → (documentation | error_handling)
 *   ui_ux → integration → testing
 *   error_handling → (back to the reporting role)
 *   documentation → project_manager
 * </pre>
 *
 * <p>Single writer: {@link #initializeProject}, {@link #reset} and
 * {@link #run} hold one lock. {@link #cancel} only raises a flag that the
 * run loop checks before every step. Status queries do not take the lock.
 */
@Service
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    static final String ORCHESTRATOR_AGENT = "orchestrator";

    private final PersistenceStore   store;
    private final AgentTurnProcessor turnProcessor;
    private final ObjectMapper       objectMapper;
    private final DevCrewProperties  properties;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    private volatile SystemState systemState;
    private volatile MessageBus  messageBus;

    public Orchestrator(PersistenceStore store,
                        AgentTurnProcessor turnProcessor,
                        ObjectMapper objectMapper,
                        DevCrewProperties properties) {
        this.store         = store;
        this.turnProcessor = turnProcessor;
        this.objectMapper  = objectMapper;
        this.properties    = properties;
        resetState(null);
    }

    // ------------------------------------------------------------------
    // Project lifecycle
    // ------------------------------------------------------------------

    /**
     * Start a workflow for a project, reusing an existing project with the
     * same name (its description is updated when it changed).
     *
     * Steps:
     *  1. Find or create the project row and mark it active
     *  2. Replace SystemState and MessageBus, register a fresh agent per role
     *  3. Send the requirements from "system" to the project manager
     *  4. Save the bootstrap checkpoint (empty accumulators, next = project_manager)
     */
    public UUID initializeProject(String name, String description, String requirements) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Project name must not be blank");
        }
        lock.lock();
        try {
            UUID projectId;
            Optional<Project> existing = store.findProjectByName(name);
            if (existing.isPresent()) {
                projectId = existing.get().getId();
                if (!Objects.equals(existing.get().getDescription(), description)) {
                    store.updateProject(projectId, ProjectUpdate.description(description));
                }
                log.info("Reusing project {} ('{}')", projectId, name);
            } else {
                projectId = store.createProject(name, description);
            }
            store.updateProject(projectId, ProjectUpdate.status(ProjectStatus.ACTIVE));

            resetState(projectId);
            SystemState state = systemState;

            Map<String, Object> content = new LinkedHashMap<>();
            content.put("name",         name);
            content.put("description",  description);
            content.put("requirements", requirements);
            Message message = new Message(AgentRole.SYSTEM_SENDER,
                    state.requireAgent(AgentRole.PROJECT_MANAGER).getAgentId(),
                    content, MessageType.REQUIREMENTS, null, projectId, null);
            messageBus.send(message);
            state.addMessage(message);

            saveCheckpoint(WorkflowState.initial());
            log.info("Initialized project {} with {} agents", projectId, state.getAgents().size());
            return projectId;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop all live state and register fresh agents. An unknown project id
     * resets to an empty orchestrator with no project loaded.
     */
    public void reset(UUID projectId) {
        lock.lock();
        try {
            UUID target = projectId != null && store.getProject(projectId).isPresent() ? projectId : null;
            if (projectId != null && target == null) {
                log.warn("Reset requested for unknown project {}; resetting without a project", projectId);
            }
            resetState(target);
        } finally {
            lock.unlock();
        }
    }

    /** Ask an in-flight run to stop before its next step. */
    public void cancel() {
        cancelRequested.set(true);
        log.info("Cancellation requested for project {}", currentProjectId());
    }

    // ------------------------------------------------------------------
    // Run loop
    // ------------------------------------------------------------------

    public Map<String, Object> run() {
        return run(properties.getRun().getDefaultSteps());
    }

    /**
     * Advance the workflow by up to {@code steps} agent turns (capped by
     * {@code devcrew.run.max-steps}).
     *
     * Agent-turn failures are handled inside the turn and routed to error
     * handling. Anything else (e.g. the store failing) stops the run with
     * status ERROR; the next call resumes from the last checkpoint.
     *
     * @return snapshot of the system state, or {projectId, status, error}
     *         if the snapshot cannot be built
     * @throws IllegalStateException    if no project is initialized
     * @throws IllegalArgumentException if steps &lt; 1
     */
    public Map<String, Object> run(int steps) {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be at least 1, got " + steps);
        }
        int budget = Math.min(steps, properties.getRun().getMaxSteps());
        lock.lock();
        try {
            SystemState state = systemState;
            MessageBus bus = messageBus;
            if (state.getProjectId() == null) {
                throw new IllegalStateException("No project initialized; call initializeProject first");
            }
            cancelRequested.set(false);
            state.setStatus(SystemStatus.RUNNING);

            try {
                WorkflowState workflow = loadCheckpoint(null);
                for (int step = 1; step <= budget; step++) {
                    if (cancelRequested.getAndSet(false)) {
                        state.setStatus(SystemStatus.PAUSED);
                        log.info("Run for project {} cancelled before step {}", state.getProjectId(), step);
                        break;
                    }
                    if (workflow.isParked()) {
                        break;
                    }
                    AgentRole role = workflow.getNext();
                    state.setCurrentPhase(role.wireName());

                    TurnResult result = turnProcessor.runTurn(role, state, bus);
                    workflow.appendAll(result.additions());
                    if (result.parked()) {
                        workflow.park();
                    } else {
                        AgentRole requested = result.next() != null ? result.next() : role;
                        workflow.setNext(schedule(requested, state, bus));
                    }
                    saveCheckpoint(workflow);
                    log.debug("Step {}/{}: {} processed {} message(s), next={}", step, budget,
                            role.wireName(), result.processedMessages(), workflow);
                }
                if (workflow.isParked()) {
                    state.setStatus(SystemStatus.COMPLETED);
                    state.setCurrentPhase("completed");
                }
            } catch (RuntimeException e) {
                log.error("Run for project {} failed: {}", state.getProjectId(), e.getMessage(), e);
                recordRunError(state, e);
                state.setStatus(SystemStatus.ERROR);
            }
            return state.toSnapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Work-conserving choice of the next role: keep the requested role when
     * it has unread mail, otherwise take the first role in pipeline order
     * (starting after the requested one) that has some. With no mail
     * anywhere the requested role stays.
     */
    private AgentRole schedule(AgentRole requested, SystemState state, MessageBus bus) {
        if (hasMail(requested, state, bus)) {
            return requested;
        }
        List<AgentRole> pipeline = AgentRole.pipeline();
        int start = pipeline.indexOf(requested);
        for (int i = 1; i < pipeline.size(); i++) {
            AgentRole candidate = pipeline.get((start + i) % pipeline.size());
            if (hasMail(candidate, state, bus)) {
                return candidate;
            }
        }
        return requested;
    }

    private static boolean hasMail(AgentRole role, SystemState state, MessageBus bus) {
        return state.getAgentByRole(role)
                .map(agent -> bus.countUnread(agent.getAgentId()) > 0)
                .orElse(false);
    }

    private void recordRunError(SystemState state, RuntimeException e) {
        ErrorReport report = ErrorReport.fromThrowable(null, ORCHESTRATOR_AGENT, e);
        try {
            report = report.withRecordId(store.storeError(null, ORCHESTRATOR_AGENT,
                    report.errorType(), report.errorMessage(), report.stackTrace()));
        } catch (RuntimeException storeError) {
            log.warn("Could not persist run error for project {}: {}", state.getProjectId(), storeError.getMessage());
        }
        state.addError(report);
    }

    // ------------------------------------------------------------------
    // Checkpoints
    // ------------------------------------------------------------------

    /** Persist the workflow state for the loaded project and remember its id. */
    public Long saveCheckpoint(WorkflowState workflow) {
        SystemState state = systemState;
        Long id = store.storeCheckpoint(state.getProjectId(), workflow);
        state.setCheckpointId(id);
        return id;
    }

    /**
     * Load a checkpoint by id, or with a null id the latest one: for the
     * loaded project when there is one, across all projects otherwise.
     * Without any checkpoint the bootstrap state is returned.
     *
     * @throws IllegalArgumentException if an explicit id does not exist
     */
    public WorkflowState loadCheckpoint(Long checkpointId) {
        Optional<WorkflowCheckpoint> checkpoint;
        if (checkpointId != null) {
            checkpoint = store.getCheckpoint(checkpointId);
            if (checkpoint.isEmpty()) {
                throw new IllegalArgumentException("Unknown checkpoint: " + checkpointId);
            }
        } else {
            UUID projectId = currentProjectId();
            checkpoint = projectId != null
                    ? store.getLatestCheckpoint(projectId)
                    : store.getLatestCheckpoint();
        }
        return checkpoint.map(WorkflowCheckpoint::state).orElseGet(WorkflowState::initial);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /**
     * Progress summary computed from the store. Never throws: an unknown
     * project or a store failure is reported in the {@code error} field.
     */
    public ProjectStatusReport getProjectStatus(UUID projectId) {
        try {
            Optional<Project> project = store.getProject(projectId);
            if (project.isEmpty()) {
                return ProjectStatusReport.failed(projectId, ProjectStatusReport.NOT_FOUND);
            }

            List<Task> tasks = store.getTasksByProject(projectId);
            Map<TaskStatus, Integer> byStatus = new EnumMap<>(TaskStatus.class);
            int open = 0;
            int resolved = 0;
            for (Task task : tasks) {
                byStatus.merge(task.getStatus(), 1, Integer::sum);
                for (ErrorRecord error : store.getErrorsByTask(task.getId())) {
                    if (error.getStatus() == ErrorStatus.RESOLVED) resolved++;
                    else open++;
                }
            }
            int total = tasks.size();
            int completed = byStatus.getOrDefault(TaskStatus.COMPLETED, 0);
            ProjectStatusReport.TaskCounts taskCounts = new ProjectStatusReport.TaskCounts(
                    total,
                    byStatus.getOrDefault(TaskStatus.CREATED, 0),
                    byStatus.getOrDefault(TaskStatus.ASSIGNED, 0),
                    byStatus.getOrDefault(TaskStatus.IN_PROGRESS, 0),
                    completed,
                    byStatus.getOrDefault(TaskStatus.BLOCKED, 0),
                    byStatus.getOrDefault(TaskStatus.ERROR, 0),
                    total == 0 ? 0.0 : completed * 100.0 / total);

            SystemState state = systemState;
            Map<String, String> agentStatus = new LinkedHashMap<>();
            String systemStatus = ProjectStatusReport.UNKNOWN;
            if (projectId.equals(state.getProjectId())) {
                for (AgentState agent : state.getAgents()) {
                    agentStatus.put(agent.getRole().wireName(), agent.getStatus().wireName());
                }
                systemStatus = state.getStatus().wireName();
            }

            return new ProjectStatusReport(projectId,
                    ProjectStatusReport.ProjectView.from(project.get()),
                    taskCounts,
                    new ProjectStatusReport.ErrorCounts(open + resolved, open, resolved),
                    agentStatus,
                    systemStatus,
                    null);
        } catch (RuntimeException e) {
            log.warn("Could not compute status for project {}: {}", projectId, e.getMessage());
            return ProjectStatusReport.failed(projectId, String.valueOf(e.getMessage()));
        }
    }

    public List<Project> listProjects() {
        return store.getAllProjects();
    }

    public List<Message> getMessageHistory(MessageFilter filter) {
        return messageBus.getMessageHistory(filter);
    }

    public Map<String, Object> getSystemSnapshot() {
        return systemState.toSnapshot();
    }

    public UUID currentProjectId() {
        return systemState.getProjectId();
    }

    public SystemStatus currentStatus() {
        return systemState.getStatus();
    }

    /** The live state; replaced on every initialize / reset. */
    public SystemState systemState() {
        return systemState;
    }

    public MessageBus messageBus() {
        return messageBus;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void resetState(UUID projectId) {
        SystemState state = new SystemState(projectId);
        for (AgentRole role : AgentRole.pipeline()) {
            state.registerAgent(AgentState.create(role));
        }
        this.messageBus  = new MessageBus(store, objectMapper);
        this.systemState = state;
        cancelRequested.set(false);
    }
}
