package com.devcrew.orchestrator.state;

import com.devcrew.orchestrator.messaging.Message;
import com.devcrew.orchestrator.model.AgentRole;
import com.devcrew.orchestrator.model.AgentStatus;
import com.devcrew.orchestrator.model.SystemStatus;
import com.devcrew.orchestrator.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Aggregate runtime state of one workflow: agents, task registry, message
 * log, error log and overall status.
 *
 * Exactly one instance is live per orchestrator; it is replaced wholesale
 * when a project is initialised or reset. Every mutator takes the instance
 * lock, so status updates and history appends are atomic.
 *
 * Each role has at most one registered agent; a second registration for
 * the same role is rejected.
 */
public class SystemState {

    private static final Logger log = LoggerFactory.getLogger(SystemState.class);

    private final UUID projectId;

    private final Map<String, AgentState>    agents       = new LinkedHashMap<>();
    private final Map<AgentRole, AgentState> agentsByRole = new EnumMap<>(AgentRole.class);
    private final Map<UUID, Map<String, Object>> tasks    = new LinkedHashMap<>();
    private final List<Message>     messages = new ArrayList<>();
    private final List<ErrorReport> errors   = new ArrayList<>();

    private SystemStatus status = SystemStatus.INITIALIZING;
    private String  currentPhase = "initialization";
    private final Instant startedAt = Instant.now();
    private Instant updatedAt = startedAt;
    private Long    checkpointId;

    public SystemState(UUID projectId) {
        this.projectId = projectId;
    }

    // ------------------------------------------------------------------
    // Agents
    // ------------------------------------------------------------------

    public synchronized void registerAgent(AgentState agent) {
        if (agentsByRole.containsKey(agent.getRole())) {
            throw new IllegalStateException("An agent is already registered for role "
                    + agent.getRole().wireName() + ": " + agentsByRole.get(agent.getRole()).getAgentId());
        }
        if (agents.containsKey(agent.getAgentId())) {
            throw new IllegalStateException("Duplicate agent id: " + agent.getAgentId());
        }
        agents.put(agent.getAgentId(), agent);
        agentsByRole.put(agent.getRole(), agent);
        touch();
    }

    public synchronized Optional<AgentState> getAgent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public synchronized Optional<AgentState> getAgentByRole(AgentRole role) {
        return Optional.ofNullable(agentsByRole.get(role));
    }

    /** @throws IllegalStateException if no agent is registered for the role */
    public synchronized AgentState requireAgent(AgentRole role) {
        AgentState agent = agentsByRole.get(role);
        if (agent == null) {
            throw new IllegalStateException("No agent registered for role " + role.wireName());
        }
        return agent;
    }

    public synchronized Collection<AgentState> getAgents() {
        return List.copyOf(agents.values());
    }

    /** @return false if the agent id is unknown */
    public synchronized boolean updateAgentStatus(String agentId, AgentStatus newStatus) {
        AgentState agent = agents.get(agentId);
        if (agent == null) {
            log.warn("Status update for unknown agent {}", agentId);
            return false;
        }
        agent.setStatus(newStatus);
        touch();
        return true;
    }

    /**
     * Record a task assignment. Always appends to the agent's task history,
     * even for a task it already had, and marks the agent WORKING.
     */
    public synchronized boolean assignTaskToAgent(String agentId, UUID taskId) {
        AgentState agent = agents.get(agentId);
        if (agent == null) {
            log.warn("Task {} assigned to unknown agent {}", taskId, agentId);
            return false;
        }
        agent.assignTask(taskId);
        touch();
        return true;
    }

    public synchronized void markAgentFailed(String agentId, String errorMessage) {
        AgentState agent = agents.get(agentId);
        if (agent != null) {
            agent.setLastError(errorMessage);
            agent.setStatus(AgentStatus.ERROR);
            touch();
        }
    }

    // ------------------------------------------------------------------
    // Tasks, messages, errors
    // ------------------------------------------------------------------

    public synchronized void putTask(UUID taskId, Map<String, Object> task) {
        tasks.put(taskId, new LinkedHashMap<>(task));
        touch();
    }

    public synchronized void updateTaskStatus(UUID taskId, TaskStatus newStatus) {
        Map<String, Object> task = tasks.get(taskId);
        if (task != null) {
            task.put("status", newStatus.wireName());
            task.put("updatedAt", Instant.now().toString());
            touch();
        }
    }

    public synchronized Map<UUID, Map<String, Object>> getTasks() {
        Map<UUID, Map<String, Object>> copy = new LinkedHashMap<>();
        tasks.forEach((id, t) -> copy.put(id, Collections.unmodifiableMap(new LinkedHashMap<>(t))));
        return copy;
    }

    public synchronized void addMessage(Message message) {
        messages.add(message);
        touch();
    }

    public synchronized List<Message> getMessages() {
        return List.copyOf(messages);
    }

    public synchronized void addError(ErrorReport error) {
        errors.add(error);
        touch();
    }

    public synchronized List<ErrorReport> getErrors() {
        return List.copyOf(errors);
    }

    // ------------------------------------------------------------------
    // Workflow status
    // ------------------------------------------------------------------

    public synchronized void setStatus(SystemStatus status) {
        this.status = status;
        touch();
    }

    public synchronized void setCurrentPhase(String currentPhase) {
        this.currentPhase = currentPhase;
        touch();
    }

    public synchronized void setCheckpointId(Long checkpointId) {
        this.checkpointId = checkpointId;
        touch();
    }

    public UUID                      getProjectId()    { return projectId; }
    public synchronized SystemStatus getStatus()       { return status; }
    public synchronized String       getCurrentPhase() { return currentPhase; }
    public Instant                   getStartedAt()    { return startedAt; }
    public synchronized Instant      getUpdatedAt()    { return updatedAt; }
    public synchronized Long         getCheckpointId() { return checkpointId; }

    // ------------------------------------------------------------------
    // Serialization
    // ------------------------------------------------------------------

    /**
     * Reduce the whole state to plain data (maps, lists, strings, numbers).
     * Messages are summarised without their content.
     *
     * Never throws: any failure yields {@code {projectId, status, error}}.
     */
    public synchronized Map<String, Object> toSnapshot() {
        try {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("projectId",    projectId == null ? null : projectId.toString());
            out.put("status",       status.wireName());
            out.put("currentPhase", currentPhase);
            out.put("startedAt",    startedAt.toString());
            out.put("updatedAt",    updatedAt.toString());
            out.put("checkpointId", checkpointId);

            Map<String, Object> agentMaps = new LinkedHashMap<>();
            agents.forEach((id, a) -> agentMaps.put(id, a.toMap()));
            out.put("agents", agentMaps);

            Map<String, Object> taskMaps = new LinkedHashMap<>();
            tasks.forEach((id, t) -> taskMaps.put(id.toString(), new LinkedHashMap<>(t)));
            out.put("tasks", taskMaps);

            out.put("messages", messages.stream().map(m -> m.toMap(false)).toList());
            out.put("errors",   errors.stream().map(ErrorReport::toMap).toList());
            return out;
        } catch (RuntimeException e) {
            log.warn("Could not build system snapshot for project {}: {}", projectId, e.getMessage());
            return fallbackSnapshot(projectId, status, e);
        }
    }

    public static Map<String, Object> fallbackSnapshot(UUID projectId, SystemStatus status, Throwable error) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("projectId", projectId == null ? null : projectId.toString());
        out.put("status",    status == null ? null : status.wireName());
        out.put("error",     String.valueOf(error.getMessage()));
        return out;
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }
}
