package com.devcrew.orchestrator.state;

import com.devcrew.orchestrator.model.AgentRole;
import com.devcrew.orchestrator.model.AgentStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runtime status of one agent instance.
 *
 * A fresh AgentState (with a fresh id) is created for every role each time
 * a workflow is initialised or reset. taskHistory is append-only and keeps
 * duplicates when a task is assigned twice.
 */
public class AgentState {

    private final String    agentId;
    private final AgentRole role;

    private AgentStatus  status = AgentStatus.IDLE;
    private UUID         currentTaskId;
    private final List<UUID> taskHistory = new ArrayList<>();
    private Instant      lastActive = Instant.now();
    private String       lastError;

    public AgentState(String agentId, AgentRole role) {
        this.agentId = agentId;
        this.role    = role;
    }

    /** New agent for the given role with an id of the form {@code <role>_<8 hex chars>}. */
    public static AgentState create(AgentRole role) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return new AgentState(role.wireName() + "_" + suffix, role);
    }

    // ------------------------------------------------------------------
    // Transitions (no illegal-transition checks, callers drive them)
    // ------------------------------------------------------------------

    void setStatus(AgentStatus status) {
        this.status     = status;
        this.lastActive = Instant.now();
    }

    void assignTask(UUID taskId) {
        this.currentTaskId = taskId;
        this.taskHistory.add(taskId);
        setStatus(AgentStatus.WORKING);
    }

    void setLastError(String lastError) {
        this.lastError = lastError;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String      getAgentId()       { return agentId; }
    public AgentRole   getRole()          { return role; }
    public AgentStatus getStatus()        { return status; }
    public UUID        getCurrentTaskId() { return currentTaskId; }
    public List<UUID>  getTaskHistory()   { return Collections.unmodifiableList(taskHistory); }
    public Instant     getLastActive()    { return lastActive; }
    public String      getLastError()     { return lastError; }

    Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("agentId",       agentId);
        out.put("agentType",     role.wireName());
        out.put("status",        status.wireName());
        out.put("currentTaskId", currentTaskId == null ? null : currentTaskId.toString());
        out.put("taskHistory",   taskHistory.stream().map(UUID::toString).toList());
        out.put("lastActive",    lastActive.toString());
        out.put("lastError",     lastError);
        return out;
    }
}
