package com.devcrew.orchestrator.workflow;

import com.devcrew.orchestrator.messaging.Message;
import com.devcrew.orchestrator.messaging.MessageBus;
import com.devcrew.orchestrator.model.AgentRole;
import com.devcrew.orchestrator.model.MessageType;
import com.devcrew.orchestrator.model.TaskStatus;
import com.devcrew.orchestrator.persistence.PersistenceStore;
import com.devcrew.orchestrator.persistence.TaskUpdate;
import com.devcrew.orchestrator.state.Accumulator;
import com.devcrew.orchestrator.state.AgentState;
import com.devcrew.orchestrator.state.SystemState;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Everything a {@link RoleHandler} may touch during one turn.
 *
 * Outgoing messages are sent as the current agent and also appended to the
 * system message log. Accumulator entries and the routing decision are
 * collected here and handed to the orchestrator as a {@link TurnResult}.
 */
public class TurnContext {

    private final AgentState       agent;
    private final SystemState      systemState;
    private final MessageBus       bus;
    private final PersistenceStore store;

    private final EnumMap<Accumulator, List<Map<String, Object>>> additions = new EnumMap<>(Accumulator.class);
    private AgentRole next;
    private boolean   parked;

    TurnContext(AgentState agent, SystemState systemState, MessageBus bus, PersistenceStore store) {
        this.agent       = agent;
        this.systemState = systemState;
        this.bus         = bus;
        this.store       = store;
    }

    public AgentState       agent()       { return agent; }
    public SystemState      systemState() { return systemState; }
    public PersistenceStore store()       { return store; }
    public UUID             projectId()   { return systemState.getProjectId(); }

    // ------------------------------------------------------------------
    // Messaging
    // ------------------------------------------------------------------

    /** Send to the agent currently registered for a role. */
    public String send(AgentRole to, MessageType type, Object content, UUID taskId) {
        return sendTo(systemState.requireAgent(to).getAgentId(), type, content, taskId);
    }

    public String sendTo(String receiverId, MessageType type, Object content, UUID taskId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("senderRole", agent.getRole().wireName());
        Message message = new Message(agent.getAgentId(), receiverId, content, type,
                taskId, projectId(), metadata);
        bus.send(message);
        systemState.addMessage(message);
        return message.getId();
    }

    public Optional<Message> findMessage(String messageId) {
        return bus.findMessage(messageId);
    }

    /** Put a fresh copy of an earlier message back in its receiver's mailbox. */
    public Optional<Message> redeliver(String messageId) {
        Optional<Message> copy = bus.redeliver(messageId);
        copy.ifPresent(systemState::addMessage);
        return copy;
    }

    // ------------------------------------------------------------------
    // Persistence helpers
    // ------------------------------------------------------------------

    /** Persist one stage output of the current agent. */
    public UUID recordOutput(UUID taskId, String outputType, Map<String, Object> content) {
        return store.storeAgentOutput(taskId, agent.getAgentId(), outputType, content);
    }

    /** Update a task in the store and in the live task registry. No-op for a null id. */
    public void updateTaskStatus(UUID taskId, TaskStatus status) {
        if (taskId == null) {
            return;
        }
        store.updateTask(taskId, TaskUpdate.status(status));
        systemState.updateTaskStatus(taskId, status);
    }

    /** The live task tree for an id, or an empty map when unknown. */
    public Map<String, Object> task(UUID taskId) {
        if (taskId == null) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> task = systemState.getTasks().get(taskId);
        return task == null ? new LinkedHashMap<>() : new LinkedHashMap<>(task);
    }

    // ------------------------------------------------------------------
    // Workflow state and routing
    // ------------------------------------------------------------------

    public void accumulate(Accumulator accumulator, Map<String, Object> entry) {
        additions.computeIfAbsent(accumulator, k -> new ArrayList<>()).add(entry);
    }

    public void routeTo(AgentRole role) {
        this.next = role;
    }

    /** Signal that the workflow is finished; the scheduler stops picking roles. */
    public void park() {
        this.parked = true;
    }

    TurnResult toResult(int processed, boolean failed) {
        return new TurnResult(agent.getRole(), agent.getAgentId(), processed,
                new EnumMap<>(additions), next, parked, failed);
    }
}
