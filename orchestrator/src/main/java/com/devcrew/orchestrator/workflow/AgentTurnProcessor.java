package com.devcrew.orchestrator.workflow;

import com.devcrew.orchestrator.messaging.Message;
import com.devcrew.orchestrator.messaging.MessageBus;
import com.devcrew.orchestrator.model.AgentRole;
import com.devcrew.orchestrator.model.AgentStatus;
import com.devcrew.orchestrator.model.MessageType;
import com.devcrew.orchestrator.persistence.PersistenceStore;
import com.devcrew.orchestrator.state.AgentState;
import com.devcrew.orchestrator.state.ErrorReport;
import com.devcrew.orchestrator.state.SystemState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs one agent turn: deliver the agent's unread mail to its role handler.
 *
 * <p>All {@link RoleHandler} beans are collected at startup into a dispatch
 * table keyed by role. A turn:
 * <ol>
 *   <li>marks the agent WORKING and fetches its unread messages without marking them;</li>
 *   <li>with no mail, marks the agent IDLE and returns an idle result;</li>
 *   <li>otherwise marks each message read as it is dispatched, hands it to the
 *       handler if its type is handled and marks it processed; other types are
 *       acknowledged unhandled;</li>
 *   <li>marks the agent IDLE and returns the collected result.</li>
 * </ol>
 *
 * <p>A handler exception never leaves the turn. It becomes an
 * {@link ErrorReport} (persisted if possible), the agent is marked ERROR,
 * an {@code error} message goes to the error-handling agent (to the project
 * manager if error handling itself failed) and the result routes there.
 * The failing message stays read but unprocessed; messages after it stay
 * unread for a later turn. Error handling may redeliver the failing one.
 *
 * <p>Every turn is timed and counted:
 * <pre>
 *   devcrew.turn.duration{role}
 *   devcrew.turn.calls{role, outcome="success|idle|error"}
 * </pre>
 */
@Component
public class AgentTurnProcessor {

    private static final Logger log = LoggerFactory.getLogger(AgentTurnProcessor.class);

    private final Map<AgentRole, RoleHandler> handlers = new EnumMap<>(AgentRole.class);
    private final PersistenceStore store;
    private final MeterRegistry    meterRegistry;

    public AgentTurnProcessor(List<RoleHandler> allHandlers,
                              PersistenceStore store,
                              MeterRegistry meterRegistry) {
        this.store         = store;
        this.meterRegistry = meterRegistry;
        for (RoleHandler handler : allHandlers) {
            RoleHandler previous = handlers.putIfAbsent(handler.role(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for role " + handler.role().wireName() + ": "
                        + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
            log.info("Registered handler {} for role '{}' (handles {})",
                    handler.getClass().getSimpleName(), handler.role().wireName(), handler.handledTypes());
        }
    }

    public boolean handles(AgentRole role) {
        return handlers.containsKey(role);
    }

    // ------------------------------------------------------------------
    // Turn
    // ------------------------------------------------------------------

    /**
     * Run one turn for the agent registered under {@code role}.
     *
     * @throws IllegalStateException if no agent or no handler exists for the role
     */
    public TurnResult runTurn(AgentRole role, SystemState state, MessageBus bus) {
        RoleHandler handler = handlers.get(role);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for role " + role.wireName());
        }
        AgentState agent = state.requireAgent(role);
        String agentId = agent.getAgentId();

        MDC.put("projectId", String.valueOf(state.getProjectId()));
        MDC.put("agentId",   agentId);
        MDC.put("role",      role.wireName());
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            state.updateAgentStatus(agentId, AgentStatus.WORKING);
            List<Message> inbox = bus.getUnreadMessages(agentId, false);
            if (inbox.isEmpty()) {
                state.updateAgentStatus(agentId, AgentStatus.IDLE);
                outcome = "idle";
                log.debug("No unread messages for {}", agentId);
                return TurnResult.idle(role, agentId);
            }

            log.info("Turn for {}: {} unread message(s)", agentId, inbox.size());
            TurnContext ctx = new TurnContext(agent, state, bus, store);
            int processed = 0;
            for (Message message : inbox) {
                bus.markRead(message.getId());
                try {
                    if (handler.handledTypes().contains(message.getMessageType())) {
                        handler.handle(message, ctx);
                    } else {
                        log.debug("Acknowledging {} without handling: role '{}' does not react to '{}'",
                                message.getId(), role.wireName(), message.getMessageType().wireName());
                    }
                } catch (Exception e) {
                    outcome = "error";
                    return failTurn(ctx, message, e, processed);
                }
                bus.markProcessed(message.getId());
                processed++;
            }

            state.updateAgentStatus(agentId, AgentStatus.IDLE);
            return ctx.toResult(processed, false);
        } finally {
            sample.stop(meterRegistry.timer("devcrew.turn.duration", "role", role.wireName()));
            meterRegistry.counter("devcrew.turn.calls", "role", role.wireName(), "outcome", outcome).increment();
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private TurnResult failTurn(TurnContext ctx, Message message, Exception error, int processed) {
        AgentState agent = ctx.agent();
        SystemState state = ctx.systemState();
        log.error("Agent {} failed on message {} ({}): {}",
                agent.getAgentId(), message.getId(), message.getMessageType().wireName(), error.getMessage(), error);

        ErrorReport report = ErrorReport.fromThrowable(message.getTaskId(), agent.getAgentId(), error);
        try {
            UUID recordId = store.storeError(report.taskId(), report.agentId(), report.errorType(),
                    report.errorMessage(), report.stackTrace());
            report = report.withRecordId(recordId);
        } catch (RuntimeException e) {
            log.warn("Could not persist error from {}: {}", agent.getAgentId(), e.getMessage());
        }
        state.addError(report);
        state.markAgentFailed(agent.getAgentId(), report.errorMessage());

        AgentRole target = agent.getRole() == AgentRole.ERROR_HANDLING
                ? AgentRole.PROJECT_MANAGER
                : AgentRole.ERROR_HANDLING;
        Map<String, Object> content = report.toMap();
        content.put("sourceMessageId",   message.getId());
        content.put("sourceMessageType", message.getMessageType().wireName());
        ctx.send(target, MessageType.ERROR, content, message.getTaskId());
        ctx.routeTo(target);
        return ctx.toResult(processed, true);
    }
}
