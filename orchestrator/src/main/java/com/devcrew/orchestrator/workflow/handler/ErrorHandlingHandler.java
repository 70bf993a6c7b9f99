package com.devcrew.orchestrator.workflow.handler;

import com.devcrew.orchestrator.agent.ErrorHandlingAgent;
import com.devcrew.orchestrator.messaging.Message;
import com.devcrew.orchestrator.messaging.MessageBus;
import com.devcrew.orchestrator.model.AgentRole;
import com.devcrew.orchestrator.model.ErrorStatus;
import com.devcrew.orchestrator.model.MessageType;
import com.devcrew.orchestrator.model.TaskStatus;
import com.devcrew.orchestrator.state.Accumulator;
import com.devcrew.orchestrator.workflow.Payloads;
import com.devcrew.orchestrator.workflow.RoleHandler;
import com.devcrew.orchestrator.workflow.TurnContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Resolves reported errors.
 *
 * The error record is marked resolved, a blocked task is unblocked, and an
 * {@code error_resolution} goes to the reporter and to the project manager
 * (once, when the reporter is the project manager). Control then returns to
 * the reporter's role.
 *
 * <p>Errors raised by a failed turn carry {@code sourceMessageId}. The failed
 * message is redelivered to the reporter so the work is redone, up to
 * {@link #MAX_DELIVERY_ATTEMPTS} deliveries in total. Past that the task is
 * marked {@code error}, the error record stays open and control goes to the
 * project manager.
 */
@Component
public class ErrorHandlingHandler implements RoleHandler {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandlingHandler.class);

    public static final int MAX_DELIVERY_ATTEMPTS = 2;

    static final String RESOLVED  = "resolved";
    static final String ABANDONED = "abandoned";

    private final ErrorHandlingAgent agent;

    public ErrorHandlingHandler(ErrorHandlingAgent agent) {
        this.agent = agent;
    }

    @Override
    public AgentRole role() {
        return AgentRole.ERROR_HANDLING;
    }

    @Override
    public Set<MessageType> handledTypes() {
        return Set.of(MessageType.ERROR);
    }

    @Override
    public void handle(Message message, TurnContext ctx) {
        UUID taskId = message.getTaskId();
        String reporter = message.getSenderId();
        Map<String, Object> errorData = Payloads.asMap(message.getContent());

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("reporter",  reporter);
        context.put("taskId",    taskId == null ? null : taskId.toString());
        context.put("projectId", String.valueOf(ctx.projectId()));
        context.put("task",      ctx.task(taskId));

        Map<String, Object> result = agent.handleError(errorData, context);
        ctx.recordOutput(taskId, "error_handling", result);
        String resolution = String.valueOf(result.getOrDefault("resolution", "resolved"));

        UUID errorId = Payloads.uuid(errorData.get("errorId"));
        Object sourceId = errorData.get("sourceMessageId");
        Optional<Message> retry = Optional.empty();
        boolean abandoned = false;
        if (sourceId != null) {
            Optional<Message> source = ctx.findMessage(sourceId.toString());
            if (source.isPresent() && MessageBus.deliveryAttempt(source.get()) < MAX_DELIVERY_ATTEMPTS) {
                retry = ctx.redeliver(sourceId.toString());
            }
            abandoned = retry.isEmpty();
        }

        if (abandoned) {
            log.warn("Giving up on message {} from {}: delivery attempts exhausted", sourceId, reporter);
            ctx.updateTaskStatus(taskId, TaskStatus.ERROR);
        } else {
            if (errorId != null) {
                ctx.store().updateErrorStatus(errorId, ErrorStatus.RESOLVED, resolution, Instant.now());
            } else {
                log.warn("Error message {} has no persisted error id; store not updated", message.getId());
            }
            if (taskId != null && ctx.store().getTask(taskId)
                    .filter(t -> t.getStatus() == TaskStatus.BLOCKED).isPresent()) {
                ctx.updateTaskStatus(taskId, TaskStatus.IN_PROGRESS);
            }
        }

        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("error_id",   errorId == null ? null : errorId.toString());
        reply.put("task_id",    taskId == null ? null : taskId.toString());
        reply.put("status",     abandoned ? ABANDONED : RESOLVED);
        reply.put("resolution", resolution);
        reply.put("result",     result);
        retry.ifPresent(m -> reply.put("redelivered_message_id", m.getId()));
        ctx.accumulate(Accumulator.ERROR_HANDLING_RESULTS, reply);

        AgentRole reporterRole = AgentRole.fromAgentId(reporter);
        if (!AgentRole.SYSTEM_SENDER.equals(reporter)) {
            ctx.sendTo(reporter, MessageType.ERROR_RESOLUTION, reply, taskId);
        }
        if (reporterRole != AgentRole.PROJECT_MANAGER || AgentRole.SYSTEM_SENDER.equals(reporter)) {
            ctx.send(AgentRole.PROJECT_MANAGER, MessageType.ERROR_RESOLUTION, reply, taskId);
        }
        AgentRole next = abandoned ? AgentRole.PROJECT_MANAGER : reporterRole;
        log.info("{} error {} from {}; control goes to {}",
                abandoned ? "Abandoned" : "Resolved", errorId, reporter, next.wireName());
        ctx.routeTo(next);
    }
}
