package com.devcrew.orchestrator.workflow.handler;

import com.devcrew.orchestrator.agent.UiUxAgent;
import com.devcrew.orchestrator.messaging.Message;
import com.devcrew.orchestrator.model.AgentRole;
import com.devcrew.orchestrator.model.MessageType;
import com.devcrew.orchestrator.model.TaskStatus;
import com.devcrew.orchestrator.state.Accumulator;
import com.devcrew.orchestrator.workflow.Payloads;
import com.devcrew.orchestrator.workflow.RoleHandler;
import com.devcrew.orchestrator.workflow.TurnContext;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/** task → design, responsive layout, accessibility → {@code ui_implementation} to integration. */
@Component
public class UiUxHandler implements RoleHandler {

    private final UiUxAgent agent;

    public UiUxHandler(UiUxAgent agent) {
        this.agent = agent;
    }

    @Override
    public AgentRole role() {
        return AgentRole.UI_UX;
    }

    @Override
    public Set<MessageType> handledTypes() {
        return Set.of(MessageType.TASK);
    }

    @Override
    public void handle(Message message, TurnContext ctx) {
        UUID taskId = message.getTaskId();
        Map<String, Object> task = Payloads.asMap(message.getContent());
        ctx.updateTaskStatus(taskId, TaskStatus.IN_PROGRESS);

        Map<String, Object> design = agent.designInterface(task);
        ctx.recordOutput(taskId, "ui_design", design);
        Map<String, Object> responsive = agent.makeResponsive(design);
        ctx.recordOutput(taskId, "responsive_design", responsive);
        Map<String, Object> accessibility = agent.checkAccessibility(responsive);
        ctx.recordOutput(taskId, "accessibility_report", accessibility);

        Map<String, Object> uiImplementation = new LinkedHashMap<>();
        uiImplementation.put("task_id",       task.get("id"));
        uiImplementation.put("task",          task);
        uiImplementation.put("design",        responsive);
        uiImplementation.put("accessibility", accessibility);

        ctx.accumulate(Accumulator.UI_IMPLEMENTATIONS, uiImplementation);
        ctx.send(AgentRole.INTEGRATION, MessageType.UI_IMPLEMENTATION, uiImplementation, taskId);
        ctx.routeTo(AgentRole.INTEGRATION);
    }
}
