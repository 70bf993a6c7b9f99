package com.devcrew.orchestrator.workflow.handler;

import com.devcrew.orchestrator.agent.IntegrationAgent;
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
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Combines an implementation, a UI implementation or a directly assigned
 * integration task into an {@code integrated_system} for testing.
 */
@Component
public class IntegrationHandler implements RoleHandler {

    private final IntegrationAgent agent;

    public IntegrationHandler(IntegrationAgent agent) {
        this.agent = agent;
    }

    @Override
    public AgentRole role() {
        return AgentRole.INTEGRATION;
    }

    @Override
    public Set<MessageType> handledTypes() {
        return Set.of(MessageType.IMPLEMENTATION, MessageType.UI_IMPLEMENTATION, MessageType.TASK);
    }

    @Override
    public void handle(Message message, TurnContext ctx) {
        UUID taskId = message.getTaskId();
        Map<String, Object> payload = Payloads.asMap(message.getContent());
        Map<String, Object> task;
        if (message.getMessageType() == MessageType.TASK) {
            task = payload;
            ctx.updateTaskStatus(taskId, TaskStatus.IN_PROGRESS);
        } else {
            task = ctx.task(taskId);
        }

        List<Map<String, Object>> components = List.of(payload);
        Map<String, Object> analysis = agent.analyzeComponents(components);
        ctx.recordOutput(taskId, "component_analysis", analysis);
        Map<String, Object> dataFlow = agent.designDataFlow(analysis, task);
        ctx.recordOutput(taskId, "data_flow", dataFlow);
        Map<String, Object> connectors = agent.createApiConnectors(analysis, task);
        ctx.recordOutput(taskId, "api_connectors", connectors);

        Map<String, Object> integrated = new LinkedHashMap<>();
        integrated.put("task_id",        taskId == null ? null : taskId.toString());
        integrated.put("source_type",    message.getMessageType().wireName());
        integrated.put("components",     components);
        integrated.put("analysis",       analysis);
        integrated.put("data_flow",      dataFlow);
        integrated.put("api_connectors", connectors);

        ctx.accumulate(Accumulator.INTEGRATED_SYSTEMS, integrated);
        ctx.send(AgentRole.TESTING, MessageType.INTEGRATED_SYSTEM, integrated, taskId);
        ctx.routeTo(AgentRole.TESTING);
    }
}
