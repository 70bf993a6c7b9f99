package com.devcrew.orchestrator.workflow.handler;

import com.devcrew.orchestrator.agent.DocumentationAgent;
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

/** tested_implementation or task → technical docs + user guide → {@code documentation} to the project manager. */
@Component
public class DocumentationHandler implements RoleHandler {

    private final DocumentationAgent agent;

    public DocumentationHandler(DocumentationAgent agent) {
        this.agent = agent;
    }

    @Override
    public AgentRole role() {
        return AgentRole.DOCUMENTATION;
    }

    @Override
    public Set<MessageType> handledTypes() {
        return Set.of(MessageType.TESTED_IMPLEMENTATION, MessageType.TASK);
    }

    @Override
    public void handle(Message message, TurnContext ctx) {
        UUID taskId = message.getTaskId();
        Map<String, Object> payload = Payloads.asMap(message.getContent());
        Map<String, Object> task;
        if (message.getMessageType() == MessageType.TASK) {
            task = payload;
            payload.putIfAbsent("task_id", payload.get("id"));
            ctx.updateTaskStatus(taskId, TaskStatus.IN_PROGRESS);
        } else {
            task = ctx.task(taskId);
        }

        Map<String, Object> analysis = agent.analyzeImplementation(payload);
        ctx.recordOutput(taskId, "documentation_analysis", analysis);
        Map<String, Object> technical = agent.writeTechnicalDocs(analysis, task);
        ctx.recordOutput(taskId, "technical_documentation", technical);
        Map<String, Object> guide = agent.writeUserGuide(task, technical);
        ctx.recordOutput(taskId, "user_guide", guide);

        Map<String, Object> documentation = new LinkedHashMap<>();
        documentation.put("task_id",        taskId == null ? null : taskId.toString());
        documentation.put("technical_docs", technical);
        documentation.put("user_guide",     guide);

        ctx.accumulate(Accumulator.DOCUMENTATION, documentation);
        ctx.send(AgentRole.PROJECT_MANAGER, MessageType.DOCUMENTATION, documentation, taskId);
        ctx.routeTo(AgentRole.PROJECT_MANAGER);
    }
}
