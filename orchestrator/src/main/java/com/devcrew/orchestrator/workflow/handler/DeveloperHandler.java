package com.devcrew.orchestrator.workflow.handler;

import com.devcrew.orchestrator.agent.DeveloperAgent;
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

/** task → analyze, generate, document → {@code implementation} to testing. */
@Component
public class DeveloperHandler implements RoleHandler {

    private final DeveloperAgent agent;

    public DeveloperHandler(DeveloperAgent agent) {
        this.agent = agent;
    }

    @Override
    public AgentRole role() {
        return AgentRole.DEVELOPER;
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

        Map<String, Object> analysis = agent.analyzeTask(task);
        ctx.recordOutput(taskId, "analysis", analysis);
        Map<String, Object> code = agent.generateCode(task, analysis);
        ctx.recordOutput(taskId, "code", code);
        Map<String, Object> docs = agent.documentCode(code);
        ctx.recordOutput(taskId, "code_documentation", docs);

        Map<String, Object> implementation = new LinkedHashMap<>();
        implementation.put("task_id",       task.get("id"));
        implementation.put("task",          task);
        implementation.put("analysis",      analysis);
        implementation.put("code",          code);
        implementation.put("documentation", docs);

        ctx.accumulate(Accumulator.IMPLEMENTATIONS, implementation);
        ctx.send(AgentRole.TESTING, MessageType.IMPLEMENTATION, implementation, taskId);
        ctx.routeTo(AgentRole.TESTING);
    }
}
