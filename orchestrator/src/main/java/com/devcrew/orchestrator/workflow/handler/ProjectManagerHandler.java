package com.devcrew.orchestrator.workflow.handler;

import com.devcrew.orchestrator.agent.ProjectManagerAgent;
import com.devcrew.orchestrator.messaging.Message;
import com.devcrew.orchestrator.model.*;
import com.devcrew.orchestrator.persistence.PersistenceStore;
import com.devcrew.orchestrator.persistence.ProjectUpdate;
import com.devcrew.orchestrator.persistence.TaskUpdate;
import com.devcrew.orchestrator.state.Accumulator;
import com.devcrew.orchestrator.state.SystemState;
import com.devcrew.orchestrator.workflow.Payloads;
import com.devcrew.orchestrator.workflow.RoleHandler;
import com.devcrew.orchestrator.workflow.TurnContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Project manager turn logic.
 *
 * <ul>
 *   <li>requirements: plan, persist and assign tasks, one {@code task} message per task;</li>
 *   <li>documentation: the task is done; once every task is done the workflow parks;</li>
 *   <li>error_resolution: recorded;</li>
 *   <li>error: an error the error-handling role could not handle itself, escalated.</li>
 * </ul>
 */
@Component
public class ProjectManagerHandler implements RoleHandler {

    private static final Logger log = LoggerFactory.getLogger(ProjectManagerHandler.class);

    private final ProjectManagerAgent agent;

    public ProjectManagerHandler(ProjectManagerAgent agent) {
        this.agent = agent;
    }

    @Override
    public AgentRole role() {
        return AgentRole.PROJECT_MANAGER;
    }

    @Override
    public Set<MessageType> handledTypes() {
        return Set.of(MessageType.REQUIREMENTS, MessageType.DOCUMENTATION,
                MessageType.ERROR_RESOLUTION, MessageType.ERROR);
    }

    @Override
    public void handle(Message message, TurnContext ctx) {
        switch (message.getMessageType()) {
            case REQUIREMENTS     -> planTasks(message, ctx);
            case DOCUMENTATION    -> completeTask(message, ctx);
            case ERROR_RESOLUTION -> ctx.recordOutput(message.getTaskId(), "error_resolution_ack",
                                            Payloads.asMap(message.getContent()));
            case ERROR            -> escalate(message, ctx);
            default -> throw new IllegalArgumentException("Unexpected message type " + message.getMessageType());
        }
    }

    // ------------------------------------------------------------------
    // requirements → tasks
    // ------------------------------------------------------------------

    private void planTasks(Message message, TurnContext ctx) {
        String requirements = requirementsText(message.getContent());
        Map<String, Object> parsed = agent.parseRequirements(requirements);
        ctx.recordOutput(null, "requirements_analysis", parsed);

        List<Map<String, Object>> assigned = agent.assignTasks(agent.createTaskBreakdown(parsed));

        PersistenceStore store = ctx.store();
        SystemState state = ctx.systemState();
        AgentRole first = null;
        for (Map<String, Object> planned : assigned) {
            AgentRole role = AgentRole.fromWireName(String.valueOf(planned.get("assigned_agent")));
            String title = String.valueOf(planned.get("title"));
            String description = (String) planned.get("description");

            UUID taskId = store.createTask(ctx.projectId(), title, description, role);
            store.updateTask(taskId, TaskUpdate.status(TaskStatus.ASSIGNED));

            Map<String, Object> task = new LinkedHashMap<>(planned);
            task.put("id",         taskId.toString());
            task.put("project_id", String.valueOf(ctx.projectId()));
            task.put("status",     TaskStatus.ASSIGNED.wireName());
            state.putTask(taskId, task);
            state.assignTaskToAgent(state.requireAgent(role).getAgentId(), taskId);

            ctx.send(role, MessageType.TASK, task, taskId);
            ctx.accumulate(Accumulator.TASKS, task);

            if (first == null || role.ordinal() < first.ordinal()) {
                first = role;
            }
        }
        log.info("Planned {} task(s) for project {}", assigned.size(), ctx.projectId());
        ctx.routeTo(first == null ? AgentRole.PROJECT_MANAGER : first);
    }

    @SuppressWarnings("unchecked")
    private static String requirementsText(Object content) {
        if (content instanceof Map) {
            Object text = ((Map<String, Object>) content).get("requirements");
            return text == null ? "" : text.toString();
        }
        return content == null ? "" : content.toString();
    }

    // ------------------------------------------------------------------
    // documentation → task complete
    // ------------------------------------------------------------------

    private void completeTask(Message message, TurnContext ctx) {
        UUID taskId = message.getTaskId();
        if (taskId == null) {
            log.warn("Documentation message {} carries no task id; nothing to complete", message.getId());
            return;
        }
        ctx.updateTaskStatus(taskId, TaskStatus.COMPLETED);

        List<Task> tasks = ctx.store().getTasksByProject(ctx.projectId());
        long open = tasks.stream().filter(t -> t.getStatus() != TaskStatus.COMPLETED).count();
        if (!tasks.isEmpty() && open == 0) {
            ctx.store().updateProject(ctx.projectId(), ProjectUpdate.status(ProjectStatus.COMPLETED));
            log.info("All {} task(s) of project {} completed", tasks.size(), ctx.projectId());
            ctx.park();
        } else {
            log.info("Task {} completed, {} task(s) still open", taskId, open);
        }
    }

    // ------------------------------------------------------------------
    // error → escalation
    // ------------------------------------------------------------------

    private void escalate(Message message, TurnContext ctx) {
        Map<String, Object> error = Payloads.asMap(message.getContent());
        log.warn("Escalated error from {}: {}", message.getSenderId(), error.get("errorMessage"));
        ctx.updateTaskStatus(message.getTaskId(), TaskStatus.ERROR);

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("task_id",  message.getTaskId() == null ? null : message.getTaskId().toString());
        entry.put("error_id", error.get("errorId"));
        entry.put("status",   "escalated");
        ctx.accumulate(Accumulator.ERROR_HANDLING_RESULTS, entry);
    }
}
