package com.devcrew.orchestrator.workflow.handler;

import com.devcrew.orchestrator.agent.TestingAgent;
import com.devcrew.orchestrator.messaging.Message;
import com.devcrew.orchestrator.model.AgentRole;
import com.devcrew.orchestrator.model.MessageType;
import com.devcrew.orchestrator.model.TaskStatus;
import com.devcrew.orchestrator.state.Accumulator;
import com.devcrew.orchestrator.state.ErrorReport;
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
 * Generates, runs and reports tests for whatever reaches the testing role.
 *
 * A fully passing run is forwarded to documentation. Any failure is stored
 * as a {@code TestFailure} error, blocks the task and goes to error handling
 * instead. When the fix comes back as {@code error_resolution}, the task
 * proceeds to documentation with the resolution attached, unless the
 * resolution redelivered the failed message or abandoned the task.
 */
@Component
public class TestingHandler implements RoleHandler {

    private static final Logger log = LoggerFactory.getLogger(TestingHandler.class);

    static final String TEST_FAILURE = "TestFailure";

    private final TestingAgent agent;

    public TestingHandler(TestingAgent agent) {
        this.agent = agent;
    }

    @Override
    public AgentRole role() {
        return AgentRole.TESTING;
    }

    @Override
    public Set<MessageType> handledTypes() {
        return Set.of(MessageType.IMPLEMENTATION, MessageType.INTEGRATED_SYSTEM,
                MessageType.TASK, MessageType.ERROR_RESOLUTION);
    }

    @Override
    public void handle(Message message, TurnContext ctx) {
        if (message.getMessageType() == MessageType.ERROR_RESOLUTION) {
            forwardResolved(message, ctx);
        } else {
            runTests(message, ctx);
        }
    }

    // ------------------------------------------------------------------
    // Test run
    // ------------------------------------------------------------------

    @SuppressWarnings("unchecked")
    private void runTests(Message message, TurnContext ctx) {
        UUID taskId = message.getTaskId();
        Map<String, Object> subject = Payloads.asMap(message.getContent());
        if (message.getMessageType() == MessageType.TASK) {
            ctx.updateTaskStatus(taskId, TaskStatus.IN_PROGRESS);
            subject.putIfAbsent("task_id", subject.get("id"));
        }

        Map<String, Object> tests = agent.generateTests(subject);
        ctx.recordOutput(taskId, "test_cases", tests);
        Map<String, Object> results = agent.executeTests(tests);
        ctx.recordOutput(taskId, "test_results", results);
        Map<String, Object> report = agent.createReport(results);
        ctx.recordOutput(taskId, "test_report", report);
        ctx.accumulate(Accumulator.TEST_REPORTS, report);

        List<Object> failed = (List<Object>) report.getOrDefault("failed_tests", List.of());
        if (!failed.isEmpty()) {
            reportFailure(message, ctx, subject, report, failed.size());
            return;
        }

        Map<String, Object> tested = new LinkedHashMap<>();
        tested.put("task_id",        taskId == null ? null : taskId.toString());
        tested.put("implementation", subject);
        tested.put("test_report",    report);
        ctx.send(AgentRole.DOCUMENTATION, MessageType.TESTED_IMPLEMENTATION, tested, taskId);
        ctx.routeTo(AgentRole.DOCUMENTATION);
    }

    private void reportFailure(Message message, TurnContext ctx, Map<String, Object> subject,
                               Map<String, Object> report, int failedCount) {
        UUID taskId = message.getTaskId();
        String agentId = ctx.agent().getAgentId();
        String errorMessage = failedCount + " test(s) failed";
        String details = String.valueOf(report.get("failed_tests"));

        UUID errorId = ctx.store().storeError(taskId, agentId, TEST_FAILURE, errorMessage, details);
        ErrorReport error = ErrorReport.of(errorId, taskId, agentId, TEST_FAILURE, errorMessage, details);
        ctx.systemState().addError(error);
        ctx.updateTaskStatus(taskId, TaskStatus.BLOCKED);
        log.warn("Task {} blocked: {}", taskId, errorMessage);

        Map<String, Object> content = error.toMap();
        content.put("test_report",    report);
        content.put("implementation", subject);
        ctx.send(AgentRole.ERROR_HANDLING, MessageType.ERROR, content, taskId);
        ctx.routeTo(AgentRole.ERROR_HANDLING);
    }

    // ------------------------------------------------------------------
    // Fix received
    // ------------------------------------------------------------------

    private void forwardResolved(Message message, TurnContext ctx) {
        UUID taskId = message.getTaskId();
        if (taskId == null) {
            log.info("Resolution {} acknowledged; it is not tied to a task", message.getId());
            return;
        }
        Map<String, Object> resolution = Payloads.asMap(message.getContent());
        // a redelivered message reruns the tests itself; an abandoned task goes nowhere
        if (resolution.containsKey("redelivered_message_id")
                || ErrorHandlingHandler.ABANDONED.equals(resolution.get("status"))) {
            log.info("Resolution {} for task {} acknowledged without forwarding", message.getId(), taskId);
            return;
        }
        Map<String, Object> tested = new LinkedHashMap<>();
        tested.put("task_id",    taskId.toString());
        tested.put("task",       ctx.task(taskId));
        tested.put("resolution", resolution);
        ctx.send(AgentRole.DOCUMENTATION, MessageType.TESTED_IMPLEMENTATION, tested, taskId);
        ctx.routeTo(AgentRole.DOCUMENTATION);
    }
}
