package com.devcrew.orchestrator.workflow.handler;

import com.devcrew.orchestrator.messaging.Message;
import com.devcrew.orchestrator.messaging.MessageBus;
import com.devcrew.orchestrator.model.*;
import com.devcrew.orchestrator.persistence.TaskUpdate;
import com.devcrew.orchestrator.state.Accumulator;
import com.devcrew.orchestrator.state.SystemState;
import com.devcrew.orchestrator.workflow.CrewFixtures;
import com.devcrew.orchestrator.workflow.TurnResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorHandlingHandlerTest {

    CrewFixtures crew;
    UUID projectId;
    SystemState state;
    MessageBus bus;
    String ehId;

    @BeforeEach
    void setUp() {
        crew = new CrewFixtures();
        projectId = crew.store.createProject("Errors", null);
        state = crew.systemState(projectId);
        bus = crew.bus();
        ehId = state.requireAgent(AgentRole.ERROR_HANDLING).getAgentId();
    }

    @Test
    void resolvesErrorUnblocksTaskAndRepliesToReporterAndManager() {
        UUID taskId = crew.store.createTask(projectId, "Implement login feature", null, AgentRole.DEVELOPER);
        crew.store.updateTask(taskId, TaskUpdate.status(TaskStatus.BLOCKED));
        String qaId = state.requireAgent(AgentRole.TESTING).getAgentId();
        UUID errorId = crew.store.storeError(taskId, qaId, "TestFailure", "1 test(s) failed", null);
        bus.send(new Message(qaId, ehId, Map.of("errorId", errorId.toString(), "errorType", "TestFailure"),
                MessageType.ERROR, taskId, projectId, null));

        TurnResult result = crew.processor().runTurn(AgentRole.ERROR_HANDLING, state, bus);

        assertThat(result.next()).isEqualTo(AgentRole.TESTING);
        assertThat(crew.store.getError(errorId).orElseThrow().getStatus()).isEqualTo(ErrorStatus.RESOLVED);
        assertThat(crew.store.getTask(taskId).orElseThrow().getStatus()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(result.additions().get(Accumulator.ERROR_HANDLING_RESULTS)).singleElement()
                .satisfies(r -> assertThat(r).containsEntry("error_id", errorId.toString()));

        String pmId = state.requireAgent(AgentRole.PROJECT_MANAGER).getAgentId();
        assertThat(bus.getUnreadMessages(qaId, false)).extracting(Message::getMessageType)
                .containsExactly(MessageType.ERROR_RESOLUTION);
        assertThat(bus.getUnreadMessages(pmId, false)).extracting(Message::getMessageType)
                .containsExactly(MessageType.ERROR_RESOLUTION);
    }

    @Test
    void failedTurn_redeliversSourceMessageToReporter() {
        UUID taskId = crew.store.createTask(projectId, "Implement login feature", null, AgentRole.DEVELOPER);
        crew.store.updateTask(taskId, TaskUpdate.status(TaskStatus.IN_PROGRESS));
        String devId = state.requireAgent(AgentRole.DEVELOPER).getAgentId();
        String source = bus.send(new Message("project_manager_1", devId, Map.of("id", taskId.toString()),
                MessageType.TASK, taskId, projectId, null));
        bus.markRead(source);
        UUID errorId = crew.store.storeError(taskId, devId, "IllegalStateException", "compiler unavailable", null);
        bus.send(new Message(devId, ehId, Map.of("errorId", errorId.toString(), "sourceMessageId", source),
                MessageType.ERROR, taskId, projectId, null));

        TurnResult result = crew.processor().runTurn(AgentRole.ERROR_HANDLING, state, bus);

        assertThat(result.next()).isEqualTo(AgentRole.DEVELOPER);
        assertThat(crew.store.getError(errorId).orElseThrow().getStatus()).isEqualTo(ErrorStatus.RESOLVED);
        List<Message> inbox = bus.getUnreadMessages(devId, false);
        assertThat(inbox).extracting(Message::getMessageType)
                .containsExactly(MessageType.TASK, MessageType.ERROR_RESOLUTION);
        Message copy = inbox.get(0);
        assertThat(copy.getId()).isNotEqualTo(source);
        assertThat(copy.getSenderId()).isEqualTo("project_manager_1");
        assertThat(copy.getTaskId()).isEqualTo(taskId);
        assertThat(copy.getMetadata()).containsEntry(MessageBus.REDELIVERY_OF, source);
        assertThat(MessageBus.deliveryAttempt(copy)).isEqualTo(2);
        assertThat(result.additions().get(Accumulator.ERROR_HANDLING_RESULTS)).singleElement()
                .satisfies(r -> assertThat(r)
                        .containsEntry("status", "resolved")
                        .containsEntry("redelivered_message_id", copy.getId()));
    }

    @Test
    void failedRedelivery_abandonsTaskAndLeavesErrorOpen() {
        UUID taskId = crew.store.createTask(projectId, "Implement login feature", null, AgentRole.DEVELOPER);
        String devId = state.requireAgent(AgentRole.DEVELOPER).getAgentId();
        String source = bus.send(new Message("project_manager_1", devId, Map.of("id", taskId.toString()),
                MessageType.TASK, taskId, projectId,
                Map.of(MessageBus.DELIVERY_ATTEMPT, ErrorHandlingHandler.MAX_DELIVERY_ATTEMPTS)));
        bus.markRead(source);
        UUID errorId = crew.store.storeError(taskId, devId, "IllegalStateException", "compiler unavailable", null);
        bus.send(new Message(devId, ehId, Map.of("errorId", errorId.toString(), "sourceMessageId", source),
                MessageType.ERROR, taskId, projectId, null));

        TurnResult result = crew.processor().runTurn(AgentRole.ERROR_HANDLING, state, bus);

        assertThat(result.next()).isEqualTo(AgentRole.PROJECT_MANAGER);
        assertThat(crew.store.getError(errorId).orElseThrow().getStatus()).isEqualTo(ErrorStatus.OPEN);
        assertThat(crew.store.getTask(taskId).orElseThrow().getStatus()).isEqualTo(TaskStatus.ERROR);
        assertThat(bus.getUnreadMessages(devId, false)).extracting(Message::getMessageType)
                .containsExactly(MessageType.ERROR_RESOLUTION);
        assertThat(result.additions().get(Accumulator.ERROR_HANDLING_RESULTS)).singleElement()
                .satisfies(r -> assertThat(r).containsEntry("status", "abandoned")
                        .doesNotContainKey("redelivered_message_id"));
    }

    @Test
    void reporterIsProjectManager_getsASingleReply() {
        String pmId = state.requireAgent(AgentRole.PROJECT_MANAGER).getAgentId();
        bus.send(new Message(pmId, ehId, Map.of("errorType", "KeyError"), MessageType.ERROR, null, projectId, null));

        TurnResult result = crew.processor().runTurn(AgentRole.ERROR_HANDLING, state, bus);

        assertThat(result.next()).isEqualTo(AgentRole.PROJECT_MANAGER);
        assertThat(bus.getUnreadMessages(pmId, false)).hasSize(1);
    }

    @Test
    void systemReporter_repliesOnlyToManager() {
        bus.send(new Message("system", ehId, Map.of("errorType", "IndexError"), MessageType.ERROR, null, projectId, null));

        TurnResult result = crew.processor().runTurn(AgentRole.ERROR_HANDLING, state, bus);

        String pmId = state.requireAgent(AgentRole.PROJECT_MANAGER).getAgentId();
        assertThat(result.next()).isEqualTo(AgentRole.PROJECT_MANAGER);
        assertThat(bus.getUnreadMessages(pmId, false)).hasSize(1);
        assertThat(bus.getUnreadMessages("system", false)).isEmpty();
    }
}
