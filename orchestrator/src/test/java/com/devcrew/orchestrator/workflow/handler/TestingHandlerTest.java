package com.devcrew.orchestrator.workflow.handler;

import com.devcrew.orchestrator.agent.stub.StubTestingAgent;
import com.devcrew.orchestrator.messaging.Message;
import com.devcrew.orchestrator.messaging.MessageBus;
import com.devcrew.orchestrator.model.*;
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

class TestingHandlerTest {

    CrewFixtures crew;
    UUID projectId;
    UUID taskId;
    SystemState state;
    MessageBus bus;
    String qaId;

    @BeforeEach
    void setUp() {
        crew = new CrewFixtures();
        projectId = crew.store.createProject("QA", null);
        taskId = crew.store.createTask(projectId, "Implement login feature", null, AgentRole.DEVELOPER);
        state = crew.systemState(projectId);
        bus = crew.bus();
        qaId = state.requireAgent(AgentRole.TESTING).getAgentId();
    }

    @Test
    void passingRun_forwardsToDocumentation() {
        bus.send(new Message("developer_1", qaId, Map.of("task_id", taskId.toString()),
                MessageType.IMPLEMENTATION, taskId, projectId, null));

        TurnResult result = crew.processor().runTurn(AgentRole.TESTING, state, bus);

        assertThat(result.next()).isEqualTo(AgentRole.DOCUMENTATION);
        assertThat(result.additions().get(Accumulator.TEST_REPORTS)).hasSize(1);
        String docsId = state.requireAgent(AgentRole.DOCUMENTATION).getAgentId();
        assertThat(bus.getUnreadMessages(docsId, false)).extracting(Message::getMessageType)
                .containsExactly(MessageType.TESTED_IMPLEMENTATION);
        assertThat(crew.store.getAgentOutputs(taskId, qaId)).extracting(o -> o.getOutputType())
                .containsExactly("test_cases", "test_results", "test_report");
    }

    @Test
    void failingRun_blocksTaskAndReportsToErrorHandling() {
        crew.testing = failingOnce();
        bus.send(new Message("developer_1", qaId, Map.of("task_id", taskId.toString()),
                MessageType.IMPLEMENTATION, taskId, projectId, null));

        TurnResult result = crew.processor().runTurn(AgentRole.TESTING, state, bus);

        assertThat(result.next()).isEqualTo(AgentRole.ERROR_HANDLING);
        assertThat(crew.store.getTask(taskId).orElseThrow().getStatus()).isEqualTo(TaskStatus.BLOCKED);
        assertThat(crew.store.getErrorsByTask(taskId)).singleElement().satisfies(e -> {
            assertThat(e.getErrorType()).isEqualTo(TestingHandler.TEST_FAILURE);
            assertThat(e.getStatus()).isEqualTo(ErrorStatus.OPEN);
        });
        assertThat(state.getErrors()).singleElement()
                .satisfies(e -> assertThat(e.kind()).isEqualTo(ErrorKind.TEST_FAILURE));

        String ehId = state.requireAgent(AgentRole.ERROR_HANDLING).getAgentId();
        assertThat(bus.getUnreadMessages(ehId, false)).singleElement().satisfies(m -> {
            assertThat(m.getMessageType()).isEqualTo(MessageType.ERROR);
            assertThat((Map<String, Object>) m.getContent()).containsKeys("errorId", "test_report", "implementation");
        });
    }

    @Test
    void errorResolution_forwardsTaskToDocumentation() {
        bus.send(new Message("error_handling_1", qaId, Map.of("resolution", "fixed"),
                MessageType.ERROR_RESOLUTION, taskId, projectId, null));

        TurnResult result = crew.processor().runTurn(AgentRole.TESTING, state, bus);

        assertThat(result.next()).isEqualTo(AgentRole.DOCUMENTATION);
        String docsId = state.requireAgent(AgentRole.DOCUMENTATION).getAgentId();
        assertThat(bus.getUnreadMessages(docsId, false)).singleElement().satisfies(m -> {
            assertThat(m.getMessageType()).isEqualTo(MessageType.TESTED_IMPLEMENTATION);
            assertThat((Map<String, Object>) m.getContent()).containsKey("resolution");
        });
    }

    @Test
    void errorResolutionWithRedelivery_isNotForwarded() {
        bus.send(new Message("error_handling_1", qaId,
                Map.of("resolution", "retry", "redelivered_message_id", "m-2"),
                MessageType.ERROR_RESOLUTION, taskId, projectId, null));

        TurnResult result = crew.processor().runTurn(AgentRole.TESTING, state, bus);

        assertThat(result.processedMessages()).isEqualTo(1);
        assertThat(result.next()).isNull();
        String docsId = state.requireAgent(AgentRole.DOCUMENTATION).getAgentId();
        assertThat(bus.countUnread(docsId)).isZero();
    }

    /** Reports one failing test on its first report only. */
    static StubTestingAgent failingOnce() {
        return new StubTestingAgent() {
            private boolean failed;

            @Override
            public Map<String, Object> createReport(Map<String, Object> executionResults) {
                Map<String, Object> report = super.createReport(executionResults);
                if (!failed) {
                    failed = true;
                    report.put("failed_tests", List.of(Map.of("test_id", "unit-1", "status", "fail")));
                }
                return report;
            }
        };
    }
}
