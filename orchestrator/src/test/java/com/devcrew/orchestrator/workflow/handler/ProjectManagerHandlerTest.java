package com.devcrew.orchestrator.workflow.handler;

import com.devcrew.orchestrator.messaging.Message;
import com.devcrew.orchestrator.messaging.MessageBus;
import com.devcrew.orchestrator.model.*;
import com.devcrew.orchestrator.state.Accumulator;
import com.devcrew.orchestrator.state.SystemState;
import com.devcrew.orchestrator.workflow.AgentTurnProcessor;
import com.devcrew.orchestrator.workflow.CrewFixtures;
import com.devcrew.orchestrator.workflow.TurnResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ProjectManagerHandlerTest {

    CrewFixtures crew;
    AgentTurnProcessor processor;
    UUID projectId;
    SystemState state;
    MessageBus bus;
    String pmId;

    @BeforeEach
    void setUp() {
        crew = new CrewFixtures();
        processor = crew.processor();
        projectId = crew.store.createProject("Todo App", "demo");
        state = crew.systemState(projectId);
        bus = crew.bus();
        pmId = state.requireAgent(AgentRole.PROJECT_MANAGER).getAgentId();
    }

    @Test
    void requirements_createAssignAndDispatchTasks() {
        bus.send(new Message("system", pmId, Map.of("requirements", "Build a todo app with login"),
                MessageType.REQUIREMENTS, null, projectId, null));

        TurnResult result = processor.runTurn(AgentRole.PROJECT_MANAGER, state, bus);

        List<Task> tasks = crew.store.getTasksByProject(projectId);
        assertThat(tasks).hasSize(3).allSatisfy(t -> assertThat(t.getStatus()).isEqualTo(TaskStatus.ASSIGNED));
        assertThat(tasks).extracting(Task::getAssignedAgent)
                .containsExactly(AgentRole.DEVELOPER, AgentRole.TESTING, AgentRole.DOCUMENTATION);
        assertThat(result.additions().get(Accumulator.TASKS)).hasSize(3);
        assertThat(result.next()).isEqualTo(AgentRole.DEVELOPER);
        assertThat(state.getTasks()).hasSize(3);

        String devId = state.requireAgent(AgentRole.DEVELOPER).getAgentId();
        assertThat(bus.getUnreadMessages(devId, false)).singleElement().satisfies(m -> {
            assertThat(m.getMessageType()).isEqualTo(MessageType.TASK);
            assertThat(m.getTaskId()).isEqualTo(tasks.get(0).getId());
        });
        assertThat(state.requireAgent(AgentRole.DEVELOPER).getTaskHistory()).containsExactly(tasks.get(0).getId());
        // requirements analysis is stored without a task
        assertThat(crew.store.getAgentOutputs(null, pmId))
                .extracting(o -> o.getOutputType()).contains("requirements_analysis");
    }

    @Test
    void documentation_lastOpenTask_completesProjectAndParks() {
        UUID only = crew.store.createTask(projectId, "Create project documentation", null, AgentRole.DOCUMENTATION);
        String docsId = state.requireAgent(AgentRole.DOCUMENTATION).getAgentId();
        bus.send(new Message(docsId, pmId, Map.of("task_id", only.toString()), MessageType.DOCUMENTATION,
                only, projectId, null));

        TurnResult result = processor.runTurn(AgentRole.PROJECT_MANAGER, state, bus);

        assertThat(result.parked()).isTrue();
        assertThat(crew.store.getTask(only).orElseThrow().getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(crew.store.getProject(projectId).orElseThrow().getStatus()).isEqualTo(ProjectStatus.COMPLETED);
    }

    @Test
    void documentation_withOpenTasksLeft_doesNotPark() {
        UUID done = crew.store.createTask(projectId, "a", null, AgentRole.DOCUMENTATION);
        crew.store.createTask(projectId, "b", null, AgentRole.DEVELOPER);
        bus.send(new Message("documentation_1", pmId, Map.of(), MessageType.DOCUMENTATION, done, projectId, null));

        TurnResult result = processor.runTurn(AgentRole.PROJECT_MANAGER, state, bus);

        assertThat(result.parked()).isFalse();
        assertThat(crew.store.getProject(projectId).orElseThrow().getStatus()).isNotEqualTo(ProjectStatus.COMPLETED);
    }

    @Test
    void error_isEscalatedAndTaskMarkedError() {
        UUID task = crew.store.createTask(projectId, "a", null, AgentRole.DEVELOPER);
        String ehId = state.requireAgent(AgentRole.ERROR_HANDLING).getAgentId();
        bus.send(new Message(ehId, pmId, Map.of("errorId", "x", "errorMessage", "resolver offline"),
                MessageType.ERROR, task, projectId, null));

        TurnResult result = processor.runTurn(AgentRole.PROJECT_MANAGER, state, bus);

        assertThat(crew.store.getTask(task).orElseThrow().getStatus()).isEqualTo(TaskStatus.ERROR);
        assertThat(result.additions().get(Accumulator.ERROR_HANDLING_RESULTS))
                .singleElement().satisfies(e -> assertThat(e).containsEntry("status", "escalated"));
    }
}
