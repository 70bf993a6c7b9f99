package com.devcrew.orchestrator.workflow.handler;

import com.devcrew.orchestrator.messaging.Message;
import com.devcrew.orchestrator.messaging.MessageBus;
import com.devcrew.orchestrator.model.AgentRole;
import com.devcrew.orchestrator.model.MessageType;
import com.devcrew.orchestrator.model.TaskStatus;
import com.devcrew.orchestrator.state.Accumulator;
import com.devcrew.orchestrator.state.SystemState;
import com.devcrew.orchestrator.workflow.AgentTurnProcessor;
import com.devcrew.orchestrator.workflow.CrewFixtures;
import com.devcrew.orchestrator.workflow.TurnResult;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/** The ui_ux → integration → testing leg. */
class UiIntegrationHandlersTest {

    @Test
    void uiTask_flowsThroughIntegrationToTesting() {
        CrewFixtures crew = new CrewFixtures();
        AgentTurnProcessor processor = crew.processor();
        UUID projectId = crew.store.createProject("Dashboard", null);
        UUID taskId = crew.store.createTask(projectId, "Design and implement ui interface", null, AgentRole.UI_UX);
        SystemState state = crew.systemState(projectId);
        MessageBus bus = crew.bus();
        String uiId = state.requireAgent(AgentRole.UI_UX).getAgentId();
        bus.send(new Message("project_manager_1", uiId, Map.of("id", taskId.toString(), "component", "ui"),
                MessageType.TASK, taskId, projectId, null));

        TurnResult ui = processor.runTurn(AgentRole.UI_UX, state, bus);
        TurnResult integration = processor.runTurn(AgentRole.INTEGRATION, state, bus);

        assertThat(ui.next()).isEqualTo(AgentRole.INTEGRATION);
        assertThat(ui.additions().get(Accumulator.UI_IMPLEMENTATIONS)).hasSize(1);
        assertThat(crew.store.getTask(taskId).orElseThrow().getStatus()).isEqualTo(TaskStatus.IN_PROGRESS);

        assertThat(integration.next()).isEqualTo(AgentRole.TESTING);
        assertThat(integration.additions().get(Accumulator.INTEGRATED_SYSTEMS)).singleElement()
                .satisfies(s -> assertThat(s).containsEntry("source_type", "ui_implementation"));
        String qaId = state.requireAgent(AgentRole.TESTING).getAgentId();
        assertThat(bus.getUnreadMessages(qaId, false)).extracting(Message::getMessageType)
                .containsExactly(MessageType.INTEGRATED_SYSTEM);
    }
}
