package com.devcrew.orchestrator.state;

import com.devcrew.orchestrator.messaging.Message;
import com.devcrew.orchestrator.model.AgentRole;
import com.devcrew.orchestrator.model.AgentStatus;
import com.devcrew.orchestrator.model.MessageType;
import com.devcrew.orchestrator.model.SystemStatus;
import com.devcrew.orchestrator.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SystemStateTest {

    UUID projectId;
    SystemState state;

    @BeforeEach
    void setUp() {
        projectId = UUID.randomUUID();
        state = new SystemState(projectId);
    }

    @Test
    void newState_isInitializing() {
        assertThat(state.getStatus()).isEqualTo(SystemStatus.INITIALIZING);
        assertThat(state.getAgents()).isEmpty();
        assertThat(state.getCheckpointId()).isNull();
    }

    // ------------------------------------------------------------------
    // agents
    // ------------------------------------------------------------------

    @Test
    void registerAgent_secondAgentForSameRole_isRejected() {
        state.registerAgent(AgentState.create(AgentRole.DEVELOPER));

        assertThatThrownBy(() -> state.registerAgent(AgentState.create(AgentRole.DEVELOPER)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("developer");
        assertThat(state.getAgents()).hasSize(1);
    }

    @Test
    void registerAgent_duplicateId_isRejected() {
        state.registerAgent(new AgentState("shared_1", AgentRole.DEVELOPER));

        assertThatThrownBy(() -> state.registerAgent(new AgentState("shared_1", AgentRole.TESTING)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void createdAgentIds_carryTheirRolePrefix() {
        AgentState pm = AgentState.create(AgentRole.PROJECT_MANAGER);

        assertThat(pm.getAgentId()).matches("project_manager_[0-9a-f]{8}");
        assertThat(AgentRole.fromAgentId(pm.getAgentId())).isEqualTo(AgentRole.PROJECT_MANAGER);
    }

    @Test
    void updateAgentStatus_unknownAgent_returnsFalse() {
        assertThat(state.updateAgentStatus("ghost_1", AgentStatus.WORKING)).isFalse();
    }

    @Test
    void assignTaskToAgent_sameTaskTwice_appendsBothTimes() {
        AgentState dev = AgentState.create(AgentRole.DEVELOPER);
        state.registerAgent(dev);
        UUID task = UUID.randomUUID();

        assertThat(state.assignTaskToAgent(dev.getAgentId(), task)).isTrue();
        assertThat(state.assignTaskToAgent(dev.getAgentId(), task)).isTrue();

        assertThat(dev.getTaskHistory()).containsExactly(task, task);
        assertThat(dev.getCurrentTaskId()).isEqualTo(task);
        assertThat(dev.getStatus()).isEqualTo(AgentStatus.WORKING);
    }

    @Test
    void markAgentFailed_setsErrorStatusAndMessage() {
        AgentState qa = AgentState.create(AgentRole.TESTING);
        state.registerAgent(qa);

        state.markAgentFailed(qa.getAgentId(), "boom");

        assertThat(qa.getStatus()).isEqualTo(AgentStatus.ERROR);
        assertThat(qa.getLastError()).isEqualTo("boom");
    }

    // ------------------------------------------------------------------
    // tasks and snapshot
    // ------------------------------------------------------------------

    @Test
    void updateTaskStatus_changesLiveTaskTree() {
        UUID task = UUID.randomUUID();
        state.putTask(task, Map.of("title", "Implement login feature", "status", "assigned"));

        state.updateTaskStatus(task, TaskStatus.BLOCKED);

        assertThat(state.getTasks().get(task))
                .containsEntry("status", "blocked")
                .containsEntry("title", "Implement login feature")
                .containsKey("updatedAt");
    }

    @Test
    void toSnapshot_unserializableAgent_fallsBackToIdAndStatus() {
        AgentState dev = AgentState.create(AgentRole.DEVELOPER);
        state.registerAgent(dev);
        state.setStatus(SystemStatus.RUNNING);
        state.assignTaskToAgent(dev.getAgentId(), null);

        Map<String, Object> snapshot = state.toSnapshot();

        assertThat(snapshot).containsOnlyKeys("projectId", "status", "error")
                .containsEntry("projectId", projectId.toString())
                .containsEntry("status", "running");
        assertThat(snapshot.get("error")).isNotNull();
    }

    @Test
    void toSnapshot_isPlainDataWithoutMessageContent() {
        AgentState pm = AgentState.create(AgentRole.PROJECT_MANAGER);
        state.registerAgent(pm);
        state.setStatus(SystemStatus.RUNNING);
        state.addMessage(Message.of("system", pm.getAgentId(), Map.of("requirements", "secret"),
                MessageType.REQUIREMENTS));
        state.addError(ErrorReport.of(null, null, pm.getAgentId(), "KeyError", "missing", null));

        Map<String, Object> snapshot = state.toSnapshot();

        assertThat(snapshot)
                .containsEntry("projectId", projectId.toString())
                .containsEntry("status", "running")
                .containsKeys("agents", "tasks", "messages", "errors", "startedAt", "updatedAt");
        List<Map<String, Object>> messages = (List<Map<String, Object>>) snapshot.get("messages");
        assertThat(messages.get(0))
                .containsEntry("messageType", "requirements")
                .doesNotContainKey("content");
        List<Map<String, Object>> errors = (List<Map<String, Object>>) snapshot.get("errors");
        assertThat(errors.get(0)).containsEntry("kind", "missing_key");
    }
}
