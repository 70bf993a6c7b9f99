package com.devcrew.orchestrator.state;

import com.devcrew.orchestrator.model.AgentRole;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowStateTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void initial_hasEmptyAccumulatorsAndStartsWithProjectManager() {
        WorkflowState state = WorkflowState.initial();

        assertThat(state.getNext()).isEqualTo(AgentRole.PROJECT_MANAGER);
        assertThat(state.isParked()).isFalse();
        assertThat(state.sizes()).hasSize(7).allSatisfy((name, size) -> assertThat(size).isZero());
    }

    @Test
    void appendAll_onlyAddsToNamedAccumulators() {
        WorkflowState state = WorkflowState.initial();

        state.appendAll(Map.of(Accumulator.TEST_REPORTS, List.of(Map.of("task_id", "t1"))));

        assertThat(state.get(Accumulator.TEST_REPORTS)).hasSize(1);
        assertThat(state.get(Accumulator.TASKS)).isEmpty();
    }

    @Test
    void get_returnsReadOnlyView() {
        WorkflowState state = WorkflowState.initial();

        assertThatThrownBy(() -> state.get(Accumulator.TASKS).add(Map.of()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void json_usesWireNamesAndEndMarker() throws Exception {
        WorkflowState state = WorkflowState.initial();
        state.append(Accumulator.ERROR_HANDLING_RESULTS, Map.of("status", "escalated"));
        state.park();

        Map<String, Object> json = mapper.readValue(mapper.writeValueAsString(state), new TypeReference<>() {});

        assertThat(json).containsEntry("next", "end")
                .containsKeys("tasks", "implementations", "ui_implementations", "integrated_systems",
                        "test_reports", "documentation", "error_handling_results");
        assertThat(mapper.readValue(mapper.writeValueAsString(state), WorkflowState.class).isParked()).isTrue();
    }

    @Test
    void json_missingOrNullFieldsFallBackToDefaults() throws Exception {
        WorkflowState state = mapper.readValue("{\"tasks\":null,\"legacy\":1}", WorkflowState.class);

        assertThat(state.get(Accumulator.TASKS)).isEmpty();
        assertThat(state.getNext()).isEqualTo(AgentRole.PROJECT_MANAGER);
    }

    @Test
    void json_unknownRoleIsRejected() {
        assertThatThrownBy(() -> mapper.readValue("{\"next\":\"janitor\"}", WorkflowState.class))
                .hasRootCauseInstanceOf(IllegalArgumentException.class);
    }
}
