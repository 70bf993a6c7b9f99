package com.devcrew.orchestrator.persistence;

import com.devcrew.orchestrator.model.*;
import com.devcrew.orchestrator.state.Accumulator;
import com.devcrew.orchestrator.state.WorkflowState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryPersistenceStoreTest {

    InMemoryPersistenceStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryPersistenceStore(new ObjectMapper().findAndRegisterModules());
    }

    // ------------------------------------------------------------------
    // projects and tasks
    // ------------------------------------------------------------------

    @Test
    void updateProject_appliesOnlyGivenFields() {
        UUID id = store.createProject("Todo App", "demo");

        assertThat(store.updateProject(id, ProjectUpdate.status(ProjectStatus.ACTIVE))).isTrue();

        Project project = store.getProject(id).orElseThrow();
        assertThat(project.getStatus()).isEqualTo(ProjectStatus.ACTIVE);
        assertThat(project.getDescription()).isEqualTo("demo");
    }

    @Test
    void updates_onMissingRows_returnFalse() {
        assertThat(store.updateProject(UUID.randomUUID(), ProjectUpdate.status(ProjectStatus.ACTIVE))).isFalse();
        assertThat(store.updateTask(UUID.randomUUID(), TaskUpdate.status(TaskStatus.BLOCKED))).isFalse();
        assertThat(store.updateErrorStatus(UUID.randomUUID(), ErrorStatus.RESOLVED, null, null)).isFalse();
    }

    @Test
    void getTasksByProject_returnsOnlyThatProjectsTasksInOrder() {
        UUID p1 = store.createProject("one", null);
        UUID p2 = store.createProject("two", null);
        store.createTask(p1, "first", null, AgentRole.DEVELOPER);
        store.createTask(p2, "other", null, AgentRole.TESTING);
        store.createTask(p1, "second", null, AgentRole.DOCUMENTATION);

        assertThat(store.getTasksByProject(p1)).extracting(Task::getTitle).containsExactly("first", "second");
    }

    @Test
    void getAgentOutputs_nullTaskIdMatchesTasklessOutputs() {
        store.storeAgentOutput(null, "project_manager_1", "requirements_analysis", Map.of("features", List.of()));

        assertThat(store.getAgentOutputs(null, null)).singleElement()
                .satisfies(o -> assertThat(o.getContent()).contains("features"));
    }

    // ------------------------------------------------------------------
    // errors
    // ------------------------------------------------------------------

    @Test
    void updateErrorStatus_resolvedWithoutTimestamp_stampsNow() {
        UUID id = store.storeError(null, "testing_1", "TestFailure", "1 test(s) failed", null);

        store.updateErrorStatus(id, ErrorStatus.RESOLVED, "fixed", null);

        ErrorRecord error = store.getError(id).orElseThrow();
        assertThat(error.getStatus()).isEqualTo(ErrorStatus.RESOLVED);
        assertThat(error.getResolvedAt()).isNotNull();
        assertThat(error.getResolution()).isEqualTo("fixed");
        assertThat(store.getAllErrors(ErrorStatus.OPEN)).isEmpty();
        assertThat(store.getAllErrors(null)).hasSize(1);
    }

    // ------------------------------------------------------------------
    // checkpoints
    // ------------------------------------------------------------------

    @Test
    void checkpoint_saveLoadSave_isIdempotent() {
        WorkflowState state = WorkflowState.initial();
        state.append(Accumulator.TASKS, Map.of("title", "Implement login feature", "assigned_agent", "developer"));
        state.append(Accumulator.TEST_REPORTS, Map.of("summary", Map.of("total_tests", 3)));
        state.setNext(AgentRole.TESTING);

        Long first = store.storeCheckpoint(null, state);
        WorkflowState loaded = store.getCheckpoint(first).orElseThrow().state();
        Long second = store.storeCheckpoint(null, loaded);

        assertThat(loaded).isEqualTo(state);
        assertThat(store.getCheckpoint(second).orElseThrow().state()).isEqualTo(loaded);
        assertThat(second).isGreaterThan(first);
    }

    @Test
    void getLatestCheckpoint_perProjectAndGlobal() {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        WorkflowState parked = WorkflowState.initial();
        parked.park();

        Long aId = store.storeCheckpoint(a, parked);
        Long bId = store.storeCheckpoint(b, WorkflowState.initial());

        assertThat(store.getLatestCheckpoint(a).orElseThrow().id()).isEqualTo(aId);
        assertThat(store.getLatestCheckpoint(a).orElseThrow().state().isParked()).isTrue();
        assertThat(store.getLatestCheckpoint().orElseThrow().id()).isEqualTo(bId);
        assertThat(store.getLatestCheckpoint(UUID.randomUUID())).isEmpty();
    }

    @Test
    void storeAgentOutput_unserializableContent_throwsPersistenceException() {
        assertThatThrownBy(() -> store.storeAgentOutput(null, "a", "x", new Object()))
                .isInstanceOf(PersistenceException.class);
    }
}
