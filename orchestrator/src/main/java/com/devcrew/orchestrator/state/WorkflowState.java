package com.devcrew.orchestrator.state;

import com.devcrew.orchestrator.model.AgentRole;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checkpointed workflow state: seven accumulator lists plus the scheduler
 * pointer naming the role that runs next.
 *
 * Wire format:
 * <pre>
 *   {"tasks": [], "implementations": [], "ui_implementations": [],
 *    "integrated_systems": [], "test_reports": [], "documentation": [],
 *    "error_handling_results": [], "next": "project_manager"}
 * </pre>
 * {@code next} is {@code "end"} once the workflow is parked. Unknown keys are
 * ignored; missing lists read as empty and a missing {@code next} as
 * {@code project_manager}, so older blobs keep loading.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonAutoDetect(fieldVisibility = Visibility.NONE, getterVisibility = Visibility.NONE,
        isGetterVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
public class WorkflowState {

    public static final String END = "end";

    @JsonProperty("tasks")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Map<String, Object>> tasks = new ArrayList<>();

    @JsonProperty("implementations")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Map<String, Object>> implementations = new ArrayList<>();

    @JsonProperty("ui_implementations")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Map<String, Object>> uiImplementations = new ArrayList<>();

    @JsonProperty("integrated_systems")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Map<String, Object>> integratedSystems = new ArrayList<>();

    @JsonProperty("test_reports")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Map<String, Object>> testReports = new ArrayList<>();

    @JsonProperty("documentation")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Map<String, Object>> documentation = new ArrayList<>();

    @JsonProperty("error_handling_results")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Map<String, Object>> errorHandlingResults = new ArrayList<>();

    // null once parked
    private AgentRole next = AgentRole.PROJECT_MANAGER;

    /** The bootstrap state: empty accumulators, project manager runs first. */
    public static WorkflowState initial() {
        return new WorkflowState();
    }

    // ------------------------------------------------------------------
    // Scheduler pointer
    // ------------------------------------------------------------------

    public AgentRole getNext()  { return next; }
    public boolean   isParked() { return next == null; }

    public void setNext(AgentRole role) {
        this.next = Objects.requireNonNull(role, "role");
    }

    public void park() {
        this.next = null;
    }

    @JsonProperty("next")
    String getNextWireName() {
        return next == null ? END : next.wireName();
    }

    @JsonProperty("next")
    void setNextWireName(String value) {
        if (value == null || value.isBlank()) {
            this.next = AgentRole.PROJECT_MANAGER;
        } else if (END.equals(value)) {
            this.next = null;
        } else {
            this.next = AgentRole.fromWireName(value);
        }
    }

    // ------------------------------------------------------------------
    // Accumulators
    // ------------------------------------------------------------------

    public List<Map<String, Object>> get(Accumulator accumulator) {
        return Collections.unmodifiableList(listFor(accumulator));
    }

    public void append(Accumulator accumulator, Map<String, Object> entry) {
        listFor(accumulator).add(entry);
    }

    public void appendAll(Map<Accumulator, List<Map<String, Object>>> additions) {
        additions.forEach((acc, entries) -> listFor(acc).addAll(entries));
    }

    /** Sizes of every accumulator, keyed by wire name; used in status views. */
    public Map<String, Integer> sizes() {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        for (Accumulator acc : Accumulator.values()) {
            sizes.put(acc.wireName(), listFor(acc).size());
        }
        return sizes;
    }

    private List<Map<String, Object>> listFor(Accumulator accumulator) {
        return switch (accumulator) {
            case TASKS                  -> tasks;
            case IMPLEMENTATIONS        -> implementations;
            case UI_IMPLEMENTATIONS     -> uiImplementations;
            case INTEGRATED_SYSTEMS     -> integratedSystems;
            case TEST_REPORTS           -> testReports;
            case DOCUMENTATION          -> documentation;
            case ERROR_HANDLING_RESULTS -> errorHandlingResults;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowState other = (WorkflowState) o;
        return tasks.equals(other.tasks)
                && implementations.equals(other.implementations)
                && uiImplementations.equals(other.uiImplementations)
                && integratedSystems.equals(other.integratedSystems)
                && testReports.equals(other.testReports)
                && documentation.equals(other.documentation)
                && errorHandlingResults.equals(other.errorHandlingResults)
                && next == other.next;
    }

    @Override
    public int hashCode() {
        return Objects.hash(tasks, implementations, uiImplementations, integratedSystems,
                testReports, documentation, errorHandlingResults, next);
    }

    @Override
    public String toString() {
        return "WorkflowState" + sizes() + " next=" + getNextWireName();
    }
}
