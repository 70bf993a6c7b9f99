package com.devcrew.orchestrator.state;

/**
 * The seven append-only result lists carried in every checkpoint.
 * The wire name is the JSON key in the persisted checkpoint blob.
 */
public enum Accumulator {
    TASKS("tasks"),
    IMPLEMENTATIONS("implementations"),
    UI_IMPLEMENTATIONS("ui_implementations"),
    INTEGRATED_SYSTEMS("integrated_systems"),
    TEST_REPORTS("test_reports"),
    DOCUMENTATION("documentation"),
    ERROR_HANDLING_RESULTS("error_handling_results");

    private final String wireName;

    Accumulator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
