package com.devcrew.orchestrator.agent;

import java.util.Map;

/**
 * Verification stage.
 *
 * The report produced by {@link #createReport} must contain a
 * {@code failed_tests} list; a non-empty list routes the task to the
 * error-handling role instead of documentation.
 */
public interface TestingAgent {

    Map<String, Object> generateTests(Map<String, Object> implementation);

    Map<String, Object> executeTests(Map<String, Object> testCases);

    Map<String, Object> createReport(Map<String, Object> executionResults);
}
