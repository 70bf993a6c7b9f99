package com.devcrew.orchestrator.agent.stub;

import com.devcrew.orchestrator.agent.TestingAgent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates three fixed test cases and reports every one as passing.
 */
@Component
public class StubTestingAgent implements TestingAgent {

    @Override
    public Map<String, Object> generateTests(Map<String, Object> implementation) {
        Map<String, Object> tests = new LinkedHashMap<>();
        tests.put("task_id",           implementation.get("task_id"));
        tests.put("unit_tests",        List.of(testCase("unit-1", "service returns greeting")));
        tests.put("integration_tests", List.of(testCase("integration-1", "controller calls service")));
        tests.put("end_to_end_tests",  List.of(testCase("e2e-1", "user completes main flow")));
        return tests;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> executeTests(Map<String, Object> testCases) {
        List<Map<String, Object>> results = new ArrayList<>();
        for (String group : List.of("unit_tests", "integration_tests", "end_to_end_tests")) {
            for (Map<String, Object> test : (List<Map<String, Object>>) testCases.getOrDefault(group, List.of())) {
                Map<String, Object> result = new LinkedHashMap<>();
                result.put("test_id", test.get("id"));
                result.put("type",    group);
                result.put("status",  "pass");
                results.add(result);
            }
        }
        Map<String, Object> execution = new LinkedHashMap<>();
        execution.put("task_id", testCases.get("task_id"));
        execution.put("results", results);
        return execution;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> createReport(Map<String, Object> executionResults) {
        List<Map<String, Object>> results =
                (List<Map<String, Object>>) executionResults.getOrDefault("results", List.of());
        List<Map<String, Object>> failed = new ArrayList<>();
        for (Map<String, Object> r : results) {
            if (!"pass".equals(r.get("status"))) {
                failed.add(r);
            }
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_tests",  results.size());
        summary.put("passed_tests", results.size() - failed.size());
        summary.put("failed_tests", failed.size());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("task_id",      executionResults.get("task_id"));
        report.put("summary",      summary);
        report.put("failed_tests", failed);
        return report;
    }

    private static Map<String, Object> testCase(String id, String name) {
        Map<String, Object> test = new LinkedHashMap<>();
        test.put("id",   id);
        test.put("name", name);
        return test;
    }
}
