package com.devcrew.orchestrator.agent.stub;

import com.devcrew.orchestrator.agent.IntegrationAgent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class StubIntegrationAgent implements IntegrationAgent {

    @Override
    public Map<String, Object> analyzeComponents(List<Map<String, Object>> components) {
        List<Object> taskIds = new ArrayList<>();
        for (Map<String, Object> component : components) {
            taskIds.add(component.get("task_id"));
        }
        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("component_count", components.size());
        analysis.put("component_tasks", taskIds);
        analysis.put("interfaces",      List.of("REST", "in-process events"));
        return analysis;
    }

    @Override
    public Map<String, Object> designDataFlow(Map<String, Object> analysis, Map<String, Object> task) {
        Map<String, Object> flow = new LinkedHashMap<>();
        flow.put("task_id", task.get("id"));
        flow.put("flows",   List.of("ui -> api -> service -> repository"));
        flow.put("format",  "json");
        return flow;
    }

    @Override
    public Map<String, Object> createApiConnectors(Map<String, Object> analysis, Map<String, Object> task) {
        Map<String, Object> endpoint = new LinkedHashMap<>();
        endpoint.put("method", "GET");
        endpoint.put("path",   "/api/resources");

        Map<String, Object> connectors = new LinkedHashMap<>();
        connectors.put("task_id",   task.get("id"));
        connectors.put("endpoints", List.of(endpoint));
        return connectors;
    }
}
