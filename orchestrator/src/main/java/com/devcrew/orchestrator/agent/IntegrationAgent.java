package com.devcrew.orchestrator.agent;

import java.util.List;
import java.util.Map;

/** Wires implemented components together. */
public interface IntegrationAgent {

    Map<String, Object> analyzeComponents(List<Map<String, Object>> components);

    Map<String, Object> designDataFlow(Map<String, Object> analysis, Map<String, Object> task);

    Map<String, Object> createApiConnectors(Map<String, Object> analysis, Map<String, Object> task);
}
