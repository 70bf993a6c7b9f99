package com.devcrew.orchestrator.agent;

import java.util.Map;

/** Implementation stage for back-end tasks: analyze → generate → document. */
public interface DeveloperAgent {

    Map<String, Object> analyzeTask(Map<String, Object> task);

    Map<String, Object> generateCode(Map<String, Object> task, Map<String, Object> analysis);

    Map<String, Object> documentCode(Map<String, Object> implementation);
}
