package com.devcrew.orchestrator.agent;

import java.util.Map;

public interface DocumentationAgent {

    Map<String, Object> analyzeImplementation(Map<String, Object> testedImplementation);

    Map<String, Object> writeTechnicalDocs(Map<String, Object> analysis, Map<String, Object> task);

    Map<String, Object> writeUserGuide(Map<String, Object> task, Map<String, Object> technicalDocs);
}
