package com.devcrew.orchestrator.agent.stub;

import com.devcrew.orchestrator.agent.DocumentationAgent;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class StubDocumentationAgent implements DocumentationAgent {

    @Override
    public Map<String, Object> analyzeImplementation(Map<String, Object> testedImplementation) {
        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("task_id", testedImplementation.get("task_id"));
        analysis.put("modules", List.of("ExampleService"));
        analysis.put("public_operations", List.of("greet"));
        return analysis;
    }

    @Override
    public Map<String, Object> writeTechnicalDocs(Map<String, Object> analysis, Map<String, Object> task) {
        Map<String, Object> docs = new LinkedHashMap<>();
        docs.put("title",    "Technical reference: " + task.getOrDefault("title", "project"));
        docs.put("sections", List.of("Overview", "Architecture", "API", "Configuration"));
        docs.put("modules",  analysis.get("modules"));
        return docs;
    }

    @Override
    public Map<String, Object> writeUserGuide(Map<String, Object> task, Map<String, Object> technicalDocs) {
        Map<String, Object> guide = new LinkedHashMap<>();
        guide.put("title", "User guide: " + task.getOrDefault("title", "project"));
        guide.put("steps", List.of("Install", "Configure", "Run", "Troubleshoot"));
        return guide;
    }
}
