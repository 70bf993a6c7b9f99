package com.devcrew.orchestrator.agent.stub;

import com.devcrew.orchestrator.agent.DeveloperAgent;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Returns a fixed example implementation for every task. */
@Component
public class StubDeveloperAgent implements DeveloperAgent {

    @Override
    public Map<String, Object> analyzeTask(Map<String, Object> task) {
        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("task_id",    task.get("id"));
        analysis.put("title",      task.get("title"));
        analysis.put("complexity", "medium");
        analysis.put("approach",   "Service class with a thin REST adapter");
        analysis.put("components", List.of("service", "repository", "controller"));
        return analysis;
    }

    @Override
    public Map<String, Object> generateCode(Map<String, Object> task, Map<String, Object> analysis) {
        String code = "public class ExampleService {\n"
                + "    public String greet() { return \"Hello, world!\"; }\n"
                + "}\n";
        Map<String, Object> file = new LinkedHashMap<>();
        file.put("path",    "src/main/java/example/ExampleService.java");
        file.put("content", code);

        Map<String, Object> implementation = new LinkedHashMap<>();
        implementation.put("task_id",  task.get("id"));
        implementation.put("language", "java");
        implementation.put("files",    List.of(file));
        implementation.put("approach", analysis.get("approach"));
        return implementation;
    }

    @Override
    public Map<String, Object> documentCode(Map<String, Object> implementation) {
        Map<String, Object> docs = new LinkedHashMap<>();
        docs.put("task_id", implementation.get("task_id"));
        docs.put("summary", "ExampleService exposes a single greet() operation.");
        docs.put("files_documented", ((List<?>) implementation.getOrDefault("files", List.of())).size());
        return docs;
    }
}
