package com.devcrew.orchestrator.agent.stub;

import com.devcrew.orchestrator.agent.ProjectManagerAgent;
import com.devcrew.orchestrator.model.AgentRole;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword-driven planner.
 *
 * Keywords match whole words only, so "build" does not count as "ui".
 * Components become one task each, features become developer tasks, and a
 * test-plan task plus a documentation task are always added.
 */
@Component
public class StubProjectManagerAgent implements ProjectManagerAgent {

    private static final List<String> COMPONENT_KEYWORDS =
            List.of("database", "frontend", "backend", "ui", "api", "authentication", "storage");
    private static final List<String> FEATURE_KEYWORDS =
            List.of("login", "signup", "search", "dashboard", "analytics", "profile", "settings");
    private static final List<String> TECHNOLOGY_KEYWORDS =
            List.of("java", "python", "javascript", "react", "node", "sql", "nosql", "rest", "graphql");

    private static final List<String> UI_COMPONENTS          = List.of("frontend", "ui", "interface");
    private static final List<String> INTEGRATION_COMPONENTS = List.of("api", "integration", "connection");

    @Override
    public Map<String, Object> parseRequirements(String requirements) {
        String text = requirements == null ? "" : requirements;
        List<String> features = matching(FEATURE_KEYWORDS, text);

        Map<String, Object> parsed = new LinkedHashMap<>();
        parsed.put("project_description", text);
        parsed.put("components",   matching(COMPONENT_KEYWORDS, text));
        parsed.put("features",     features.isEmpty() ? List.of("core functionality") : features);
        parsed.put("technologies", matching(TECHNOLOGY_KEYWORDS, text));
        return parsed;
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> createTaskBreakdown(Map<String, Object> parsed) {
        List<Map<String, Object>> tasks = new ArrayList<>();

        for (String component : (List<String>) parsed.getOrDefault("components", List.of())) {
            String title = switch (component) {
                case "frontend", "ui" -> "Design and implement " + component + " interface";
                case "backend", "api" -> "Develop " + component + " services";
                case "database"       -> "Design and implement " + component + " schema";
                default               -> "Implement " + component + " component";
            };
            Map<String, Object> task = task(title,
                    "Deliver the " + component + " component described in the requirements.");
            task.put("component", component);
            tasks.add(task);
        }
        for (String feature : (List<String>) parsed.getOrDefault("features", List.of())) {
            Map<String, Object> task = task("Implement " + feature + " feature",
                    "Deliver the " + feature + " feature end to end.");
            task.put("aspect", "feature");
            tasks.add(task);
        }

        Map<String, Object> testPlan = task("Create test plan and test cases",
                "Cover every component and feature with automated tests.");
        testPlan.put("aspect", "testing");
        tasks.add(testPlan);

        Map<String, Object> docs = task("Create project documentation",
                "Write setup instructions, a user guide and API documentation.");
        docs.put("aspect", "documentation");
        tasks.add(docs);
        return tasks;
    }

    @Override
    public List<Map<String, Object>> assignTasks(List<Map<String, Object>> tasks) {
        List<Map<String, Object>> assigned = new ArrayList<>(tasks.size());
        for (Map<String, Object> task : tasks) {
            Map<String, Object> copy = new LinkedHashMap<>(task);
            copy.put("assigned_agent", roleFor(task).wireName());
            assigned.add(copy);
        }
        return assigned;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AgentRole roleFor(Map<String, Object> task) {
        Object aspect = task.get("aspect");
        if ("testing".equals(aspect))       return AgentRole.TESTING;
        if ("documentation".equals(aspect)) return AgentRole.DOCUMENTATION;

        Object component = task.get("component");
        if (component != null) {
            if (UI_COMPONENTS.contains(component))          return AgentRole.UI_UX;
            if (INTEGRATION_COMPONENTS.contains(component)) return AgentRole.INTEGRATION;
        }
        return AgentRole.DEVELOPER;
    }

    private static Map<String, Object> task(String title, String description) {
        Map<String, Object> task = new LinkedHashMap<>();
        task.put("title", title);
        task.put("description", description);
        return task;
    }

    private static List<String> matching(List<String> keywords, String text) {
        List<String> found = new ArrayList<>();
        for (String keyword : keywords) {
            Pattern p = Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", Pattern.CASE_INSENSITIVE);
            if (p.matcher(text).find()) {
                found.add(keyword);
            }
        }
        return found;
    }
}
