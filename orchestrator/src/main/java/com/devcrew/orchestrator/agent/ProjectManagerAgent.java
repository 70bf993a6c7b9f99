package com.devcrew.orchestrator.agent;

import java.util.List;
import java.util.Map;

/**
 * Planning stage: turns free-text requirements into assigned tasks.
 *
 * All payloads are plain-data trees (maps, lists, strings, numbers, booleans)
 * so they can be checkpointed and persisted as JSON.
 */
public interface ProjectManagerAgent {

    /** Extract components, features and technologies from the requirements text. */
    Map<String, Object> parseRequirements(String requirements);

    /** Break parsed requirements into tasks with {@code title} and {@code description}. */
    List<Map<String, Object>> createTaskBreakdown(Map<String, Object> parsedRequirements);

    /**
     * Assign each task to a role. Every returned task carries an
     * {@code assigned_agent} key holding a role wire name.
     */
    List<Map<String, Object>> assignTasks(List<Map<String, Object>> tasks);
}
