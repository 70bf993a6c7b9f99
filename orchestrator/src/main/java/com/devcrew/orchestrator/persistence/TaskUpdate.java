package com.devcrew.orchestrator.persistence;

import com.devcrew.orchestrator.model.AgentRole;
import com.devcrew.orchestrator.model.Task;
import com.devcrew.orchestrator.model.TaskStatus;

/** Partial task update; null fields are left unchanged. */
public record TaskUpdate(String title, String description, AgentRole assignedAgent, TaskStatus status) {

    public static TaskUpdate status(TaskStatus status) {
        return new TaskUpdate(null, null, null, status);
    }

    void applyTo(Task task) {
        if (title != null)         task.setTitle(title);
        if (description != null)   task.setDescription(description);
        if (assignedAgent != null) task.setAssignedAgent(assignedAgent);
        if (status != null)        task.setStatus(status);
        task.touch();
    }
}
