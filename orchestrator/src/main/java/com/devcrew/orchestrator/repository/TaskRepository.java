package com.devcrew.orchestrator.repository;

import com.devcrew.orchestrator.model.Task;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface TaskRepository extends JpaRepository<Task, UUID> {

    /** All tasks of a project, in creation order. */
    List<Task> findByProjectIdOrderByCreatedAtAsc(UUID projectId);
}
