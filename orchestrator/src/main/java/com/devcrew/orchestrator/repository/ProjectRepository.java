package com.devcrew.orchestrator.repository;

import com.devcrew.orchestrator.model.Project;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the projects table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface ProjectRepository extends JpaRepository<Project, UUID> {

    Optional<Project> findByName(String name);

    List<Project> findAllByOrderByCreatedAtAsc();
}
