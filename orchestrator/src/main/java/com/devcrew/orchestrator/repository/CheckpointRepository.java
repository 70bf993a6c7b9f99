package com.devcrew.orchestrator.repository;

import com.devcrew.orchestrator.model.Checkpoint;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

/**
 * Checkpoint lookups. "Latest" is always the highest id: ids come from an
 * identity column, so ordering never depends on clock resolution.
 */
public interface CheckpointRepository extends JpaRepository<Checkpoint, Long> {

    Optional<Checkpoint> findTopByOrderByIdDesc();

    Optional<Checkpoint> findTopByProjectIdOrderByIdDesc(UUID projectId);
}
