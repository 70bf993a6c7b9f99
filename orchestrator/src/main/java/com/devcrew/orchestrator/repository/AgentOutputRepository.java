package com.devcrew.orchestrator.repository;

import com.devcrew.orchestrator.model.AgentOutput;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AgentOutputRepository extends JpaRepository<AgentOutput, UUID> {

    List<AgentOutput> findByTaskIdOrderByCreatedAtAsc(UUID taskId);

    List<AgentOutput> findByTaskIdAndAgentIdOrderByCreatedAtAsc(UUID taskId, String agentId);
}
