package com.devcrew.orchestrator.repository;

import com.devcrew.orchestrator.model.ErrorRecord;
import com.devcrew.orchestrator.model.ErrorStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ErrorRecordRepository extends JpaRepository<ErrorRecord, UUID> {

    List<ErrorRecord> findByTaskIdOrderByCreatedAtAsc(UUID taskId);

    List<ErrorRecord> findByStatusOrderByCreatedAtAsc(ErrorStatus status);

    List<ErrorRecord> findAllByOrderByCreatedAtAsc();
}
