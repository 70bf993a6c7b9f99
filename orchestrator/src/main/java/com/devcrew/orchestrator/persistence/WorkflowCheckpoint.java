package com.devcrew.orchestrator.persistence;

import com.devcrew.orchestrator.state.WorkflowState;

import java.time.Instant;
import java.util.UUID;

/** A loaded checkpoint: sequence id, owning project (may be null) and decoded state. */
public record WorkflowCheckpoint(Long id, UUID projectId, Instant createdAt, WorkflowState state) {}
