package com.devcrew.orchestrator.api.dto;

import java.util.UUID;

public record ProjectCreatedResponse(UUID projectId) {}
