package com.devcrew.orchestrator.agent;

import java.util.Map;

/**
 * Diagnoses a reported error and proposes a fix.
 *
 * The result must contain a {@code resolution} string, which is written to
 * the error record when it is marked resolved.
 */
public interface ErrorHandlingAgent {

    Map<String, Object> handleError(Map<String, Object> errorData, Map<String, Object> context);
}
