package com.devcrew.orchestrator.state;

import com.devcrew.orchestrator.model.ErrorKind;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * In-memory error entry attached to SystemState.
 *
 * recordId points at the persisted ErrorRecord when the store accepted it,
 * and is null when persisting failed.
 */
public record ErrorReport(
        UUID      recordId,
        UUID      taskId,
        String    agentId,
        String    errorType,
        String    errorMessage,
        String    stackTrace,
        ErrorKind kind,
        Instant   createdAt
) {
    public static ErrorReport of(UUID recordId, UUID taskId, String agentId,
                                 String errorType, String errorMessage, String stackTrace) {
        return new ErrorReport(recordId, taskId, agentId, errorType, errorMessage, stackTrace,
                ErrorKind.classify(errorType), Instant.now());
    }

    public static ErrorReport fromThrowable(UUID taskId, String agentId, Throwable error) {
        return new ErrorReport(null, taskId, agentId,
                error.getClass().getSimpleName(),
                String.valueOf(error.getMessage()),
                stackTraceOf(error),
                ErrorKind.classify(error),
                Instant.now());
    }

    public ErrorReport withRecordId(UUID id) {
        return new ErrorReport(id, taskId, agentId, errorType, errorMessage, stackTrace, kind, createdAt);
    }

    /** Plain-data view; used for error messages and snapshots. */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("errorId",      recordId == null ? null : recordId.toString());
        out.put("taskId",       taskId == null ? null : taskId.toString());
        out.put("agentId",      agentId);
        out.put("errorType",    errorType);
        out.put("errorMessage", errorMessage);
        out.put("stackTrace",   stackTrace);
        out.put("kind",         kind.wireName());
        out.put("createdAt",    createdAt.toString());
        return out;
    }

    public static String stackTraceOf(Throwable error) {
        StringWriter sw = new StringWriter();
        error.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }
}
