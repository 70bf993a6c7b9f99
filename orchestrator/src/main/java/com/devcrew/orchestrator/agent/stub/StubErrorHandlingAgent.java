package com.devcrew.orchestrator.agent.stub;

import com.devcrew.orchestrator.agent.ErrorHandlingAgent;
import com.devcrew.orchestrator.model.ErrorKind;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule-based diagnosis: the error kind decides severity, root cause and
 * fix strategy. Every error is reported as resolved.
 */
@Component
public class StubErrorHandlingAgent implements ErrorHandlingAgent {

    @Override
    public Map<String, Object> handleError(Map<String, Object> errorData, Map<String, Object> context) {
        Object type = errorData.get("errorType");
        ErrorKind kind = ErrorKind.classify(type == null ? null : type.toString());

        Map<String, Object> fix = new LinkedHashMap<>();
        fix.put("strategy", kind.fixStrategy());
        fix.put("steps",    List.of("reproduce", "apply fix", "re-run verification"));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("error_id",   errorData.get("errorId"));
        result.put("kind",       kind.wireName());
        result.put("severity",   kind.severity());
        result.put("root_cause", kind.rootCause());
        result.put("fix",        fix);
        result.put("resolution", "Applied fix strategy for " + kind.wireName() + ": " + kind.fixStrategy());
        result.put("status",     "resolved");
        return result;
    }
}
