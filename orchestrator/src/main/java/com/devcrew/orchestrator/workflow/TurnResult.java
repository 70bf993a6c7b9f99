package com.devcrew.orchestrator.workflow;

import com.devcrew.orchestrator.model.AgentRole;
import com.devcrew.orchestrator.state.Accumulator;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one agent turn: the accumulator entries to merge into the
 * workflow state and the scheduling decision.
 *
 * next is null when the turn expressed no preference. parked means the
 * workflow has nothing left to do.
 */
public record TurnResult(
        AgentRole role,
        String    agentId,
        int       processedMessages,
        Map<Accumulator, List<Map<String, Object>>> additions,
        AgentRole next,
        boolean   parked,
        boolean   failed
) {
    public static TurnResult idle(AgentRole role, String agentId) {
        return new TurnResult(role, agentId, 0, Map.of(), null, false, false);
    }

    public boolean isIdle() {
        return processedMessages == 0 && !failed;
    }
}
