package com.devcrew.orchestrator.workflow;

import com.devcrew.orchestrator.messaging.Message;
import com.devcrew.orchestrator.model.AgentRole;
import com.devcrew.orchestrator.model.MessageType;

import java.util.Set;

/**
 * Turn logic for one role.
 *
 * Declare an implementation as a Spring {@code @Component} and the
 * {@link AgentTurnProcessor} picks it up; exactly one handler per role.
 * Messages whose type is not in {@link #handledTypes()} are acknowledged
 * without calling {@link #handle}.
 */
public interface RoleHandler {

    AgentRole role();

    Set<MessageType> handledTypes();

    /**
     * React to one message: call the role's agent, forward results through
     * the context and pick the next role. Exceptions are allowed to escape;
     * the turn processor converts them into error reports.
     */
    void handle(Message message, TurnContext ctx);
}
