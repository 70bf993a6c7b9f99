package com.devcrew.orchestrator.messaging;

import java.util.UUID;

/**
 * Optional criteria for {@link MessageBus#getMessageHistory}. Null fields
 * match anything; non-null fields are AND-combined.
 */
public record MessageFilter(UUID taskId, UUID projectId, String senderId, String receiverId) {

    public static MessageFilter any() {
        return new MessageFilter(null, null, null, null);
    }

    public static MessageFilter forReceiver(String receiverId) {
        return new MessageFilter(null, null, null, receiverId);
    }

    public static MessageFilter forSender(String senderId) {
        return new MessageFilter(null, null, senderId, null);
    }

    boolean matches(Message m) {
        return (taskId     == null || taskId.equals(m.getTaskId()))
            && (projectId  == null || projectId.equals(m.getProjectId()))
            && (senderId   == null || senderId.equals(m.getSenderId()))
            && (receiverId == null || receiverId.equals(m.getReceiverId()));
    }
}
