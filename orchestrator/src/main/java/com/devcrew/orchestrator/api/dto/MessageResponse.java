package com.devcrew.orchestrator.api.dto;

import com.devcrew.orchestrator.messaging.Message;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A delivered message as returned by GET /projects/{id}/messages.
 * content is whatever the sending agent put on the bus.
 */
public record MessageResponse(
        String              id,
        String              senderId,
        String              receiverId,
        String              messageType,
        UUID                taskId,
        Object              content,
        Map<String, Object> metadata,
        Instant             timestamp,
        boolean             read,
        boolean             processed
) {
    public static MessageResponse from(Message m) {
        return new MessageResponse(
                m.getId(),
                m.getSenderId(),
                m.getReceiverId(),
                m.getMessageType().wireName(),
                m.getTaskId(),
                m.getContent(),
                m.getMetadata(),
                m.getTimestamp(),
                m.isRead(),
                m.isProcessed()
        );
    }
}
