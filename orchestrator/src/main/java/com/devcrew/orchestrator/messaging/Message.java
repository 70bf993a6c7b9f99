package com.devcrew.orchestrator.messaging;

import com.devcrew.orchestrator.model.MessageType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Envelope for one message between agents.
 *
 * Everything except the read / processed flags is fixed at construction.
 * content is an opaque payload (task, implementation artefact, error report,
 * ...) and is expected to be a plain-data tree of maps, lists and scalars.
 */
public class Message {

    private final String      id;
    private final String      senderId;
    private final String      receiverId;
    private final Object      content;
    private final MessageType messageType;
    private final UUID        taskId;
    private final UUID        projectId;
    private final Map<String, Object> metadata;
    private final Instant     timestamp;

    private volatile boolean read;
    private volatile boolean processed;

    public Message(String senderId, String receiverId, Object content, MessageType messageType,
                   UUID taskId, UUID projectId, Map<String, Object> metadata) {
        this.id          = UUID.randomUUID().toString();
        this.senderId    = Objects.requireNonNull(senderId, "senderId");
        this.receiverId  = Objects.requireNonNull(receiverId, "receiverId");
        this.content     = content;
        this.messageType = Objects.requireNonNull(messageType, "messageType");
        this.taskId      = taskId;
        this.projectId   = projectId;
        this.metadata    = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.timestamp   = Instant.now();
    }

    public static Message of(String senderId, String receiverId, Object content, MessageType type) {
        return new Message(senderId, receiverId, content, type, null, null, null);
    }

    // ------------------------------------------------------------------
    // Receiver-side mutations
    // ------------------------------------------------------------------

    void markRead()      { this.read = true; }
    void markProcessed() { this.processed = true; }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String      getId()          { return id; }
    public String      getSenderId()    { return senderId; }
    public String      getReceiverId()  { return receiverId; }
    public Object      getContent()     { return content; }
    public MessageType getMessageType() { return messageType; }
    public UUID        getTaskId()      { return taskId; }
    public UUID        getProjectId()   { return projectId; }
    public Map<String, Object> getMetadata() { return metadata; }
    public Instant     getTimestamp()   { return timestamp; }
    public boolean     isRead()         { return read; }
    public boolean     isProcessed()    { return processed; }

    /**
     * Plain-data projection used for persistence: ids as strings and the
     * timestamp as ISO-8601. {@code includeContent=false} gives the short
     * form used in snapshots.
     */
    public Map<String, Object> toMap(boolean includeContent) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id",          id);
        out.put("senderId",    senderId);
        out.put("receiverId",  receiverId);
        out.put("messageType", messageType.wireName());
        out.put("taskId",      taskId == null ? null : taskId.toString());
        out.put("projectId",   projectId == null ? null : projectId.toString());
        out.put("timestamp",   timestamp.toString());
        out.put("read",        read);
        out.put("processed",   processed);
        if (includeContent) {
            out.put("content",  content);
            out.put("metadata", metadata);
        }
        return out;
    }

    @Override
    public String toString() {
        return "Message[" + id + " " + messageType.wireName() + " " + senderId + " -> " + receiverId + "]";
    }
}
