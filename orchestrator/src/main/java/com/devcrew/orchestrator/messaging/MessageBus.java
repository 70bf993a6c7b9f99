package com.devcrew.orchestrator.messaging;

import com.devcrew.orchestrator.model.MessageType;
import com.devcrew.orchestrator.persistence.PersistenceStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-receiver mailboxes plus a flat, append-only history.
 *
 * <p>Delivery is in send order per receiver. The history is the audit trail:
 * {@link #clearProcessedMessages()} only sweeps mailboxes.
 *
 * <p>When a store is configured every sent message is also persisted as an
 * agent output of type {@code message_<type>}. Persistence problems are
 * logged and never reach the sender.
 *
 * <p>One bus lives per initialised workflow. Methods are synchronized on the
 * bus, which is enough for the single-writer orchestrator and keeps the
 * read-modify-write of read flags atomic if turns ever run in parallel.
 */
public class MessageBus {

    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    public static final String REDELIVERY_OF    = "redeliveryOf";
    public static final String DELIVERY_ATTEMPT = "deliveryAttempt";

    private final Map<String, List<Message>> mailboxes = new LinkedHashMap<>();
    private final List<Message> history = new ArrayList<>();

    private final PersistenceStore store;   // null → in-memory only
    private final ObjectMapper     objectMapper;

    public MessageBus(PersistenceStore store, ObjectMapper objectMapper) {
        this.store        = store;
        this.objectMapper = objectMapper;
    }

    // ------------------------------------------------------------------
    // Sending
    // ------------------------------------------------------------------

    /**
     * Deliver a message to its receiver's mailbox and the history.
     *
     * @return the message id, also when persisting the message failed
     */
    public synchronized String send(Message message) {
        mailboxes.computeIfAbsent(message.getReceiverId(), k -> new ArrayList<>()).add(message);
        history.add(message);
        log.debug("Sent {}", message);
        persist(message);
        return message.getId();
    }

    /** One message per receiver, all sharing the same content reference. */
    public synchronized List<String> broadcast(String senderId, List<String> receiverIds, Object content,
                                               MessageType type, UUID taskId, UUID projectId,
                                               Map<String, Object> metadata) {
        List<String> ids = new ArrayList<>(receiverIds.size());
        for (String receiverId : receiverIds) {
            ids.add(send(new Message(senderId, receiverId, content, type, taskId, projectId, metadata)));
        }
        return ids;
    }

    public List<String> broadcast(String senderId, List<String> receiverIds, Object content) {
        return broadcast(senderId, receiverIds, content, MessageType.BROADCAST, null, null, null);
    }

    // ------------------------------------------------------------------
    // Receiving
    // ------------------------------------------------------------------

    /** Snapshot of the receiver's mailbox in delivery order. */
    public synchronized List<Message> getMessages(String receiverId, boolean markRead) {
        List<Message> box = mailboxes.getOrDefault(receiverId, List.of());
        List<Message> out = new ArrayList<>(box);
        if (markRead) {
            out.forEach(Message::markRead);
        }
        return out;
    }

    public List<Message> getMessages(String receiverId) {
        return getMessages(receiverId, true);
    }

    /**
     * Messages never fetched before with {@code markRead=true}, in delivery order.
     * Once read, a message is never returned here again.
     */
    public synchronized List<Message> getUnreadMessages(String receiverId, boolean markRead) {
        List<Message> out = new ArrayList<>();
        for (Message m : mailboxes.getOrDefault(receiverId, List.of())) {
            if (!m.isRead()) {
                out.add(m);
            }
        }
        if (markRead) {
            out.forEach(Message::markRead);
        }
        return out;
    }

    public List<Message> getUnreadMessages(String receiverId) {
        return getUnreadMessages(receiverId, true);
    }

    /**
     * Mark one message read. Used by the turn loop, which fetches with
     * {@code markRead=false} and marks each message as it is dispatched.
     *
     * @return false if no mailbox holds the id
     */
    public synchronized boolean markRead(String messageId) {
        for (List<Message> box : mailboxes.values()) {
            for (Message m : box) {
                if (m.getId().equals(messageId)) {
                    m.markRead();
                    return true;
                }
            }
        }
        return false;
    }

    /** Number of unread messages without marking anything. */
    public synchronized int countUnread(String receiverId) {
        int n = 0;
        for (Message m : mailboxes.getOrDefault(receiverId, List.of())) {
            if (!m.isRead()) n++;
        }
        return n;
    }

    /**
     * Flag a message as processed. Idempotent: returns true for a message
     * that is already processed, false only when the id is unknown.
     */
    public synchronized boolean markProcessed(String messageId) {
        for (List<Message> box : mailboxes.values()) {
            for (Message m : box) {
                if (m.getId().equals(messageId)) {
                    m.markProcessed();
                    return true;
                }
            }
        }
        for (Message m : history) {
            if (m.getId().equals(messageId)) {
                m.markProcessed();
                return true;
            }
        }
        return false;
    }

    // ------------------------------------------------------------------
    // History
    // ------------------------------------------------------------------

    public synchronized Optional<Message> findMessage(String messageId) {
        return history.stream().filter(m -> m.getId().equals(messageId)).findFirst();
    }

    /**
     * Send a fresh, unread copy of an earlier message to the same receiver,
     * keeping its sender, type, task and content. The copy's metadata records
     * the id of the first delivery under {@value #REDELIVERY_OF} and the
     * attempt number under {@value #DELIVERY_ATTEMPT}. The original message
     * is left as it is, so read flags stay monotonic.
     *
     * @return the copy, or empty when the id is unknown
     */
    public synchronized Optional<Message> redeliver(String messageId) {
        Optional<Message> source = findMessage(messageId);
        if (source.isEmpty()) {
            log.warn("Cannot redeliver unknown message {}", messageId);
            return Optional.empty();
        }
        Message original = source.get();
        Map<String, Object> metadata = new LinkedHashMap<>(original.getMetadata());
        metadata.putIfAbsent(REDELIVERY_OF, original.getId());
        metadata.put(DELIVERY_ATTEMPT, deliveryAttempt(original) + 1);
        Message copy = new Message(original.getSenderId(), original.getReceiverId(), original.getContent(),
                original.getMessageType(), original.getTaskId(), original.getProjectId(), metadata);
        send(copy);
        log.info("Redelivered {} as {} (attempt {})", original.getId(), copy.getId(), metadata.get(DELIVERY_ATTEMPT));
        return Optional.of(copy);
    }

    /** 1 for a first delivery, n for the (n-1)th redelivery. */
    public static int deliveryAttempt(Message message) {
        Object attempt = message.getMetadata().get(DELIVERY_ATTEMPT);
        return attempt instanceof Number ? ((Number) attempt).intValue() : 1;
    }

    public synchronized List<Message> getMessageHistory(MessageFilter filter) {
        MessageFilter f = filter == null ? MessageFilter.any() : filter;
        return history.stream().filter(f::matches).toList();
    }

    /**
     * Remove processed messages from the mailboxes. The history is untouched.
     *
     * @return number of messages removed
     */
    public synchronized int clearProcessedMessages() {
        int removed = 0;
        for (List<Message> box : mailboxes.values()) {
            Iterator<Message> it = box.iterator();
            while (it.hasNext()) {
                if (it.next().isProcessed()) {
                    it.remove();
                    removed++;
                }
            }
        }
        log.debug("Cleared {} processed message(s) from mailboxes", removed);
        return removed;
    }

    public synchronized int historySize() {
        return history.size();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void persist(Message message) {
        if (store == null) {
            return;
        }
        Map<String, Object> projection;
        try {
            projection = objectMapper.convertValue(message.toMap(true), MAP_TYPE);
        } catch (IllegalArgumentException e) {
            log.warn("Could not serialize message {} for persistence, storing placeholder: {}",
                    message.getId(), e.getMessage());
            projection = new LinkedHashMap<>();
            projection.put("messageId", message.getId());
            projection.put("error", String.valueOf(e.getMessage()));
        }
        try {
            store.storeAgentOutput(message.getTaskId(), message.getSenderId(),
                    "message_" + message.getMessageType().wireName(), projection);
        } catch (RuntimeException e) {
            log.warn("Could not persist message {} from {}: {}",
                    message.getId(), message.getSenderId(), e.getMessage());
        }
    }
}
