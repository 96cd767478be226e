package com.ai.leadqualifier.conversation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single message in a lead conversation. Immutable once created.
 */
public final class Message {

    private final MessageRole role;
    private final String content;
    private final Instant timestamp;
    private final Map<String, Object> metadata;

    public Message(MessageRole role, String content, Instant timestamp, Map<String, Object> metadata) {
        this.role = role;
        this.content = content != null ? content : "";
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.metadata = metadata == null || metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public MessageRole getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public boolean isFromUser() {
        return role == MessageRole.USER;
    }
}
