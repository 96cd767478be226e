package com.ai.leadqualifier.conversation;

import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Per-lead qualification state, keyed by phone. Holds the append-only message
 * log, facts collected so far, score, attempts and the audit notes.
 * <p>
 * Not thread-safe: instances are owned by {@code ConversationStore} and only
 * touched while holding that phone's lock.
 */
public class LeadConversation {

    public static final String META_CONTACT_NAME = "contact_name";

    private final String phone;
    private final List<Message> messages = new ArrayList<>();
    private final Map<String, Object> collectedData = new LinkedHashMap<>();
    private QualificationStatus status = QualificationStatus.IN_PROGRESS;
    private int score;
    private int attempts;
    private final List<String> notes = new ArrayList<>();
    private final Instant startedAt;
    private Instant lastActivityAt;
    private Instant endedAt;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    public LeadConversation(String phone, Instant startedAt) {
        this.phone = Objects.requireNonNull(phone, "phone");
        this.startedAt = startedAt != null ? startedAt : Instant.now();
        this.lastActivityAt = this.startedAt;
    }

    public String getPhone() {
        return phone;
    }

    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public List<Message> getUserMessages() {
        return messages.stream().filter(Message::isFromUser).collect(Collectors.toList());
    }

    public Message addMessage(MessageRole role, String content, Map<String, Object> messageMetadata, Instant at) {
        Message message = new Message(role, content, at, messageMetadata);
        messages.add(message);
        lastActivityAt = message.getTimestamp();
        return message;
    }

    public Map<String, Object> getCollectedData() {
        return Collections.unmodifiableMap(collectedData);
    }

    public String getString(String field) {
        Object v = collectedData.get(field);
        return v != null ? v.toString() : null;
    }

    public boolean isFilled(String field) {
        return isPresent(collectedData.get(field));
    }

    public int getFilledFieldCount() {
        return (int) collectedData.values().stream().filter(LeadConversation::isPresent).count();
    }

    /**
     * Merges freshly extracted facts. A non-null value overwrites the previous
     * one for the same field; null or blank values never erase anything.
     *
     * @return the fields whose value changed
     */
    public List<String> mergeCollectedData(Map<String, ?> extracted, Instant at) {
        if (extracted == null || extracted.isEmpty()) return Collections.emptyList();
        List<String> changed = new ArrayList<>();
        extracted.forEach((field, value) -> {
            if (field == null || !isPresent(value)) return;
            Object normalized = value instanceof String ? ((String) value).trim() : value;
            if (!Objects.equals(collectedData.get(field), normalized)) {
                collectedData.put(field, normalized);
                addNote("Campo '" + field + "' coletado: " + normalized, at);
                changed.add(field);
            }
        });
        return changed;
    }

    public QualificationStatus getStatus() {
        return status;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Moves to a terminal state and stamps {@code endedAt}. Only valid from IN_PROGRESS.
     */
    public void transitionTo(QualificationStatus next, Instant at) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Cannot move conversation " + phone + " from " + status + " to " + next);
        }
        status = next;
        endedAt = at != null ? at : Instant.now();
    }

    public int getScore() {
        return score;
    }

    public void setScore(int score) {
        this.score = Math.max(0, Math.min(100, score));
    }

    public int getAttempts() {
        return attempts;
    }

    public int incrementAttempts() {
        return ++attempts;
    }

    public List<String> getNotes() {
        return Collections.unmodifiableList(notes);
    }

    public void addNote(String note, Instant at) {
        notes.add("[" + (at != null ? at : Instant.now()) + "] " + note);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void putMetadata(String key, Object value) {
        if (key != null && value != null) metadata.put(key, value);
    }

    public String getDisplayName() {
        Object v = metadata.get(META_CONTACT_NAME);
        return v != null && StringUtils.isNotBlank(v.toString()) ? v.toString() : null;
    }

    /**
     * Detached deep copy used as the working state of a turn.
     */
    public LeadConversation copy() {
        LeadConversation c = new LeadConversation(phone, startedAt);
        c.copyStateFrom(this);
        return c;
    }

    /**
     * Replaces this conversation's state with {@code other}'s. Used to commit a
     * finished turn in one step.
     */
    public void copyStateFrom(LeadConversation other) {
        if (!phone.equals(other.phone)) {
            throw new IllegalArgumentException("Phone mismatch: " + phone + " vs " + other.phone);
        }
        messages.clear();
        messages.addAll(other.messages);
        collectedData.clear();
        collectedData.putAll(other.collectedData);
        notes.clear();
        notes.addAll(other.notes);
        metadata.clear();
        metadata.putAll(other.metadata);
        status = other.status;
        score = other.score;
        attempts = other.attempts;
        lastActivityAt = other.lastActivityAt;
        endedAt = other.endedAt;
    }

    private static boolean isPresent(Object value) {
        if (value == null) return false;
        if (value instanceof CharSequence) return StringUtils.isNotBlank((CharSequence) value);
        return true;
    }
}
