package com.ai.leadqualifier.component;

import com.ai.leadqualifier.conversation.LeadConversation;
import com.ai.leadqualifier.conversation.QualificationStatus;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Process-wide, in-memory conversations keyed by phone.
 * <p>
 * Every mutation runs under that phone's lock, so two deliveries for the same
 * lead are applied one after the other while different leads proceed in
 * parallel. Readers get the copy published when the last locked section
 * finished and never wait on an in-flight turn.
 */
@Component
public class ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(ConversationStore.class);

    private final Map<String, Entry> conversations = new ConcurrentHashMap<>();
    private final Clock clock;

    public ConversationStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns the conversation for {@code phone}, creating an IN_PROGRESS one on first reference.
     */
    public ConversationHandle getOrCreate(String phone, String displayName) {
        boolean[] created = {false};
        Entry entry = conversations.computeIfAbsent(phone, key -> {
            created[0] = true;
            LeadConversation conversation = new LeadConversation(key, clock.instant());
            if (StringUtils.isNotBlank(displayName)) {
                conversation.putMetadata(LeadConversation.META_CONTACT_NAME, displayName.trim());
            }
            conversation.addNote("Conversa iniciada", conversation.getStartedAt());
            log.info("[{}] Conversation created", key);
            return new Entry(conversation);
        });
        return new ConversationHandle(phone, entry.published.copy(), created[0]);
    }

    /**
     * Runs {@code fn} with exclusive access to the phone's conversation, creating it if needed.
     */
    public <T> T withLock(String phone, String displayName, Function<LeadConversation, T> fn) {
        getOrCreate(phone, displayName);
        return runLocked(conversations.get(phone), fn);
    }

    /**
     * Same as {@link #withLock(String, String, Function)} but never creates; empty when the phone is unknown.
     */
    public <T> Optional<T> withExistingLock(String phone, Function<LeadConversation, T> fn) {
        Entry entry = conversations.get(phone);
        if (entry == null) return Optional.empty();
        return Optional.ofNullable(runLocked(entry, fn));
    }

    /**
     * Moves every IN_PROGRESS conversation idle for longer than {@code idleTimeout}
     * to TIMEOUT, each under its own lock.
     *
     * @return phones that timed out during this sweep
     */
    public List<String> sweepExpired(Instant now, Duration idleTimeout) {
        List<String> expired = new ArrayList<>();
        for (Map.Entry<String, Entry> e : conversations.entrySet()) {
            LeadConversation published = e.getValue().published;
            if (published.isTerminal()) continue;
            if (Duration.between(published.getLastActivityAt(), now).compareTo(idleTimeout) <= 0) continue;
            Boolean timedOut = runLocked(e.getValue(), conversation -> {
                if (conversation.isTerminal()) return false;
                Duration idle = Duration.between(conversation.getLastActivityAt(), now);
                if (idle.compareTo(idleTimeout) <= 0) return false;
                conversation.transitionTo(QualificationStatus.TIMEOUT, now);
                conversation.addNote("Conversa expirada após " + idle.toMinutes() + " minutos sem atividade", now);
                return true;
            });
            if (Boolean.TRUE.equals(timedOut)) {
                log.info("[{}] Conversation timed out", e.getKey());
                expired.add(e.getKey());
            }
        }
        return expired;
    }

    public Optional<LeadConversation> find(String phone) {
        Entry entry = conversations.get(phone);
        return entry != null ? Optional.of(entry.published.copy()) : Optional.empty();
    }

    public List<LeadConversation> findActive() {
        return conversations.values().stream()
                .map(e -> e.published)
                .filter(c -> !c.isTerminal())
                .map(LeadConversation::copy)
                .collect(Collectors.toList());
    }

    public Map<QualificationStatus, Long> countByStatus() {
        Map<QualificationStatus, Long> counts = new EnumMap<>(QualificationStatus.class);
        for (QualificationStatus s : QualificationStatus.values()) counts.put(s, 0L);
        for (Entry e : conversations.values()) counts.merge(e.published.getStatus(), 1L, Long::sum);
        return Collections.unmodifiableMap(counts);
    }

    public int size() {
        return conversations.size();
    }

    private <T> T runLocked(Entry entry, Function<LeadConversation, T> fn) {
        entry.lock.lock();
        try {
            return fn.apply(entry.conversation);
        } finally {
            entry.published = entry.conversation.copy();
            entry.lock.unlock();
        }
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private final LeadConversation conversation;
        private volatile LeadConversation published;

        private Entry(LeadConversation conversation) {
            this.conversation = conversation;
            this.published = conversation.copy();
        }
    }

    /**
     * Read-only view returned by {@link #getOrCreate(String, String)}.
     */
    public static final class ConversationHandle {
        private final String phone;
        private final LeadConversation snapshot;
        private final boolean created;

        ConversationHandle(String phone, LeadConversation snapshot, boolean created) {
            this.phone = phone;
            this.snapshot = snapshot;
            this.created = created;
        }

        public String getPhone() {
            return phone;
        }

        public LeadConversation getSnapshot() {
            return snapshot;
        }

        public boolean isCreated() {
            return created;
        }
    }
}
