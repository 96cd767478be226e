package com.ai.leadqualifier.service;

import com.ai.leadqualifier.component.ConversationStore;
import com.ai.leadqualifier.component.ResponsePhrases;
import com.ai.leadqualifier.conversation.LeadConversation;
import com.ai.leadqualifier.conversation.MessageRole;
import com.ai.leadqualifier.conversation.QualificationCriteria;
import com.ai.leadqualifier.conversation.QualificationResult;
import com.ai.leadqualifier.conversation.QualificationStatus;
import com.ai.leadqualifier.provider.AiProvider;
import com.ai.leadqualifier.provider.ProviderException;
import com.ai.leadqualifier.service.QualificationPromptBuilder.PromptKind;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one qualification turn per inbound message and the manual overrides.
 * <p>
 * A turn holds the phone's lock for its whole duration but works on a copy of
 * the conversation; the copy replaces the live state only once every backend
 * call has returned or failed.
 */
@Service
public class QualificationEngine {

    private static final Logger log = LoggerFactory.getLogger(QualificationEngine.class);

    public static final String SOURCE = "ai_qualification";

    static final int REPLY_MAX_TOKENS = 300;
    static final double REPLY_TEMPERATURE = 0.7;

    private static final int MIN_PHONE_DIGITS = 10;
    private static final int MAX_PHONE_DIGITS = 15;

    private final ConversationStore store;
    private final LeadScoringService scoring;
    private final QualificationPromptBuilder prompts;
    private final AiProvider provider;
    private final ResponsePhrases phrases;
    private final Clock clock;
    private final AtomicReference<QualificationCriteria> criteria;

    public QualificationEngine(ConversationStore store,
                               LeadScoringService scoring,
                               QualificationPromptBuilder prompts,
                               AiProvider provider,
                               ResponsePhrases phrases,
                               Clock clock,
                               QualificationCriteria criteria) {
        this.store = store;
        this.scoring = scoring;
        this.prompts = prompts;
        this.provider = provider;
        this.phrases = phrases;
        this.clock = clock;
        this.criteria = new AtomicReference<>(criteria != null ? criteria : QualificationCriteria.defaults());
    }

    public QualificationResult processMessage(String phone, String message, Map<String, Object> metadata) {
        String key = normalizePhone(phone);
        if (key == null) {
            log.warn("Rejected inbound message with unparseable phone '{}'", phone);
            return QualificationResult.rejected("Telefone inválido");
        }
        if (StringUtils.isBlank(message)) {
            log.warn("[{}] Rejected empty inbound message", key);
            return QualificationResult.rejected("Mensagem vazia");
        }

        Map<String, Object> meta = metadata != null ? metadata : Collections.emptyMap();
        String displayName = displayName(meta);
        QualificationCriteria turnCriteria = criteria.get();

        return store.withLock(key, displayName, live -> {
            if (live.isTerminal()) {
                log.info("[{}] Message received after conversation ended as {}", key, live.getStatus());
                return QualificationResult.unchanged(live, phrases.alreadyWithTeam(), result("ignored", true));
            }
            LeadConversation draft = live.copy();
            QualificationResult result = runTurn(draft, message.trim(), meta, displayName, turnCriteria);
            live.copyStateFrom(draft);
            return result;
        });
    }

    /**
     * Closes a conversation by hand. Recorded as DISQUALIFIED with the reason in the notes.
     */
    public Optional<QualificationResult> endConversation(String phone, String reason) {
        String key = normalizePhone(phone);
        if (key == null) return Optional.empty();
        String why = StringUtils.defaultIfBlank(reason, "Manual");
        return store.withExistingLock(key, live -> {
            if (live.isTerminal()) {
                return QualificationResult.unchanged(live, "", result("already_ended", true));
            }
            LeadConversation draft = live.copy();
            draft.setScore(scoring.calculateScore(draft));
            QualificationResult r = terminate(draft, QualificationStatus.DISQUALIFIED,
                    phrases.disqualification(customerName(draft), phrases.disqualificationReason(), null),
                    "Conversa encerrada manualmente: " + why, result("reason", why));
            live.copyStateFrom(draft);
            return r;
        });
    }

    /**
     * Hands a conversation to a human regardless of the rules.
     */
    public Optional<QualificationResult> escalate(String phone) {
        String key = normalizePhone(phone);
        if (key == null) return Optional.empty();
        return store.withExistingLock(key, live -> {
            if (live.isTerminal()) {
                return QualificationResult.unchanged(live, "", result("already_ended", true));
            }
            LeadConversation draft = live.copy();
            draft.setScore(scoring.calculateScore(draft));
            QualificationResult r = terminate(draft, QualificationStatus.ESCALATED,
                    phrases.escalation(customerName(draft)),
                    "Escalado manualmente para atendimento humano", result("reason", "manual"));
            live.copyStateFrom(draft);
            return r;
        });
    }

    /**
     * Times out idle conversations and builds their handoff results.
     */
    public List<QualificationResult> handleTimeouts() {
        Duration idleTimeout = Duration.ofMinutes(criteria.get().getTimeoutMinutes());
        List<String> expired = store.sweepExpired(clock.instant(), idleTimeout);
        List<QualificationResult> results = new ArrayList<>();
        for (String phone : expired) {
            store.withExistingLock(phone, conversation -> {
                conversation.setScore(scoring.calculateScore(conversation));
                Instant at = conversation.getEndedAt() != null ? conversation.getEndedAt() : clock.instant();
                return QualificationResult.terminal(conversation, phrases.timeout(customerName(conversation)),
                        buildCrmData(conversation, at), result("reason", "timeout"));
            }).ifPresent(results::add);
        }
        return results;
    }

    public Map<QualificationStatus, Long> getStats() {
        return store.countByStatus();
    }

    public Optional<LeadConversation> getConversation(String phone) {
        String key = normalizePhone(phone);
        return key != null ? store.find(key) : Optional.empty();
    }

    public List<LeadConversation> getActiveConversations() {
        return store.findActive();
    }

    public QualificationCriteria getCriteria() {
        return criteria.get();
    }

    public void updateCriteria(QualificationCriteria updated) {
        if (updated == null) throw new IllegalArgumentException("criteria must not be null");
        QualificationCriteria previous = criteria.getAndSet(updated);
        log.info("Qualification criteria updated: {} -> {}", previous, updated);
    }

    public AiProvider getProvider() {
        return provider;
    }

    /**
     * Digits of the phone, without a messaging suffix such as {@code @c.us}; null when not a phone.
     */
    public static String normalizePhone(String phone) {
        if (StringUtils.isBlank(phone)) return null;
        String digits = StringUtils.getDigits(StringUtils.substringBefore(phone.trim(), "@"));
        if (digits.length() < MIN_PHONE_DIGITS || digits.length() > MAX_PHONE_DIGITS) return null;
        return digits;
    }

    private QualificationResult runTurn(LeadConversation draft, String message, Map<String, Object> meta,
                                        String displayName, QualificationCriteria turnCriteria) {
        String phone = draft.getPhone();
        if (displayName != null && draft.getDisplayName() == null) {
            draft.putMetadata(LeadConversation.META_CONTACT_NAME, displayName);
        }
        draft.addMessage(MessageRole.USER, message, meta, clock.instant());
        int attempts = draft.incrementAttempts();
        log.debug("[{}] Inbound message #{}: {}", phone, attempts, message);

        mergeExtraction(draft, turnCriteria);
        draft.setScore(scoring.calculateScore(draft));
        log.debug("[{}] Score {} with {} facts after attempt {}",
                phone, draft.getScore(), draft.getFilledFieldCount(), attempts);

        if (scoring.shouldDisqualify(draft, turnCriteria)) {
            return terminate(draft, QualificationStatus.DISQUALIFIED,
                    phrases.disqualification(customerName(draft),
                            phrases.disqualificationReason(), phrases.disqualificationAlternative()),
                    "Desqualificado automaticamente", result("reason", "rules"));
        }
        if (scoring.shouldEscalate(draft, turnCriteria)) {
            return terminate(draft, QualificationStatus.ESCALATED,
                    phrases.escalation(customerName(draft)),
                    "Escalado para atendimento humano", result("reason", "rules"));
        }
        if (scoring.shouldQualify(draft, turnCriteria)) {
            return terminate(draft, QualificationStatus.QUALIFIED,
                    phrases.handoff(customerName(draft), turnCriteria.getBusinessType().getQualificationMessage()),
                    "Lead qualificado com score " + draft.getScore(), result("reason", "rules"));
        }
        return continueConversation(draft, message, turnCriteria);
    }

    private void mergeExtraction(LeadConversation draft, QualificationCriteria turnCriteria) {
        Map<String, String> schema = prompts.extractionSchema(turnCriteria);
        String instruction = prompts.extract(prompts.conversationText(draft), schema);
        Map<String, Object> extracted;
        try {
            extracted = provider.extractStructuredData(instruction, schema);
        } catch (ProviderException e) {
            log.warn("[{}] Extraction failed ({}: {}), keeping collected data",
                    draft.getPhone(), e.getReason(), e.getMessage());
            return;
        }
        List<String> changed = draft.mergeCollectedData(extracted, clock.instant());
        if (!changed.isEmpty()) {
            log.debug("[{}] Collected {}", draft.getPhone(), changed);
        }
    }

    private QualificationResult continueConversation(LeadConversation draft, String message,
                                                     QualificationCriteria turnCriteria) {
        List<String> missing = scoring.missingFields(draft, turnCriteria.getRequiredFields());
        PromptKind kind = prompts.selectKind(draft);
        String reply;
        boolean fallback = false;
        try {
            reply = provider.generateResponse(prompts.buildReplyRequest(draft, turnCriteria, missing, message),
                    REPLY_MAX_TOKENS, REPLY_TEMPERATURE, Collections.emptyMap());
        } catch (ProviderException e) {
            log.warn("[{}] Reply generation failed ({}: {}), sending fallback",
                    draft.getPhone(), e.getReason(), e.getMessage());
            reply = phrases.fallback();
            fallback = true;
        }
        draft.addMessage(MessageRole.ASSISTANT, reply, null, clock.instant());

        Map<String, Object> meta = result("prompt", kind.name().toLowerCase(Locale.ROOT));
        meta.put("fallback", fallback);
        meta.put("attempts", draft.getAttempts());
        meta.put("missing_fields", missing);
        return QualificationResult.inProgress(draft, reply, meta);
    }

    private QualificationResult terminate(LeadConversation draft, QualificationStatus status, String response,
                                          String note, Map<String, Object> meta) {
        Instant now = clock.instant();
        draft.transitionTo(status, now);
        draft.addNote(note, now);
        draft.addMessage(MessageRole.ASSISTANT, response, null, now);
        log.info("[{}] Conversation {} with score {} after {} attempts",
                draft.getPhone(), status.value(), draft.getScore(), draft.getAttempts());
        return QualificationResult.terminal(draft, response, buildCrmData(draft, now), meta);
    }

    Map<String, Object> buildCrmData(LeadConversation conversation, Instant at) {
        Map<String, Object> crm = new LinkedHashMap<>();
        crm.put("phone", conversation.getPhone());
        crm.put("name", leadName(conversation));
        crm.put("status", conversation.getStatus().value());
        crm.put("source", SOURCE);
        crm.put("priority", scoring.determinePriority(conversation).value());
        crm.put("tags", scoring.suggestTags(conversation));
        crm.put("custom_fields", new LinkedHashMap<>(conversation.getCollectedData()));
        crm.put("notes", scoring.generateSummary(conversation));
        crm.put("qualification_score", conversation.getScore());
        crm.put("qualified_at", at.toString());
        crm.put("started_at", conversation.getStartedAt().toString());
        crm.put("ended_at", conversation.getEndedAt() != null ? conversation.getEndedAt().toString() : null);
        return crm;
    }

    private static String customerName(LeadConversation conversation) {
        String extracted = conversation.getString("name");
        return StringUtils.isNotBlank(extracted) ? extracted.trim() : conversation.getDisplayName();
    }

    private static String leadName(LeadConversation conversation) {
        String name = customerName(conversation);
        return name != null ? name : conversation.getPhone();
    }

    private static String displayName(Map<String, Object> meta) {
        Object v = meta.get(LeadConversation.META_CONTACT_NAME);
        if (v == null) v = meta.get("name");
        return v != null ? StringUtils.trimToNull(v.toString()) : null;
    }

    private static Map<String, Object> result(String key, Object value) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(key, value);
        return meta;
    }
}
