package com.ai.leadqualifier.conversation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one qualification turn: the reply for the lead plus the snapshot
 * and, on terminal transitions, the CRM handoff payload.
 */
public final class QualificationResult {

    private final boolean success;
    private final QualificationStatus status;
    private final String response;
    private final Map<String, Object> collectedData;
    private final int score;
    private final boolean shouldSendToCrm;
    private final Map<String, Object> crmData;
    private final Map<String, Object> metadata;

    private QualificationResult(boolean success, QualificationStatus status, String response,
                                Map<String, Object> collectedData, int score, boolean shouldSendToCrm,
                                Map<String, Object> crmData, Map<String, Object> metadata) {
        this.success = success;
        this.status = status;
        this.response = response != null ? response : "";
        this.collectedData = copy(collectedData);
        this.score = score;
        this.shouldSendToCrm = shouldSendToCrm;
        this.crmData = copy(crmData);
        this.metadata = copy(metadata);
    }

    /** Conversation continues; nothing goes to the CRM. */
    public static QualificationResult inProgress(LeadConversation conversation, String response,
                                                 Map<String, Object> metadata) {
        return new QualificationResult(true, conversation.getStatus(), response,
                conversation.getCollectedData(), conversation.getScore(), false, null, metadata);
    }

    /** Terminal transition with the CRM handoff payload. */
    public static QualificationResult terminal(LeadConversation conversation, String response,
                                               Map<String, Object> crmData, Map<String, Object> metadata) {
        return new QualificationResult(true, conversation.getStatus(), response,
                conversation.getCollectedData(), conversation.getScore(), true, crmData, metadata);
    }

    /** A reply that changed nothing, e.g. a message to a conversation that already ended. */
    public static QualificationResult unchanged(LeadConversation conversation, String response,
                                                Map<String, Object> metadata) {
        return new QualificationResult(true, conversation.getStatus(), response,
                conversation.getCollectedData(), conversation.getScore(), false, null, metadata);
    }

    /** Input rejected before reaching the engine. */
    public static QualificationResult rejected(String reason) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("error", reason);
        return new QualificationResult(false, QualificationStatus.IN_PROGRESS, "", null, 0, false, null, meta);
    }

    public boolean isSuccess() {
        return success;
    }

    public QualificationStatus getStatus() {
        return status;
    }

    public String getResponse() {
        return response;
    }

    public Map<String, Object> getCollectedData() {
        return collectedData;
    }

    public int getScore() {
        return score;
    }

    public boolean isShouldSendToCrm() {
        return shouldSendToCrm;
    }

    public Map<String, Object> getCrmData() {
        return crmData;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public String getError() {
        Object v = metadata.get("error");
        return v != null ? v.toString() : null;
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null || source.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
