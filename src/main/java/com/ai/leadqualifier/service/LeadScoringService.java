package com.ai.leadqualifier.service;

import com.ai.leadqualifier.config.QualificationKeywords;
import com.ai.leadqualifier.conversation.BusinessType;
import com.ai.leadqualifier.conversation.LeadConversation;
import com.ai.leadqualifier.conversation.LeadPriority;
import com.ai.leadqualifier.conversation.Message;
import com.ai.leadqualifier.conversation.QualificationCriteria;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic qualification rules over a conversation snapshot.
 * Only user-authored messages count; keyword matching is case-insensitive substring.
 * Every decision recomputes the score from the snapshot instead of trusting a stored value.
 */
@Service
public class LeadScoringService {

    static final int EXPECTED_FACTS = 5;
    static final int EXPECTED_USER_MESSAGES = 5;
    static final int EXPECTED_POSITIVE_SIGNALS = 3;
    static final int MAX_URGENCY_WEIGHT = 3;

    private static final int ESCALATION_SCORE = 70;
    private static final int SUMMARY_NOTES = 3;

    private final QualificationKeywords keywords;

    public LeadScoringService(QualificationKeywords keywords) {
        this.keywords = keywords;
    }

    /**
     * Lead score 0-100: completeness (40) + engagement (30) + positive signals (20) + urgency (10).
     */
    public int calculateScore(LeadConversation conversation) {
        List<String> userTexts = userTexts(conversation);

        double completeness = Math.min(conversation.getFilledFieldCount() / (double) EXPECTED_FACTS, 1.0);
        double engagement = Math.min(userTexts.size() / (double) EXPECTED_USER_MESSAGES, 1.0);

        int positiveCount = 0;
        for (String text : userTexts) {
            for (String signal : keywords.getPositiveSignals()) {
                if (text.contains(signal)) positiveCount++;
            }
        }
        double positive = Math.min(positiveCount / (double) EXPECTED_POSITIVE_SIGNALS, 1.0);

        int score = (int) (completeness * 40) + (int) (engagement * 30) + (int) (positive * 20)
                + Math.min(urgencyScore(conversation), 10);
        return Math.max(0, Math.min(score, 100));
    }

    /**
     * Highest urgency keyword weight found in any user message, scaled to 0-10.
     */
    public int urgencyScore(LeadConversation conversation) {
        int points = 0;
        for (String text : userTexts(conversation)) {
            for (Map.Entry<String, Integer> e : keywords.getUrgencyWeights().entrySet()) {
                if (text.contains(e.getKey())) points = Math.max(points, e.getValue());
            }
        }
        return Math.min((int) Math.round(points * 10.0 / MAX_URGENCY_WEIGHT), 10);
    }

    public boolean shouldDisqualify(LeadConversation conversation, QualificationCriteria criteria) {
        if (anyUserMessageContains(conversation, keywords.getDisqualification())) return true;
        return conversation.getAttempts() >= criteria.getMaxAttempts()
                && conversation.getFilledFieldCount() < 2;
    }

    public boolean shouldQualify(LeadConversation conversation, QualificationCriteria criteria) {
        if (!hasCriticalFields(conversation, criteria.getBusinessType())) return false;
        if (calculateScore(conversation) < criteria.getMinScore()) return false;
        return !shouldDisqualify(conversation, criteria);
    }

    /**
     * Explicit request for a human always escalates. Otherwise a lead that cannot
     * qualify yet escalates when it is stalling near the attempt limit or when it
     * scores high but is still missing critical facts.
     */
    public boolean shouldEscalate(LeadConversation conversation, QualificationCriteria criteria) {
        if (anyUserMessageContains(conversation, keywords.getHumanRequest())) return true;
        if (shouldQualify(conversation, criteria)) return false;
        if (conversation.getAttempts() >= criteria.getMaxAttempts() - 1
                && conversation.getFilledFieldCount() < 3) {
            return true;
        }
        return calculateScore(conversation) >= ESCALATION_SCORE;
    }

    public boolean hasCriticalFields(LeadConversation conversation, BusinessType businessType) {
        BusinessType type = businessType != null ? businessType : BusinessType.DEFAULT;
        return type.getCriticalFields().stream().allMatch(conversation::isFilled);
    }

    public List<String> missingFields(LeadConversation conversation, List<String> required) {
        List<String> missing = new ArrayList<>();
        for (String field : required) {
            if (!conversation.isFilled(field)) missing.add(field);
        }
        return missing;
    }

    public LeadPriority determinePriority(LeadConversation conversation) {
        int score = calculateScore(conversation);
        int urgency = urgencyScore(conversation);
        if (score >= 80 && urgency >= 7) return LeadPriority.URGENT;
        if (score >= 70 || urgency >= 7) return LeadPriority.HIGH;
        if (score >= 50) return LeadPriority.MEDIUM;
        return LeadPriority.LOW;
    }

    public List<String> suggestTags(LeadConversation conversation) {
        Set<String> tags = new LinkedHashSet<>();
        tags.add("ai_qualified");
        if (urgencyScore(conversation) >= 7) tags.add("urgent");
        String allText = String.join(" ", userTexts(conversation));
        keywords.getTagKeywords().forEach((keyword, tag) -> {
            if (allText.contains(keyword)) tags.add(tag);
        });
        return new ArrayList<>(tags);
    }

    /**
     * Handoff digest for the salesperson picking the lead up.
     */
    public String generateSummary(LeadConversation conversation) {
        StringBuilder sb = new StringBuilder();
        sb.append("Score: ").append(calculateScore(conversation)).append("/100 | Prioridade: ")
                .append(determinePriority(conversation).value().toUpperCase(Locale.ROOT));

        Map<String, Object> data = conversation.getCollectedData();
        if (!data.isEmpty()) {
            sb.append("\n\nInformações coletadas:");
            data.forEach((k, v) -> {
                if (v != null && StringUtils.isNotBlank(v.toString())) {
                    sb.append("\n• ").append(k).append(": ").append(v);
                }
            });
        }

        List<String> notes = conversation.getNotes();
        if (!notes.isEmpty()) {
            sb.append("\n\nObservações:");
            for (String note : notes.subList(Math.max(0, notes.size() - SUMMARY_NOTES), notes.size())) {
                sb.append("\n• ").append(note);
            }
        }

        List<Message> userMessages = conversation.getUserMessages();
        if (!userMessages.isEmpty()) {
            sb.append("\n\nMensagens do cliente: ").append(userMessages.size());
            sb.append("\nPrimeira mensagem: \"")
                    .append(StringUtils.abbreviate(userMessages.get(0).getContent(), 100))
                    .append('"');
        }
        return sb.toString();
    }

    private boolean anyUserMessageContains(LeadConversation conversation, List<String> phrases) {
        for (String text : userTexts(conversation)) {
            for (String phrase : phrases) {
                if (text.contains(phrase)) return true;
            }
        }
        return false;
    }

    private static List<String> userTexts(LeadConversation conversation) {
        List<String> texts = new ArrayList<>();
        for (Message m : conversation.getMessages()) {
            if (m.isFromUser()) texts.add(m.getContent().toLowerCase(Locale.ROOT));
        }
        return texts;
    }
}
