package com.ai.leadqualifier.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword tables the scoring rules match against (case-insensitive substring).
 * Immutable; built once and shared by the rules.
 */
public final class QualificationKeywords {

    private final List<String> disqualification;
    private final Map<String, Integer> urgencyWeights;
    private final List<String> positiveSignals;
    private final List<String> humanRequest;
    private final Map<String, String> tagKeywords;

    public QualificationKeywords(List<String> disqualification, Map<String, Integer> urgencyWeights,
                                 List<String> positiveSignals, List<String> humanRequest,
                                 Map<String, String> tagKeywords) {
        this.disqualification = Collections.unmodifiableList(new ArrayList<>(disqualification));
        this.urgencyWeights = Collections.unmodifiableMap(new LinkedHashMap<>(urgencyWeights));
        this.positiveSignals = Collections.unmodifiableList(new ArrayList<>(positiveSignals));
        this.humanRequest = Collections.unmodifiableList(new ArrayList<>(humanRequest));
        this.tagKeywords = Collections.unmodifiableMap(new LinkedHashMap<>(tagKeywords));
    }

    public static QualificationKeywords defaults() {
        Map<String, Integer> urgency = new LinkedHashMap<>();
        urgency.put("urgente", 3);
        urgency.put("hoje", 3);
        urgency.put("agora", 3);
        urgency.put("rápido", 2);
        urgency.put("logo", 2);
        urgency.put("em breve", 1);

        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("orçamento", "budget_request");
        tags.put("valor", "pricing_inquiry");
        tags.put("comprar", "ready_to_buy");
        tags.put("dúvida", "has_questions");
        tags.put("comparar", "comparing_options");
        tags.put("urgente", "urgent");
        tags.put("problema", "has_issue");

        return new QualificationKeywords(
                List.of("spam", "teste", "bot", "desisto", "não quero mais", "me tire da lista"),
                urgency,
                List.of("interessado", "quero", "preciso", "gostaria", "quando", "como",
                        "quanto custa", "valor", "comprar", "contratar", "orçamento"),
                List.of("falar com pessoa", "atendente", "humano", "pessoa real"),
                tags);
    }

    public List<String> getDisqualification() {
        return disqualification;
    }

    public Map<String, Integer> getUrgencyWeights() {
        return urgencyWeights;
    }

    public List<String> getPositiveSignals() {
        return positiveSignals;
    }

    public List<String> getHumanRequest() {
        return humanRequest;
    }

    public Map<String, String> getTagKeywords() {
        return tagKeywords;
    }
}
