package com.ai.leadqualifier.conversation;

import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * Business profile a qualification engine runs under. Selects the fields that
 * must be collected before a lead can qualify and the field labels used in prompts.
 */
public enum BusinessType {
    DEFAULT("default",
            List.of("name", "phone"),
            List.of(),
            "Um especialista da nossa equipe vai entrar em contato com você em breve."),
    ECOMMERCE("ecommerce",
            List.of("name", "phone", "product_interest"),
            List.of("Nome completo", "Produto de interesse", "Orçamento aproximado", "Prazo de compra"),
            "Ótimo! Vou conectar você com nosso consultor de vendas."),
    SERVICES("services",
            List.of("name", "phone", "service_type", "location"),
            List.of("Nome completo", "Tipo de serviço", "Localização", "Urgência"),
            "Perfeito! Um especialista vai entrar em contato."),
    B2B("b2b",
            List.of("name", "phone", "company", "role"),
            List.of("Nome completo", "Empresa", "Cargo", "Tamanho da empresa", "Necessidade específica"),
            "Excelente! Nosso time comercial vai preparar uma proposta."),
    REAL_ESTATE("real_estate",
            List.of("name", "phone", "property_type", "budget"),
            List.of("Nome completo", "Tipo de imóvel", "Localização preferida", "Faixa de preço", "Prazo"),
            "Ótimo! Vou direcionar para um corretor especializado.");

    private final String key;
    private final List<String> criticalFields;
    private final List<String> promptFields;
    private final String qualificationMessage;

    BusinessType(String key, List<String> criticalFields, List<String> promptFields, String qualificationMessage) {
        this.key = key;
        this.criticalFields = criticalFields;
        this.promptFields = promptFields;
        this.qualificationMessage = qualificationMessage;
    }

    public String key() {
        return key;
    }

    public List<String> getCriticalFields() {
        return criticalFields;
    }

    /** Human-readable field labels for the system prompt; empty means "use the criteria's required fields". */
    public List<String> getPromptFields() {
        return promptFields;
    }

    public String getQualificationMessage() {
        return qualificationMessage;
    }

    /**
     * Resolves a configured key, falling back to {@link #DEFAULT} for unknown or blank keys.
     */
    public static BusinessType fromKey(String key) {
        if (StringUtils.isBlank(key)) return DEFAULT;
        String k = key.trim();
        for (BusinessType t : values()) {
            if (t.key.equalsIgnoreCase(k) || t.name().equalsIgnoreCase(k)) return t;
        }
        return DEFAULT;
    }
}
