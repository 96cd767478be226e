package com.ai.leadqualifier.service;

import com.ai.leadqualifier.conversation.QualificationResult;
import com.ai.leadqualifier.entity.CrmLead;
import com.ai.leadqualifier.repository.CrmLeadRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Stores handoff payloads as CRM leads.
 */
@Service
@RequiredArgsConstructor
public class CrmLeadService implements LeadHandoffSink {

    private static final Logger log = LoggerFactory.getLogger(CrmLeadService.class);

    private final CrmLeadRepository repository;
    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public Optional<Long> submit(QualificationResult result) {
        if (result == null || !result.isShouldSendToCrm() || result.getCrmData().isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> crm = result.getCrmData();
        String phone = asText(crm.get("phone"));
        try {
            CrmLead saved = repository.save(toLead(crm));
            log.info("[{}] CRM lead {} created ({}, {})", phone, saved.getId(), saved.getStatus(), saved.getPriority());
            return Optional.of(saved.getId());
        } catch (JsonProcessingException | DataAccessException e) {
            log.error("[{}] Failed to create CRM lead", phone, e);
            return Optional.empty();
        }
    }

    CrmLead toLead(Map<String, Object> crm) throws JsonProcessingException {
        Object tags = crm.get("tags");
        Object customFields = crm.get("custom_fields");
        Object score = crm.get("qualification_score");
        return CrmLead.builder()
                .phone(asText(crm.get("phone")))
                .name(StringUtils.abbreviate(
                        StringUtils.defaultIfBlank(asText(crm.get("name")), asText(crm.get("phone"))),
                        CrmLead.NAME_LENGTH))
                .status(StringUtils.defaultIfBlank(asText(crm.get("status")), "new"))
                .source(StringUtils.defaultIfBlank(asText(crm.get("source")), QualificationEngine.SOURCE))
                .priority(StringUtils.defaultIfBlank(asText(crm.get("priority")), "medium"))
                .tags(mapper.writeValueAsString(tags != null ? tags : Collections.emptyList()))
                .customFields(mapper.writeValueAsString(customFields != null ? customFields : Collections.emptyMap()))
                .notes(StringUtils.defaultString(asText(crm.get("notes"))))
                .qualificationScore(score instanceof Number ? ((Number) score).intValue() : 0)
                .qualifiedAt(parseInstant(asText(crm.get("qualified_at"))))
                .build();
    }

    private static Instant parseInstant(String value) {
        if (StringUtils.isBlank(value)) return Instant.now();
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable qualified_at '{}', using current time", value);
            return Instant.now();
        }
    }

    private static String asText(Object value) {
        return value != null ? value.toString() : null;
    }
}
