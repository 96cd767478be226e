package com.ai.leadqualifier.controller;

import com.ai.leadqualifier.conversation.LeadConversation;
import com.ai.leadqualifier.conversation.QualificationCriteria;
import com.ai.leadqualifier.conversation.QualificationResult;
import com.ai.leadqualifier.conversation.QualificationStatus;
import com.ai.leadqualifier.dto.ConversationView;
import com.ai.leadqualifier.dto.CriteriaUpdateRequest;
import com.ai.leadqualifier.dto.EndConversationRequest;
import com.ai.leadqualifier.dto.InboundMessageRequest;
import com.ai.leadqualifier.dto.TestMessageRequest;
import com.ai.leadqualifier.provider.AiProvider;
import com.ai.leadqualifier.service.LeadHandoffSink;
import com.ai.leadqualifier.service.QualificationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * HTTP surface of the qualification engine. Delivering {@code response} back to
 * the lead is the messaging gateway's job.
 */
@RestController
@RequestMapping("/api/ai")
public class QualificationController {

    private static final Logger log = LoggerFactory.getLogger(QualificationController.class);

    private static final String NOT_FOUND = "Conversa não encontrada";

    private final QualificationEngine engine;
    private final LeadHandoffSink handoffSink;

    public QualificationController(QualificationEngine engine, LeadHandoffSink handoffSink) {
        this.engine = engine;
        this.handoffSink = handoffSink;
    }

    @PostMapping("/webhook/whatsapp")
    public ResponseEntity<Map<String, Object>> whatsappWebhook(@RequestBody(required = false) InboundMessageRequest request) {
        if (request == null || !StringUtils.hasText(request.getPhone()) || request.getMessage() == null) {
            return error(HttpStatus.BAD_REQUEST, "Payload inválido");
        }
        Map<String, Object> metadata = new HashMap<>();
        if (StringUtils.hasText(request.getName())) {
            metadata.put(LeadConversation.META_CONTACT_NAME, request.getName());
        }
        QualificationResult result = engine.processMessage(request.getPhone(), request.getMessage(), metadata);
        if (!result.isSuccess()) {
            return error(HttpStatus.BAD_REQUEST, result.getError());
        }

        Map<String, Object> data = toBody(result);
        boolean leadCreated = false;
        if (result.isShouldSendToCrm()) {
            Optional<Long> leadId = handoffSink.submit(result);
            leadCreated = leadId.isPresent();
            leadId.ifPresent(id -> data.put("crm_lead_id", id));
        }

        Map<String, Object> body = ok();
        body.put("status", result.getStatus().value());
        body.put("response", result.getResponse());
        body.put("crm_lead_created", leadCreated);
        body.put("data", data);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/test")
    public ResponseEntity<Map<String, Object>> test(@RequestBody(required = false) TestMessageRequest request) {
        if (request == null || !StringUtils.hasText(request.getPhone()) || request.getMessage() == null) {
            return error(HttpStatus.BAD_REQUEST, "Envie phone e message");
        }
        QualificationResult result = engine.processMessage(request.getPhone(), request.getMessage(), request.getMetadata());
        if (!result.isSuccess()) {
            return error(HttpStatus.BAD_REQUEST, result.getError());
        }
        Map<String, Object> body = ok();
        body.put("result", toBody(result));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        long total = 0;
        for (Map.Entry<QualificationStatus, Long> e : engine.getStats().entrySet()) {
            stats.put(e.getKey().value(), e.getValue());
            total += e.getValue();
        }
        stats.put("total", total);
        stats.put("provider", engine.getProvider().getStats());

        Map<String, Object> body = ok();
        body.put("stats", stats);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/conversations/active")
    public ResponseEntity<Map<String, Object>> activeConversations() {
        List<ConversationView> views = engine.getActiveConversations().stream()
                .map(ConversationView::summary)
                .collect(Collectors.toList());
        Map<String, Object> body = ok();
        body.put("conversations", views);
        body.put("total", views.size());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/conversations/{phone}")
    public ResponseEntity<Map<String, Object>> conversation(@PathVariable String phone) {
        Optional<LeadConversation> conversation = engine.getConversation(phone);
        if (conversation.isEmpty()) {
            return error(HttpStatus.NOT_FOUND, NOT_FOUND);
        }
        Map<String, Object> body = ok();
        body.put("conversation", ConversationView.detail(conversation.get()));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/conversations/{phone}/end")
    public ResponseEntity<Map<String, Object>> endConversation(@PathVariable String phone,
                                                               @RequestBody(required = false) EndConversationRequest request) {
        String reason = request != null ? request.getReason() : null;
        Optional<QualificationResult> result = engine.endConversation(phone, reason);
        if (result.isEmpty()) {
            return error(HttpStatus.NOT_FOUND, NOT_FOUND);
        }
        result.filter(QualificationResult::isShouldSendToCrm).ifPresent(handoffSink::submit);
        Map<String, Object> body = ok();
        body.put("message", "Conversa encerrada");
        body.put("data", toBody(result.get()));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/conversations/{phone}/escalate")
    public ResponseEntity<Map<String, Object>> escalate(@PathVariable String phone) {
        Optional<QualificationResult> result = engine.escalate(phone);
        if (result.isEmpty()) {
            return error(HttpStatus.NOT_FOUND, NOT_FOUND);
        }
        Map<String, Object> data = toBody(result.get());
        if (result.get().isShouldSendToCrm()) {
            handoffSink.submit(result.get()).ifPresent(id -> data.put("crm_lead_id", id));
        }
        Map<String, Object> body = ok();
        body.put("message", "Conversa escalada");
        body.put("data", data);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/config")
    public ResponseEntity<Map<String, Object>> getConfig() {
        Map<String, Object> body = ok();
        body.put("config", configBody(engine.getCriteria()));
        return ResponseEntity.ok(body);
    }

    @PutMapping("/config")
    public ResponseEntity<Map<String, Object>> updateConfig(@RequestBody(required = false) CriteriaUpdateRequest request) {
        if (request == null) {
            return error(HttpStatus.BAD_REQUEST, "Envie as configurações");
        }
        QualificationCriteria updated = request.applyTo(engine.getCriteria());
        engine.updateCriteria(updated);
        Map<String, Object> body = ok();
        body.put("message", "Configurações atualizadas");
        body.put("config", configBody(updated));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        AiProvider provider = engine.getProvider();
        boolean healthy = provider.healthCheck();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", healthy);
        body.put("provider", provider.getModelInfo());
        body.put("active_conversations", engine.getActiveConversations().size());
        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("Request failed", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private Map<String, Object> configBody(QualificationCriteria criteria) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("business_type", criteria.getBusinessType().key());
        config.put("model", engine.getProvider().getModel());
        config.put("min_score", criteria.getMinScore());
        config.put("max_attempts", criteria.getMaxAttempts());
        config.put("timeout_minutes", criteria.getTimeoutMinutes());
        config.put("required_fields", criteria.getRequiredFields());
        return config;
    }

    static Map<String, Object> toBody(QualificationResult result) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("success", result.isSuccess());
        data.put("status", result.getStatus().value());
        data.put("response", result.getResponse());
        data.put("collected_data", result.getCollectedData());
        data.put("score", result.getScore());
        data.put("should_send_to_crm", result.isShouldSendToCrm());
        if (result.isShouldSendToCrm()) {
            data.put("crm_data", result.getCrmData());
        }
        data.put("metadata", result.getMetadata());
        return data;
    }

    private static Map<String, Object> ok() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        return body;
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
