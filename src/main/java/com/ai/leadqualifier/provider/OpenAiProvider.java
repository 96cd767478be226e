package com.ai.leadqualifier.provider;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI Chat Completions backend.
 */
@Component
@ConditionalOnProperty(prefix = "ai", name = "provider", havingValue = "openai", matchIfMissing = true)
public class OpenAiProvider extends AbstractAiProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiProvider.class);

    private static final String PROVIDER_ID = "openai";
    private static final String CHAT_COMPLETIONS_PATH = "/chat/completions";

    private final RestTemplate restTemplate;
    private final String apiKey;
    private final String model;
    private final String baseUrl;

    @Autowired
    public OpenAiProvider(RestTemplateBuilder builder,
                          ProviderSettings settings,
                          @Value("${ai.openai.api-key:${OPENAI_API_KEY:}}") String apiKey,
                          @Value("${ai.openai.model:gpt-4o-mini}") String model,
                          @Value("${ai.openai.base-url:https://api.openai.com/v1}") String baseUrl) {
        this(builder
                        .setConnectTimeout(settings.getConnectTimeout())
                        .setReadTimeout(settings.getCallTimeout())
                        .build(),
                settings, apiKey, model, baseUrl);
    }

    OpenAiProvider(RestTemplate restTemplate, ProviderSettings settings, String apiKey, String model, String baseUrl) {
        super(settings);
        this.restTemplate = restTemplate;
        this.apiKey = apiKey;
        this.model = model;
        this.baseUrl = StringUtils.removeEnd(StringUtils.trimToEmpty(baseUrl), "/");
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public String getModel() {
        return model;
    }

    @Override
    public Map<String, Object> getModelInfo() {
        Map<String, Object> info = super.getModelInfo();
        info.put("api_key_configured", StringUtils.isNotBlank(apiKey));
        return info;
    }

    @Override
    protected String doGenerate(List<ChatMessage> messages, int maxTokens, double temperature,
                                Map<String, Object> options) throws Exception {
        if (StringUtils.isBlank(apiKey)) {
            log.error("OPENAI_API_KEY is not set");
            throw new ProviderException(ProviderException.Reason.UNAVAILABLE, "OpenAI API key is not configured", false);
        }

        Map<String, Object> body = new HashMap<>(options);
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        body.put("messages", toWire(messages));

        ResponseEntity<String> response = restTemplate.postForEntity(
                baseUrl + CHAT_COMPLETIONS_PATH, new HttpEntity<>(body, headers()), String.class);
        JsonNode root = mapper.readTree(response.getBody());
        recordTokens(root.path("usage").path("total_tokens").asLong(0));
        return root.path("choices").path(0).path("message").path("content").asText("");
    }

    @Override
    protected boolean doHealthCheck() throws Exception {
        if (StringUtils.isBlank(apiKey)) return false;
        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("max_tokens", 5);
        body.put("messages", toWire(List.of(ChatMessage.user("test"))));
        ResponseEntity<String> response = restTemplate.postForEntity(
                baseUrl + CHAT_COMPLETIONS_PATH, new HttpEntity<>(body, headers()), String.class);
        JsonNode root = mapper.readTree(response.getBody());
        return root.path("choices").isArray() && root.path("choices").size() > 0;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey.trim());
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    private static List<Map<String, String>> toWire(List<ChatMessage> messages) {
        List<Map<String, String>> wire = new ArrayList<>();
        for (ChatMessage msg : messages) {
            Map<String, String> m = new HashMap<>();
            m.put("role", msg.getRole());
            m.put("content", msg.getContent());
            wire.add(m);
        }
        return wire;
    }
}
