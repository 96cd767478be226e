package com.ai.leadqualifier.provider;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
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
 * Self-hosted Ollama backend ({@code /api/chat}, non-streaming).
 */
@Component
@ConditionalOnProperty(prefix = "ai", name = "provider", havingValue = "ollama")
public class OllamaProvider extends AbstractAiProvider {

    private static final String PROVIDER_ID = "ollama";
    private static final String CHAT_PATH = "/api/chat";
    private static final String TAGS_PATH = "/api/tags";

    private final RestTemplate restTemplate;
    private final String model;
    private final String baseUrl;

    @Autowired
    public OllamaProvider(RestTemplateBuilder builder,
                          ProviderSettings settings,
                          @Value("${ai.ollama.model:llama3.1}") String model,
                          @Value("${ai.ollama.base-url:http://localhost:11434}") String baseUrl) {
        this(builder
                        .setConnectTimeout(settings.getConnectTimeout())
                        .setReadTimeout(settings.getCallTimeout())
                        .build(),
                settings, model, baseUrl);
    }

    OllamaProvider(RestTemplate restTemplate, ProviderSettings settings, String model, String baseUrl) {
        super(settings);
        this.restTemplate = restTemplate;
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
    protected String doGenerate(List<ChatMessage> messages, int maxTokens, double temperature,
                                Map<String, Object> options) throws Exception {
        Map<String, Object> modelOptions = new HashMap<>(options);
        modelOptions.put("temperature", temperature);
        modelOptions.put("num_predict", maxTokens);

        List<Map<String, String>> wire = new ArrayList<>();
        for (ChatMessage msg : messages) {
            Map<String, String> m = new HashMap<>();
            m.put("role", msg.getRole());
            m.put("content", msg.getContent());
            wire.add(m);
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("stream", false);
        body.put("messages", wire);
        body.put("options", modelOptions);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<String> response = restTemplate.postForEntity(
                baseUrl + CHAT_PATH, new HttpEntity<>(body, headers), String.class);
        JsonNode root = mapper.readTree(response.getBody());
        recordTokens(root.path("prompt_eval_count").asLong(0) + root.path("eval_count").asLong(0));
        return root.path("message").path("content").asText("");
    }

    @Override
    protected boolean doHealthCheck() {
        ResponseEntity<String> response = restTemplate.getForEntity(baseUrl + TAGS_PATH, String.class);
        return response.getStatusCode().is2xxSuccessful();
    }
}
