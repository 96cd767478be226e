package com.ai.leadqualifier.provider;

import java.util.List;
import java.util.Map;

/**
 * Remote text-generation backend used for lead replies and fact extraction.
 * One implementation per backend; the active one is chosen at startup.
 */
public interface AiProvider {

    /**
     * Generates a reply from the chat history.
     *
     * @throws ProviderException on transport failure, timeout or an empty/oversized reply,
     *                           after the adapter's own retry
     */
    String generateResponse(List<ChatMessage> messages, int maxTokens, double temperature, Map<String, Object> options);

    /**
     * Extracts the {@code schema} fields (name to type) from free text.
     * A reply that does not parse yields every schema key mapped to null; it never throws for that.
     *
     * @throws ProviderException when the backend itself cannot be reached
     */
    Map<String, Object> extractStructuredData(String text, Map<String, String> schema);

    /**
     * @return true when the backend answers; never throws
     */
    boolean healthCheck();

    /**
     * Provider id, e.g. "openai" or "ollama".
     */
    String getProviderId();

    String getModel();

    Map<String, Object> getModelInfo();

    Map<String, Object> getStats();
}
