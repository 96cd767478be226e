package com.ai.leadqualifier.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Failure contract shared by all backends: a ceiling on concurrent calls, a
 * per-call timeout, one retry after a fixed delay for transient failures, and
 * validation of the generated text. Subclasses only perform the raw call.
 */
public abstract class AbstractAiProvider implements AiProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractAiProvider.class);

    static final int RETRIES = 1;

    private static final String EXTRACTOR_SYSTEM_PROMPT =
            "Você é um extrator de dados especializado. Retorne apenas JSON válido.";
    private static final int EXTRACTION_MAX_TOKENS = 500;
    private static final double EXTRACTION_TEMPERATURE = 0.1;

    protected final ObjectMapper mapper = new ObjectMapper();
    protected final ProviderSettings settings;

    private final Semaphore callSlots;
    private final ExecutorService callExecutor;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong totalErrors = new AtomicLong();
    private final AtomicLong totalRetries = new AtomicLong();
    private final AtomicLong totalTokens = new AtomicLong();

    protected AbstractAiProvider(ProviderSettings settings) {
        this.settings = settings != null ? settings : ProviderSettings.builder().build();
        this.callSlots = new Semaphore(Math.max(1, this.settings.getMaxConcurrentCalls()), true);
        AtomicInteger threadCount = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, getClass().getSimpleName().toLowerCase() + "-call-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Performs one raw completion call. Runs on a provider worker thread and may be interrupted on timeout.
     */
    protected abstract String doGenerate(List<ChatMessage> messages, int maxTokens, double temperature,
                                         Map<String, Object> options) throws Exception;

    /**
     * Cheapest request that proves the backend is reachable.
     */
    protected abstract boolean doHealthCheck() throws Exception;

    @Override
    public String generateResponse(List<ChatMessage> messages, int maxTokens, double temperature,
                                   Map<String, Object> options) {
        totalRequests.incrementAndGet();
        ProviderException last = null;
        for (int attempt = 0; attempt <= RETRIES; attempt++) {
            try {
                String text = callWithLimits(() -> doGenerate(messages, maxTokens, temperature,
                        options != null ? options : Map.of()));
                return validate(text);
            } catch (ProviderException e) {
                last = e;
                if (!e.isRetryable() || attempt == RETRIES) break;
                totalRetries.incrementAndGet();
                log.warn("{} call failed ({}: {}), retrying in {}ms",
                        getProviderId(), e.getReason(), e.getMessage(), settings.getRetryDelay().toMillis());
                pause();
            }
        }
        totalErrors.incrementAndGet();
        throw last;
    }

    @Override
    public Map<String, Object> extractStructuredData(String text, Map<String, String> schema) {
        List<ChatMessage> messages = List.of(
                ChatMessage.system(EXTRACTOR_SYSTEM_PROMPT),
                ChatMessage.user(text));
        String raw;
        try {
            raw = generateResponse(messages, EXTRACTION_MAX_TOKENS, EXTRACTION_TEMPERATURE, Map.of());
        } catch (ProviderException e) {
            if (e.getReason() != ProviderException.Reason.INVALID_RESPONSE) throw e;
            log.warn("{} extraction returned an unusable reply, no fields extracted", getProviderId());
            return emptyExtraction(schema);
        }
        return parseExtraction(raw, schema);
    }

    @Override
    public boolean healthCheck() {
        try {
            return Boolean.TRUE.equals(callWithLimits(this::doHealthCheck));
        } catch (ProviderException e) {
            log.warn("{} health check failed: {}", getProviderId(), e.getMessage());
            return false;
        }
    }

    @Override
    public Map<String, Object> getModelInfo() {
        Map<String, Object> capabilities = new LinkedHashMap<>();
        capabilities.put("chat", true);
        capabilities.put("extraction", true);
        capabilities.put("streaming", false);

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("provider", getProviderId());
        info.put("model", getModel());
        info.put("capabilities", capabilities);
        return info;
    }

    @Override
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("provider", getProviderId());
        stats.put("model", getModel());
        stats.put("total_requests", totalRequests.get());
        stats.put("total_tokens", totalTokens.get());
        stats.put("retries", totalRetries.get());
        stats.put("errors", totalErrors.get());
        stats.put("available_call_slots", callSlots.availablePermits());
        return stats;
    }

    protected void recordTokens(long tokens) {
        if (tokens > 0) totalTokens.addAndGet(tokens);
    }

    /**
     * Parses an extraction reply into exactly the schema's keys. Markdown fences
     * and prose around the JSON object are ignored; anything unparsable maps every key to null.
     */
    Map<String, Object> parseExtraction(String raw, Map<String, String> schema) {
        Map<String, Object> result = emptyExtraction(schema);
        String body = StringUtils.trimToEmpty(raw).replace("```json", "").replace("```", "");
        int start = body.indexOf('{');
        int end = body.lastIndexOf('}');
        if (start < 0 || end < start) {
            log.warn("{} extraction reply has no JSON object, no fields extracted", getProviderId());
            return result;
        }
        try {
            JsonNode root = mapper.readTree(body.substring(start, end + 1));
            if (root == null || !root.isObject()) return result;
            for (Map.Entry<String, String> field : schema.entrySet()) {
                result.put(field.getKey(), toValue(root.get(field.getKey()), field.getValue()));
            }
            return result;
        } catch (JsonProcessingException e) {
            log.warn("{} extraction reply is not valid JSON, no fields extracted", getProviderId());
            return emptyExtraction(schema);
        }
    }

    protected ProviderException translate(Exception e) {
        if (e instanceof ProviderException) return (ProviderException) e;
        if (e instanceof ResourceAccessException) {
            return new ProviderException(ProviderException.Reason.TRANSPORT, e.getMessage(), true, e);
        }
        if (e instanceof HttpStatusCodeException) {
            HttpStatusCodeException http = (HttpStatusCodeException) e;
            int status = http.getStatusCode().value();
            boolean transientStatus = status == 429 || http.getStatusCode().is5xxServerError();
            return new ProviderException(ProviderException.Reason.TRANSPORT,
                    getProviderId() + " returned HTTP " + status, transientStatus, e);
        }
        if (e instanceof JsonProcessingException) {
            return new ProviderException(ProviderException.Reason.INVALID_RESPONSE,
                    "Malformed " + getProviderId() + " response", false, e);
        }
        if (e instanceof RestClientException) {
            return new ProviderException(ProviderException.Reason.TRANSPORT, e.getMessage(), true, e);
        }
        return new ProviderException(ProviderException.Reason.TRANSPORT,
                e.getClass().getSimpleName() + ": " + e.getMessage(), true, e);
    }

    @PreDestroy
    public void shutdown() {
        callExecutor.shutdownNow();
    }

    /**
     * Runs {@code call} on a worker thread holding one call slot. The slot is
     * released by the worker once the backend call returns, not when the caller
     * gives up, so a timed out call that ignores interruption still counts
     * against the ceiling.
     */
    private <T> T callWithLimits(Callable<T> call) {
        long timeoutMs = settings.getCallTimeout().toMillis();
        long startedAt = System.nanoTime();
        boolean acquired;
        try {
            acquired = callSlots.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderException.Reason.UNAVAILABLE, "Interrupted waiting for a call slot", false, e);
        }
        if (!acquired) {
            throw new ProviderException(ProviderException.Reason.TIMEOUT,
                    "No " + getProviderId() + " call slot within " + timeoutMs + "ms", true);
        }

        // whoever claims first owns the slot: the worker when it starts, the caller when it cancels before that
        AtomicBoolean claimed = new AtomicBoolean();
        Future<T> future;
        try {
            future = callExecutor.submit(() -> {
                if (!claimed.compareAndSet(false, true)) return null;
                try {
                    return call.call();
                } finally {
                    callSlots.release();
                }
            });
        } catch (RejectedExecutionException e) {
            callSlots.release();
            throw new ProviderException(ProviderException.Reason.UNAVAILABLE, getProviderId() + " is shut down", false, e);
        }

        long remainingMs = Math.max(1, timeoutMs - TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
        try {
            return future.get(remainingMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(future, claimed);
            throw new ProviderException(ProviderException.Reason.TIMEOUT,
                    getProviderId() + " call timed out after " + timeoutMs + "ms", true, e);
        } catch (InterruptedException e) {
            abandon(future, claimed);
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderException.Reason.UNAVAILABLE, "Interrupted waiting for " + getProviderId(), false, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw translate(cause instanceof Exception ? (Exception) cause : e);
        }
    }

    private void abandon(Future<?> future, AtomicBoolean claimed) {
        future.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            callSlots.release();
        }
    }

    private String validate(String text) {
        String trimmed = StringUtils.trimToEmpty(text);
        if (trimmed.isEmpty()) {
            throw new ProviderException(ProviderException.Reason.INVALID_RESPONSE, getProviderId() + " returned an empty reply", false);
        }
        if (trimmed.length() > settings.getMaxResponseChars()) {
            throw new ProviderException(ProviderException.Reason.INVALID_RESPONSE,
                    getProviderId() + " reply exceeds " + settings.getMaxResponseChars() + " chars", false);
        }
        return trimmed;
    }

    private void pause() {
        try {
            Thread.sleep(settings.getRetryDelay().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderException.Reason.UNAVAILABLE, "Interrupted before retry", false, e);
        }
    }

    private static Map<String, Object> emptyExtraction(Map<String, String> schema) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : schema.keySet()) result.put(key, null);
        return result;
    }

    private static Object toValue(JsonNode node, String type) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isTextual()) {
            String text = node.asText().trim();
            return text.isEmpty() || "null".equalsIgnoreCase(text) ? null : text;
        }
        if (node.isNumber()) {
            return "number".equalsIgnoreCase(type) || "integer".equalsIgnoreCase(type)
                    ? node.numberValue()
                    : node.asText();
        }
        if (node.isBoolean()) return node.booleanValue();
        return node.toString();
    }
}
