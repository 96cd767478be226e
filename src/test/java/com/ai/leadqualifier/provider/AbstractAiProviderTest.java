package com.ai.leadqualifier.provider;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class AbstractAiProviderTest {

    private static final List<ChatMessage> MESSAGES = List.of(ChatMessage.user("oi"));

    private ScriptedProvider provider;

    @AfterEach
    void tearDown() {
        if (provider != null) provider.shutdown();
    }

    private static ProviderSettings settings(Duration callTimeout) {
        return ProviderSettings.builder()
                .callTimeout(callTimeout)
                .retryDelay(Duration.ofMillis(5))
                .maxConcurrentCalls(2)
                .maxResponseChars(200)
                .build();
    }

    @Test
    void transientFailureIsRetriedOnce() {
        provider = new ScriptedProvider(settings(Duration.ofSeconds(2)));
        provider.script(() -> { throw new ResourceAccessException("connection reset"); });
        provider.script(() -> "Olá! Como posso ajudar?");

        String reply = provider.generateResponse(MESSAGES, 100, 0.7, null);

        assertThat(reply).isEqualTo("Olá! Como posso ajudar?");
        assertThat(provider.calls.get()).isEqualTo(2);
        assertThat(provider.getStats()).containsEntry("retries", 1L).containsEntry("errors", 0L);
    }

    @Test
    void secondTransientFailureSurfaces() {
        provider = new ScriptedProvider(settings(Duration.ofSeconds(2)));
        provider.script(() -> { throw new HttpServerErrorException(HttpStatus.BAD_GATEWAY); });
        provider.script(() -> { throw new HttpServerErrorException(HttpStatus.SERVICE_UNAVAILABLE); });
        provider.script(() -> "nunca chamado");

        assertThatThrownBy(() -> provider.generateResponse(MESSAGES, 100, 0.7, null))
                .isInstanceOf(ProviderException.class)
                .extracting(e -> ((ProviderException) e).getReason())
                .isEqualTo(ProviderException.Reason.TRANSPORT);
        assertThat(provider.calls.get()).isEqualTo(1 + AbstractAiProvider.RETRIES);
    }

    @Test
    void clientErrorIsNotRetried() {
        provider = new ScriptedProvider(settings(Duration.ofSeconds(2)));
        provider.script(() -> { throw new HttpClientErrorException(HttpStatus.UNAUTHORIZED); });

        assertThatThrownBy(() -> provider.generateResponse(MESSAGES, 100, 0.7, null))
                .isInstanceOf(ProviderException.class);
        assertThat(provider.calls.get()).isEqualTo(1);
    }

    @Test
    void slowCallTimesOut() {
        provider = new ScriptedProvider(settings(Duration.ofMillis(100)));
        Callable<String> slow = () -> {
            Thread.sleep(2_000);
            return "tarde demais";
        };
        provider.script(slow);
        provider.script(slow);

        assertThatThrownBy(() -> provider.generateResponse(MESSAGES, 100, 0.7, null))
                .isInstanceOf(ProviderException.class)
                .extracting(e -> ((ProviderException) e).getReason())
                .isEqualTo(ProviderException.Reason.TIMEOUT);
    }

    @Test
    void timedOutCallKeepsItsSlotUntilBackendReturns() throws Exception {
        provider = new ScriptedProvider(ProviderSettings.builder()
                .callTimeout(Duration.ofMillis(200))
                .retryDelay(Duration.ofMillis(5))
                .maxConcurrentCalls(1)
                .maxResponseChars(200)
                .build());
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        Callable<String> blockingRead = () -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                sleepIgnoringInterrupts(Duration.ofMillis(1_500));
                return "tarde demais";
            } finally {
                inFlight.decrementAndGet();
            }
        };
        for (int i = 0; i < 8; i++) provider.script(blockingRead);

        ExecutorService callers = Executors.newFixedThreadPool(4);
        List<Future<Throwable>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                outcomes.add(callers.submit(() ->
                        catchThrowable(() -> provider.generateResponse(MESSAGES, 100, 0.7, null))));
            }
            for (Future<Throwable> outcome : outcomes) {
                assertThat(outcome.get(5, TimeUnit.SECONDS))
                        .isInstanceOf(ProviderException.class)
                        .extracting(e -> ((ProviderException) e).getReason())
                        .isEqualTo(ProviderException.Reason.TIMEOUT);
            }
        } finally {
            callers.shutdownNow();
        }

        assertThat(maxInFlight.get()).isEqualTo(1);
        assertThat(provider.calls.get()).isEqualTo(1);
        assertThat(provider.getStats()).containsEntry("errors", 4L).containsEntry("available_call_slots", 0);
    }

    /** Behaves like a blocking socket read: interruption does not end it early. */
    private static void sleepIgnoringInterrupts(Duration duration) {
        long deadline = System.nanoTime() + duration.toNanos();
        boolean interrupted = false;
        long remaining;
        while ((remaining = deadline - System.nanoTime()) > 0) {
            try {
                TimeUnit.NANOSECONDS.sleep(remaining);
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
    }

    @Test
    void emptyOrOversizedReplyIsInvalidAndNotRetried() {
        provider = new ScriptedProvider(settings(Duration.ofSeconds(2)));
        provider.script(() -> "   ");

        assertThatThrownBy(() -> provider.generateResponse(MESSAGES, 100, 0.7, null))
                .extracting(e -> ((ProviderException) e).getReason())
                .isEqualTo(ProviderException.Reason.INVALID_RESPONSE);
        assertThat(provider.calls.get()).isEqualTo(1);

        provider.script(() -> "x".repeat(201));
        assertThatThrownBy(() -> provider.generateResponse(MESSAGES, 100, 0.7, null))
                .extracting(e -> ((ProviderException) e).getReason())
                .isEqualTo(ProviderException.Reason.INVALID_RESPONSE);
    }

    @Test
    void extractionParsesFencedJsonAndKeepsOnlySchemaKeys() {
        provider = new ScriptedProvider(settings(Duration.ofSeconds(2)));
        provider.script(() -> "Claro! ```json\n{\"name\": \"Ana\", \"email\": \"\", \"city\": \"SP\", \"phone\": null}\n```");

        Map<String, Object> data = provider.extractStructuredData("texto", schema("name", "phone", "email"));

        assertThat(data).containsOnlyKeys("name", "phone", "email")
                .containsEntry("name", "Ana")
                .containsEntry("phone", null)
                .containsEntry("email", null);
    }

    @Test
    void unparsableExtractionDegradesToNulls() {
        provider = new ScriptedProvider(settings(Duration.ofSeconds(2)));
        provider.script(() -> "Não encontrei nenhuma informação");
        provider.script(() -> "{\"name\": \"Ana\",");

        Map<String, String> schema = schema("name", "phone");

        assertThat(provider.extractStructuredData("texto", schema)).containsOnlyKeys("name", "phone").containsValues((Object) null);
        assertThat(provider.extractStructuredData("texto", schema)).containsEntry("name", null).containsEntry("phone", null);
    }

    @Test
    void emptyExtractionReplyDegradesToNulls() {
        provider = new ScriptedProvider(settings(Duration.ofSeconds(2)));
        provider.script(() -> "");

        assertThat(provider.extractStructuredData("texto", schema("name"))).containsEntry("name", null);
    }

    @Test
    void extractionTransportFailurePropagates() {
        provider = new ScriptedProvider(settings(Duration.ofSeconds(2)));
        provider.script(() -> { throw new ResourceAccessException("down"); });
        provider.script(() -> { throw new ResourceAccessException("down"); });

        assertThatThrownBy(() -> provider.extractStructuredData("texto", schema("name")))
                .isInstanceOf(ProviderException.class);
    }

    @Test
    void numericValuesFollowSchemaType() {
        provider = new ScriptedProvider(settings(Duration.ofSeconds(2)));
        Map<String, String> schema = new LinkedHashMap<>();
        schema.put("budget", "number");
        schema.put("zip", "string");

        Map<String, Object> data = provider.parseExtraction("{\"budget\": 1500, \"zip\": 1234}", schema);

        assertThat(data.get("budget")).isInstanceOf(Number.class);
        assertThat(data.get("zip")).isEqualTo("1234");
    }

    @Test
    void healthCheckNeverThrows() {
        provider = new ScriptedProvider(settings(Duration.ofSeconds(2)));
        provider.healthy = () -> { throw new ResourceAccessException("down"); };

        assertThat(provider.healthCheck()).isFalse();
    }

    private static Map<String, String> schema(String... fields) {
        Map<String, String> schema = new LinkedHashMap<>();
        for (String f : fields) schema.put(f, "string");
        return schema;
    }

    /**
     * Replies from a queue of scripted calls.
     */
    static class ScriptedProvider extends AbstractAiProvider {

        final Deque<Callable<String>> replies = new ConcurrentLinkedDeque<>();
        final AtomicInteger calls = new AtomicInteger();
        Callable<Boolean> healthy = () -> true;

        ScriptedProvider(ProviderSettings settings) {
            super(settings);
        }

        void script(Callable<String> reply) {
            replies.add(reply);
        }

        @Override
        protected String doGenerate(List<ChatMessage> messages, int maxTokens, double temperature,
                                       Map<String, Object> options) throws Exception {
            calls.incrementAndGet();
            Callable<String> next = replies.poll();
            if (next == null) throw new IllegalStateException("no scripted reply left");
            return next.call();
        }

        @Override
        protected boolean doHealthCheck() throws Exception {
            return healthy.call();
        }

        @Override
        public String getProviderId() {
            return "scripted";
        }

        @Override
        public String getModel() {
            return "scripted-model";
        }
    }
}
