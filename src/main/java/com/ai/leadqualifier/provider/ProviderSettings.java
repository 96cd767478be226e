package com.ai.leadqualifier.provider;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Call limits shared by every provider implementation.
 */
@Getter
@Builder
@ToString
public class ProviderSettings {

    /** Upper bound for one backend call, including waiting for a call slot. */
    @Builder.Default
    private Duration callTimeout = Duration.ofSeconds(15);

    @Builder.Default
    private Duration connectTimeout = Duration.ofSeconds(5);

    /** Fixed pause before the single retry of a transient failure. */
    @Builder.Default
    private Duration retryDelay = Duration.ofMillis(500);

    @Builder.Default
    private int maxConcurrentCalls = 8;

    @Builder.Default
    private int maxResponseChars = 10_000;
}
