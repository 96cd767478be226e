package com.ai.leadqualifier.provider;

/**
 * Failure of a call to the text-generation backend.
 */
public class ProviderException extends RuntimeException {

    public enum Reason {
        /** Network, connection or HTTP error from the backend. */
        TRANSPORT,
        /** The call did not finish within the per-call timeout. */
        TIMEOUT,
        /** The backend answered with something unusable (empty, oversized, malformed). */
        INVALID_RESPONSE,
        /** The provider is not configured or could not get a call slot. */
        UNAVAILABLE
    }

    private final Reason reason;
    private final boolean retryable;

    public ProviderException(Reason reason, String message, boolean retryable) {
        super(message);
        this.reason = reason;
        this.retryable = retryable;
    }

    public ProviderException(Reason reason, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.retryable = retryable;
    }

    public Reason getReason() {
        return reason;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
