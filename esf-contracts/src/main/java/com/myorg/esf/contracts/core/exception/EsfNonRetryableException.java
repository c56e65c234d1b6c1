package com.myorg.esf.contracts.core.exception;

/**
 * Failure that will not go away by retrying the same call.
 */
public class EsfNonRetryableException extends RuntimeException {

    private final String reason;

    public EsfNonRetryableException(String message) {
        this("NON_RETRYABLE", message);
    }

    public EsfNonRetryableException(String reason, String message) {
        this(reason, message, null);
    }

    public EsfNonRetryableException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null || reason.isBlank()) ? "NON_RETRYABLE" : reason;
    }

    public String getReason() {
        return reason;
    }
}
