package com.myorg.esf.contracts.core.exception;

import com.myorg.esf.contracts.core.event.EventReadFailure;

import java.util.List;

/**
 * A payload or snapshot state could not be encoded or decoded (usually schema drift).
 */
public class EventSerializationException extends EsfNonRetryableException {

    private final List<EventReadFailure> failures;

    public EventSerializationException(String message) {
        this(message, (Throwable) null);
    }

    public EventSerializationException(String message, Throwable cause) {
        super("SERIALIZATION", message, cause);
        this.failures = List.of();
    }

    public EventSerializationException(String message, List<EventReadFailure> failures) {
        super("SERIALIZATION", message + " " + failures);
        this.failures = List.copyOf(failures);
    }

    public List<EventReadFailure> getFailures() {
        return failures;
    }
}
