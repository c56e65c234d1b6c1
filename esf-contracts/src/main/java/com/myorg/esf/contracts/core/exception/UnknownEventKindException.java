package com.myorg.esf.contracts.core.exception;

public class UnknownEventKindException extends EsfNonRetryableException {
    public UnknownEventKindException(String eventKind) {
        super("UNKNOWN_EVENT_KIND", "No payload type registered for eventKind=" + eventKind);
    }
}
