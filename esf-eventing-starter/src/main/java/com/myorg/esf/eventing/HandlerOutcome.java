package com.myorg.esf.eventing;

import lombok.Value;

import java.util.UUID;

@Value
public class HandlerOutcome {
    UUID eventId;
    String eventKind;
    UUID aggregateId;
    long version;
    String handlerName;
    boolean success;
    Throwable error;   // null on success
}
