package com.myorg.esf.eventstore.store;

import java.time.Instant;
import java.util.UUID;

/**
 * Persisted form of one event. Written once at append, never updated or deleted.
 */
public record StoredEvent(
        UUID id,
        UUID aggregateId,
        String aggregateKind,
        long version,
        String eventKind,
        String payload,
        Instant timestamp,
        String actorId
) {
}
