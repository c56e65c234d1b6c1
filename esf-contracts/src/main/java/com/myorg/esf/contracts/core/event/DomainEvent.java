package com.myorg.esf.contracts.core.event;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one state change of an aggregate.
 *
 * <p>{@code version} is the aggregate version this event produced. For a given aggregate the
 * versions of all its events form a gapless sequence starting at 1. The payload is a plain
 * contract object resolved through its {@code eventKind} tag, never through its class name.
 */
@Value
@Builder(toBuilder = true)
public class DomainEvent {
    @NonNull UUID eventId;
    @NonNull UUID aggregateId;
    long version;
    @NonNull String eventKind;   // e.g. "rpg.character.leveled-up.v1"
    @NonNull Instant occurredAt;
    Object payload;
    String actorId;              // only known once read back from the store

    public <T> T payloadAs(Class<T> type) {
        if (payload == null) return null;
        if (!type.isInstance(payload)) {
            throw new IllegalStateException("Payload of eventKind=" + eventKind + " is "
                    + payload.getClass().getName() + ", not " + type.getName());
        }
        return type.cast(payload);
    }
}
