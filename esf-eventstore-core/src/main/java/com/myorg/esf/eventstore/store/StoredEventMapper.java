package com.myorg.esf.eventstore.store;

import com.myorg.esf.contracts.core.codec.EventPayloadCodec;
import com.myorg.esf.contracts.core.event.DomainEvent;
import com.myorg.esf.contracts.core.event.EventReadFailure;
import com.myorg.esf.contracts.core.exception.EsfNonRetryableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Converts between domain events and their stored form. Shared by every {@link EventStore}
 * implementation so that batch validation and decode-failure handling behave the same.
 */
@Slf4j
@RequiredArgsConstructor
public class StoredEventMapper {

    private final EventPayloadCodec codec;

    public List<StoredEvent> toStored(UUID aggregateId, String aggregateKind, long expectedVersion,
                                      List<DomainEvent> events, String actorId) {
        if (aggregateId == null) throw new IllegalArgumentException("aggregateId must not be null");
        if (aggregateKind == null || aggregateKind.isBlank()) {
            throw new IllegalArgumentException("aggregateKind must not be blank");
        }
        if (expectedVersion < 0) throw new IllegalArgumentException("expectedVersion must be >= 0");

        List<StoredEvent> out = new ArrayList<>(events.size());
        long next = expectedVersion + 1;
        for (DomainEvent e : events) {
            if (!aggregateId.equals(e.getAggregateId())) {
                throw new IllegalArgumentException("Event " + e.getEventId() + " belongs to aggregateId="
                        + e.getAggregateId() + ", batch is for " + aggregateId);
            }
            if (e.getVersion() != next) {
                throw new IllegalArgumentException("Non-contiguous batch for aggregateId=" + aggregateId
                        + ": expected version " + next + ", got " + e.getVersion());
            }
            out.add(new StoredEvent(
                    e.getEventId(),
                    aggregateId,
                    aggregateKind,
                    e.getVersion(),
                    e.getEventKind(),
                    codec.encodePayload(e.getEventKind(), e.getPayload()),
                    e.getOccurredAt(),
                    actorId
            ));
            next++;
        }
        return out;
    }

    /** Decodes rows already ordered by version; rows that fail are collected, not thrown. */
    public EventStream toStream(UUID aggregateId, List<StoredEvent> rows) {
        List<DomainEvent> events = new ArrayList<>(rows.size());
        List<EventReadFailure> failures = new ArrayList<>();
        for (StoredEvent row : rows) {
            try {
                events.add(DomainEvent.builder()
                        .eventId(row.id())
                        .aggregateId(row.aggregateId())
                        .version(row.version())
                        .eventKind(row.eventKind())
                        .occurredAt(row.timestamp())
                        .payload(codec.decodePayload(row.eventKind(), row.payload()))
                        .actorId(row.actorId())
                        .build());
            } catch (EsfNonRetryableException ex) {
                log.warn("Cannot decode stored event aggregateId={} version={} eventKind={}: {}",
                        aggregateId, row.version(), row.eventKind(), ex.getMessage());
                failures.add(new EventReadFailure(aggregateId, row.version(), row.eventKind(), ex.getMessage()));
            }
        }
        return new EventStream(aggregateId, events, failures);
    }
}
