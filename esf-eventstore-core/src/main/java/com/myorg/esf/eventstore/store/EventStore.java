package com.myorg.esf.eventstore.store;

import com.myorg.esf.contracts.core.event.DomainEvent;

import java.util.List;
import java.util.UUID;

/**
 * Append-only, per-aggregate ordered event log. There is no update or delete.
 */
public interface EventStore {

    /**
     * Appends a batch atomically. The events must carry versions
     * {@code expectedVersion + 1 .. expectedVersion + n} in order.
     *
     * @return the new head version
     * @throws com.myorg.esf.contracts.core.exception.ConcurrencyConflictException if the head is not {@code expectedVersion}
     * @throws com.myorg.esf.contracts.core.exception.StorageException if the durable write failed
     */
    long append(UUID aggregateId, String aggregateKind, long expectedVersion, List<DomainEvent> events, String actorId);

    /** Derives the expected head from the first event of the batch. */
    default long append(UUID aggregateId, String aggregateKind, List<DomainEvent> events, String actorId) {
        if (events == null || events.isEmpty()) {
            return headVersion(aggregateId);
        }
        return append(aggregateId, aggregateKind, events.get(0).getVersion() - 1, events, actorId);
    }

    default EventStream read(UUID aggregateId) {
        return read(aggregateId, 1);
    }

    /** Events with {@code version >= fromVersion}, ascending. */
    EventStream read(UUID aggregateId, long fromVersion);

    /** Last stored version, 0 when the aggregate has no events. */
    long headVersion(UUID aggregateId);
}
