package com.myorg.esf.eventstore.aggregate;

import com.myorg.esf.contracts.core.event.DomainEvent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Version counter and uncommitted-event buffer embedded by every event-sourced entity.
 * Not thread-safe: an aggregate instance belongs to the command that loaded it.
 */
public final class AggregateEvents {

    private final UUID aggregateId;
    private final Clock clock;
    private final List<DomainEvent> uncommitted = new ArrayList<>();
    private long version;

    public AggregateEvents(UUID aggregateId, Clock clock) {
        if (aggregateId == null) throw new IllegalArgumentException("aggregateId must not be null");
        this.aggregateId = aggregateId;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /** Creates the next event of this aggregate and buffers it. The caller applies it to state. */
    public DomainEvent record(String eventKind, Object payload) {
        DomainEvent event = DomainEvent.builder()
                .eventId(UUID.randomUUID())
                .aggregateId(aggregateId)
                .version(version + 1)
                .eventKind(eventKind)
                .occurredAt(clock.instant())
                .payload(payload)
                .build();
        uncommitted.add(event);
        version = event.getVersion();
        return event;
    }

    /** Advances the version for an event read back from the store. */
    public void replayed(DomainEvent event) {
        if (!aggregateId.equals(event.getAggregateId())) {
            throw new IllegalStateException("Event " + event.getEventId() + " belongs to aggregateId="
                    + event.getAggregateId() + ", not " + aggregateId);
        }
        if (event.getVersion() != version + 1) {
            throw new IllegalStateException("Version gap on aggregateId=" + aggregateId
                    + ": at version " + version + ", got event version " + event.getVersion());
        }
        version = event.getVersion();
    }

    /** Positions a fresh instance at the version of the snapshot it was restored from. */
    public void restoredAt(long snapshotVersion) {
        if (version != 0 || !uncommitted.isEmpty()) {
            throw new IllegalStateException("Only a fresh aggregate can be restored from a snapshot");
        }
        if (snapshotVersion < 0) throw new IllegalArgumentException("snapshotVersion must be >= 0");
        version = snapshotVersion;
    }

    public UUID aggregateId() {
        return aggregateId;
    }

    public long version() {
        return version;
    }

    /** Version last persisted, i.e. the head the store is expected to be at. */
    public long committedVersion() {
        return version - uncommitted.size();
    }

    public List<DomainEvent> uncommitted() {
        return List.copyOf(uncommitted);
    }

    public void clear() {
        uncommitted.clear();
    }
}
