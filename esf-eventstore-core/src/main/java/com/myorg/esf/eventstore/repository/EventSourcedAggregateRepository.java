package com.myorg.esf.eventstore.repository;

import com.myorg.esf.contracts.core.codec.EventPayloadCodec;
import com.myorg.esf.contracts.core.event.DomainEvent;
import com.myorg.esf.contracts.core.exception.EsfNonRetryableException;
import com.myorg.esf.eventstore.aggregate.AggregateDefinition;
import com.myorg.esf.eventstore.aggregate.EventSourcedAggregate;
import com.myorg.esf.eventstore.snapshot.SnapshotRecord;
import com.myorg.esf.eventstore.snapshot.SnapshotStore;
import com.myorg.esf.eventstore.store.EventStore;
import com.myorg.esf.eventstore.store.EventStream;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Rebuilds aggregates from the latest snapshot plus the events recorded after it.
 * Never writes to either store.
 */
@Slf4j
public class EventSourcedAggregateRepository<A extends EventSourcedAggregate> implements AggregateRepository<A> {

    private final AggregateDefinition<A> definition;
    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final EventPayloadCodec codec;
    private final Clock clock;
    private final boolean snapshotsEnabled;
    private final List<ReconstructionListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * @param snapshotStore may be null, in which case every read is a full replay
     */
    public EventSourcedAggregateRepository(AggregateDefinition<A> definition,
                                           EventStore eventStore,
                                           SnapshotStore snapshotStore,
                                           EventPayloadCodec codec,
                                           Clock clock,
                                           boolean snapshotsEnabled) {
        this.definition = definition;
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.codec = codec;
        this.clock = clock;
        this.snapshotsEnabled = snapshotsEnabled && snapshotStore != null && definition.supportsSnapshots();
    }

    public void addListener(ReconstructionListener listener) {
        listeners.add(listener);
    }

    @Override
    public String aggregateKind() {
        return definition.aggregateKind();
    }

    public AggregateDefinition<A> definition() {
        return definition;
    }

    @Override
    public Optional<A> findById(UUID aggregateId) {
        Optional<A> found = reconstruct(aggregateId, snapshotsEnabled);
        found.ifPresent(this::notifyListeners);
        return found;
    }

    /** Full replay from version 1, ignoring snapshots and without notifying listeners. */
    public Optional<A> rebuild(UUID aggregateId) {
        return reconstruct(aggregateId, false);
    }

    /** Same as {@link #findById} but without notifying listeners. */
    public Optional<A> load(UUID aggregateId) {
        return reconstruct(aggregateId, snapshotsEnabled);
    }

    private Optional<A> reconstruct(UUID aggregateId, boolean useSnapshot) {
        A aggregate = useSnapshot ? restoreFromSnapshot(aggregateId) : null;
        long fromVersion = aggregate == null ? 1 : aggregate.version() + 1;

        EventStream stream = eventStore.read(aggregateId, fromVersion).requireComplete();
        if (aggregate == null) {
            if (stream.events().isEmpty()) {
                return Optional.empty();
            }
            aggregate = definition.newInstance(aggregateId, clock);
        }

        for (DomainEvent event : stream.events()) {
            definition.replay(aggregate, event);
        }
        log.debug("Reconstructed aggregateKind={} aggregateId={} version={} replayed={} fromVersion={}",
                definition.aggregateKind(), aggregateId, aggregate.version(), stream.events().size(), fromVersion);
        return Optional.of(aggregate);
    }

    private A restoreFromSnapshot(UUID aggregateId) {
        Optional<SnapshotRecord> latest = snapshotStore.latest(aggregateId);
        if (latest.isEmpty()) {
            return null;
        }
        SnapshotRecord snapshot = latest.get();
        try {
            return definition.restore(aggregateId, snapshot.getVersion(), snapshot.getState(), codec, clock);
        } catch (EsfNonRetryableException | IllegalStateException e) {
            log.warn("Snapshot {} of aggregateId={} at version={} is unusable, falling back to full replay: {}",
                    snapshot.getId(), aggregateId, snapshot.getVersion(), e.getMessage());
            return null;
        }
    }

    private void notifyListeners(A aggregate) {
        for (ReconstructionListener listener : listeners) {
            try {
                listener.onReconstructed(aggregate);
            } catch (RuntimeException e) {
                log.warn("Reconstruction listener failed for aggregateId={}", aggregate.id(), e);
            }
        }
    }
}
