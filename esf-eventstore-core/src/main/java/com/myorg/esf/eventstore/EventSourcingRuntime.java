package com.myorg.esf.eventstore;

import com.myorg.esf.contracts.core.codec.EventPayloadCodec;
import com.myorg.esf.eventstore.aggregate.AggregateDefinition;
import com.myorg.esf.eventstore.aggregate.EventSourcedAggregate;
import com.myorg.esf.eventstore.repository.EventSourcedAggregateRepository;
import com.myorg.esf.eventstore.snapshot.SnapshotProperties;
import com.myorg.esf.eventstore.snapshot.SnapshotService;
import com.myorg.esf.eventstore.snapshot.SnapshotStore;
import com.myorg.esf.eventstore.snapshot.SnapshotStrategy;
import com.myorg.esf.eventstore.store.EventStore;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Builds and caches the repository and snapshot service of each aggregate kind over one
 * event store and one snapshot store.
 * <p>
 * Snapshot checks after reads and writes only run when a {@code snapshotExecutor} is given;
 * without one the read path never writes.
 */
@Slf4j
public class EventSourcingRuntime {

    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final EventPayloadCodec codec;
    private final SnapshotStrategy strategy;
    private final SnapshotProperties snapshotProperties;
    private final Clock clock;
    private final Executor snapshotExecutor;
    private final List<SnapshotService.SnapshotListener> snapshotListeners;

    private final Map<String, Bound<?>> byKind = new ConcurrentHashMap<>();

    private record Bound<A extends EventSourcedAggregate>(
            AggregateDefinition<A> definition,
            EventSourcedAggregateRepository<A> repository,
            SnapshotService<A> snapshots) {
    }

    @Builder
    public EventSourcingRuntime(EventStore eventStore,
                                SnapshotStore snapshotStore,
                                EventPayloadCodec codec,
                                SnapshotStrategy strategy,
                                SnapshotProperties snapshotProperties,
                                Clock clock,
                                Executor snapshotExecutor,
                                List<SnapshotService.SnapshotListener> snapshotListeners) {
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.codec = codec;
        this.strategy = strategy;
        this.snapshotProperties = snapshotProperties == null ? new SnapshotProperties() : snapshotProperties;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.snapshotExecutor = snapshotExecutor;
        this.snapshotListeners = snapshotListeners == null ? List.of() : List.copyOf(snapshotListeners);
    }

    public EventStore eventStore() {
        return eventStore;
    }

    /** Repository of the definition's kind, created on first use. */
    @SuppressWarnings("unchecked")
    public <A extends EventSourcedAggregate> EventSourcedAggregateRepository<A> repository(AggregateDefinition<A> definition) {
        Bound<?> bound = byKind.computeIfAbsent(definition.aggregateKind(), k -> bind(definition));
        if (bound.definition() != definition) {
            throw new IllegalStateException("aggregateKind=" + definition.aggregateKind()
                    + " is already bound to another definition");
        }
        return (EventSourcedAggregateRepository<A>) bound.repository();
    }

    /** Snapshot service of a kind, empty when the kind is unknown or has no snapshot support. */
    public Optional<SnapshotService<?>> snapshots(String aggregateKind) {
        Bound<?> bound = byKind.get(aggregateKind);
        return bound == null ? Optional.empty() : Optional.ofNullable(bound.snapshots());
    }

    public List<SnapshotService<?>> snapshotServices() {
        List<SnapshotService<?>> out = new ArrayList<>();
        for (Bound<?> bound : byKind.values()) {
            if (bound.snapshots() != null) {
                out.add(bound.snapshots());
            }
        }
        return out;
    }

    private <A extends EventSourcedAggregate> Bound<A> bind(AggregateDefinition<A> definition) {
        boolean snapshotsOn = snapshotStore != null && strategy != null
                && snapshotProperties.isEnabled() && definition.supportsSnapshots();

        EventSourcedAggregateRepository<A> repository = new EventSourcedAggregateRepository<>(
                definition, eventStore, snapshotStore, codec, clock, snapshotsOn);

        SnapshotService<A> snapshots = null;
        if (snapshotsOn) {
            snapshots = new SnapshotService<>(repository, eventStore, snapshotStore, strategy,
                    snapshotProperties, codec, clock, snapshotExecutor, snapshotListeners);
            if (snapshotExecutor != null) {
                repository.addListener(snapshots);
            }
        }
        log.info("Bound aggregateKind={} snapshots={}", definition.aggregateKind(), snapshotsOn);
        return new Bound<>(definition, repository, snapshots);
    }
}
