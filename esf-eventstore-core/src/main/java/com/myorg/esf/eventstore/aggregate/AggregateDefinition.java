package com.myorg.esf.eventstore.aggregate;

import com.myorg.esf.contracts.core.codec.EventKindRegistry;
import com.myorg.esf.contracts.core.codec.EventPayloadCodec;
import com.myorg.esf.contracts.core.conventions.EventKindFormat;
import com.myorg.esf.contracts.core.event.DomainEvent;
import com.myorg.esf.contracts.core.exception.UnknownEventKindException;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Everything the store layer needs to know about one aggregate kind: its tag, how to create
 * a zero-state instance, the applier of each event kind and, optionally, how to turn the
 * aggregate into snapshot state and back.
 *
 * <p>Appliers must be deterministic: same state plus same event gives the same next state.
 */
public final class AggregateDefinition<A extends EventSourcedAggregate> {

    @FunctionalInterface
    public interface Factory<A> {
        A create(UUID aggregateId, Clock clock);
    }

    @FunctionalInterface
    public interface Restorer<A, S> {
        A restore(UUID aggregateId, Clock clock, S state);
    }

    private record Applier<A>(Class<?> payloadType, BiConsumer<A, Object> action) {
    }

    private record SnapshotBinding<A, S>(Class<S> stateType, Function<A, S> extractor, Restorer<A, S> restorer) {

        Object extract(A aggregate) {
            return extractor.apply(aggregate);
        }

        A restore(UUID aggregateId, Clock clock, String state, EventPayloadCodec codec) {
            return restorer.restore(aggregateId, clock, codec.decodeState(state, stateType));
        }
    }

    private final String aggregateKind;
    private final Factory<A> factory;
    private final Map<String, Applier<A>> appliers;
    private final SnapshotBinding<A, ?> snapshots;

    private AggregateDefinition(Builder<A> b) {
        this.aggregateKind = b.aggregateKind;
        this.factory = b.factory;
        this.appliers = Collections.unmodifiableMap(new LinkedHashMap<>(b.appliers));
        this.snapshots = b.snapshots;
    }

    public static <A extends EventSourcedAggregate> Builder<A> builder(String aggregateKind, Factory<A> factory) {
        return new Builder<>(aggregateKind, factory);
    }

    public String aggregateKind() {
        return aggregateKind;
    }

    public Set<String> eventKinds() {
        return appliers.keySet();
    }

    public AggregateDefinition<A> registerKinds(EventKindRegistry registry) {
        appliers.forEach((kind, applier) -> registry.register(kind, applier.payloadType()));
        return this;
    }

    public A newInstance(UUID aggregateId, Clock clock) {
        return factory.create(aggregateId, clock);
    }

    /** Runs the state transition of an event the aggregate just recorded or is replaying. */
    public void mutate(A aggregate, DomainEvent event) {
        Applier<A> applier = appliers.get(event.getEventKind());
        if (applier == null) {
            throw new UnknownEventKindException(event.getEventKind());
        }
        applier.action().accept(aggregate, event.getPayload());
    }

    /** Applies a stored event: advances the version (gap checked) and mutates state. */
    public void replay(A aggregate, DomainEvent event) {
        aggregate.events().replayed(event);
        mutate(aggregate, event);
    }

    public boolean supportsSnapshots() {
        return snapshots != null;
    }

    public String snapshotState(A aggregate, EventPayloadCodec codec) {
        requireSnapshots();
        return codec.encodeState(snapshots.extract(aggregate));
    }

    /** Rebuilds an instance from snapshot state, positioned at the snapshot's version. */
    public A restore(UUID aggregateId, long version, String state, EventPayloadCodec codec, Clock clock) {
        requireSnapshots();
        A aggregate = snapshots.restore(aggregateId, clock, state, codec);
        aggregate.events().restoredAt(version);
        return aggregate;
    }

    private void requireSnapshots() {
        if (snapshots == null) {
            throw new IllegalStateException("Snapshots are not configured for aggregateKind=" + aggregateKind);
        }
    }

    public static final class Builder<A extends EventSourcedAggregate> {
        private final String aggregateKind;
        private final Factory<A> factory;
        private final Map<String, Applier<A>> appliers = new LinkedHashMap<>();
        private SnapshotBinding<A, ?> snapshots;

        private Builder(String aggregateKind, Factory<A> factory) {
            if (aggregateKind == null || aggregateKind.isBlank()) {
                throw new IllegalArgumentException("aggregateKind must not be blank");
            }
            if (factory == null) throw new IllegalArgumentException("factory must not be null");
            this.aggregateKind = aggregateKind;
            this.factory = factory;
        }

        public <P> Builder<A> on(String eventKind, Class<P> payloadType, BiConsumer<A, P> applier) {
            EventKindFormat.requireWellFormed(eventKind);
            if (appliers.containsKey(eventKind)) {
                throw new IllegalStateException("Duplicate applier for eventKind=" + eventKind);
            }
            appliers.put(eventKind, new Applier<>(payloadType,
                    (aggregate, payload) -> applier.accept(aggregate, payloadType.cast(payload))));
            return this;
        }

        public <S> Builder<A> snapshots(Class<S> stateType, Function<A, S> extractor, Restorer<A, S> restorer) {
            this.snapshots = new SnapshotBinding<>(stateType, extractor, restorer);
            return this;
        }

        public AggregateDefinition<A> build() {
            if (appliers.isEmpty()) {
                throw new IllegalStateException("aggregateKind=" + aggregateKind + " declares no event kinds");
            }
            return new AggregateDefinition<>(this);
        }
    }
}
