package com.myorg.esf.eventstore.snapshot;

import com.myorg.esf.contracts.core.codec.EventPayloadCodec;
import com.myorg.esf.contracts.core.exception.AggregateNotFoundException;
import com.myorg.esf.eventstore.aggregate.AggregateDefinition;
import com.myorg.esf.eventstore.aggregate.EventSourcedAggregate;
import com.myorg.esf.eventstore.repository.EventSourcedAggregateRepository;
import com.myorg.esf.eventstore.repository.ReconstructionListener;
import com.myorg.esf.eventstore.store.EventStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Creates, inspects and prunes snapshots of one aggregate kind.
 *
 * <p>Snapshotting is an optimisation: the background entry points ({@link #createSnapshotIfNeeded},
 * {@link #scheduleCheck}, {@link #processPending}) log failures and carry on.
 */
@Slf4j
public class SnapshotService<A extends EventSourcedAggregate> implements ReconstructionListener {

    private final EventSourcedAggregateRepository<A> repository;
    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final SnapshotStrategy strategy;
    private final SnapshotProperties props;
    private final EventPayloadCodec codec;
    private final Clock clock;
    private final Executor executor;
    private final List<SnapshotListener> snapshotListeners;

    /** Notified after a snapshot has been saved, e.g. for metrics. */
    @FunctionalInterface
    public interface SnapshotListener {
        void onSnapshotCreated(SnapshotRecord snapshot);
    }

    public SnapshotService(EventSourcedAggregateRepository<A> repository,
                           EventStore eventStore,
                           SnapshotStore snapshotStore,
                           SnapshotStrategy strategy,
                           SnapshotProperties props,
                           EventPayloadCodec codec,
                           Clock clock,
                           Executor executor,
                           List<SnapshotListener> snapshotListeners) {
        this.repository = repository;
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.strategy = strategy;
        this.props = props;
        this.codec = codec;
        this.clock = clock;
        this.executor = executor;
        this.snapshotListeners = snapshotListeners == null ? List.of() : List.copyOf(snapshotListeners);
    }

    public String aggregateKind() {
        return definition().aggregateKind();
    }

    public Optional<SnapshotRecord> createSnapshotIfNeeded(UUID aggregateId) {
        if (!props.isEnabled() || !definition().supportsSnapshots()) {
            return Optional.empty();
        }
        try {
            long head = eventStore.headVersion(aggregateId);
            if (head == 0) {
                return Optional.empty();
            }
            SnapshotRecord latest = snapshotStore.latest(aggregateId).orElse(null);
            if (latest != null && latest.getVersion() >= head) {
                return Optional.empty();
            }
            Optional<A> aggregate = repository.load(aggregateId);
            if (aggregate.isEmpty() || !strategy.shouldSnapshot(aggregate.get(), head, latest)) {
                return Optional.empty();
            }
            return Optional.of(snapshotOf(aggregate.get()));
        } catch (RuntimeException e) {
            log.error("Snapshot check failed aggregateKind={} aggregateId={}", aggregateKind(), aggregateId, e);
            return Optional.empty();
        }
    }

    /**
     * Forces a snapshot built from a full replay.
     *
     * @throws AggregateNotFoundException when the aggregate has no events
     */
    public SnapshotRecord createSnapshot(UUID aggregateId) {
        A aggregate = repository.rebuild(aggregateId)
                .orElseThrow(() -> new AggregateNotFoundException(aggregateKind(), aggregateId));
        return snapshotOf(aggregate);
    }

    public SnapshotStatistics statistics(UUID aggregateId) {
        long head = eventStore.headVersion(aggregateId);
        List<SnapshotRecord> snapshots = snapshotStore.list(aggregateId);
        SnapshotRecord latest = snapshots.isEmpty() ? null : snapshots.get(0);

        return SnapshotStatistics.builder()
                .aggregateId(aggregateId)
                .totalEvents(head)
                .totalSnapshots(snapshots.size())
                .latestSnapshotVersion(latest == null ? 0 : latest.getVersion())
                .eventsSinceLastSnapshot(latest == null ? head : head - latest.getEventCountAtSnapshot())
                .lastSnapshotAt(latest == null ? null : latest.getCreatedAt())
                .averageSnapshotSize(snapshots.stream().mapToInt(SnapshotRecord::getStateSize).average().orElse(0))
                .snapshotRecommended(head > 0 && strategy.shouldSnapshot(null, head, latest))
                .build();
    }

    /**
     * Snapshots up to {@code backgroundBatchSize} candidate aggregates.
     *
     * @return number of snapshots created
     */
    public int processPending() {
        if (!props.isEnabled()) {
            return 0;
        }
        List<UUID> candidates = snapshotStore.findCandidates(aggregateKind(), strategy.eventCountThreshold(),
                strategy.maxSnapshotAge(), clock.instant(), props.getBackgroundBatchSize());
        int created = 0;
        for (UUID aggregateId : candidates) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Pending snapshot processing interrupted after {} of {} candidates", created, candidates.size());
                break;
            }
            if (createSnapshotIfNeeded(aggregateId).isPresent()) {
                created++;
            }
        }
        if (!candidates.isEmpty()) {
            log.info("Processed pending snapshots aggregateKind={} candidates={} created={}",
                    aggregateKind(), candidates.size(), created);
        }
        return created;
    }

    public int cleanup() {
        int deleted = snapshotStore.pruneAll(aggregateKind(), props.getMaxSnapshotsPerAggregate());
        if (deleted > 0) {
            log.info("Pruned {} old snapshots aggregateKind={}", deleted, aggregateKind());
        }
        return deleted;
    }

    /**
     * Submits an out-of-band {@link #createSnapshotIfNeeded}; never blocks the caller.
     * Without an executor this is a no-op and snapshots come from {@link #processPending} or explicit calls.
     */
    public void scheduleCheck(UUID aggregateId) {
        if (!props.isEnabled() || executor == null) {
            return;
        }
        try {
            executor.execute(() -> createSnapshotIfNeeded(aggregateId));
        } catch (RejectedExecutionException e) {
            log.warn("Snapshot check rejected aggregateId={}: {}", aggregateId, e.getMessage());
        }
    }

    @Override
    public void onReconstructed(EventSourcedAggregate aggregate) {
        if (props.isCheckAfterRead()) {
            scheduleCheck(aggregate.id());
        }
    }

    private SnapshotRecord snapshotOf(A aggregate) {
        if (!aggregate.uncommittedEvents().isEmpty()) {
            throw new IllegalStateException("Cannot snapshot aggregateId=" + aggregate.id()
                    + " with uncommitted events");
        }
        Instant start = clock.instant();
        long startNanos = System.nanoTime();
        String state = definition().snapshotState(aggregate, codec);

        SnapshotRecord snapshot = SnapshotRecord.builder()
                .id(UUID.randomUUID())
                .aggregateId(aggregate.id())
                .aggregateKind(aggregateKind())
                .version(aggregate.version())
                .eventCountAtSnapshot(aggregate.version())
                .createdAt(start)
                .state(state)
                .stateSize(state.getBytes(StandardCharsets.UTF_8).length)
                .creationDuration(Duration.ofNanos(System.nanoTime() - startNanos))
                .build();

        snapshotStore.save(snapshot);
        snapshotStore.prune(aggregate.id(), props.getMaxSnapshotsPerAggregate());
        log.info("Created snapshot aggregateKind={} aggregateId={} version={} stateSize={}",
                aggregateKind(), aggregate.id(), snapshot.getVersion(), snapshot.getStateSize());

        for (SnapshotListener l : snapshotListeners) {
            l.onSnapshotCreated(snapshot);
        }
        return snapshot;
    }

    private AggregateDefinition<A> definition() {
        return repository.definition();
    }
}
