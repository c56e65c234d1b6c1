package com.myorg.esf.eventstore.snapshot;

import com.myorg.esf.contracts.core.codec.EventPayloadCodec;
import com.myorg.esf.contracts.core.exception.AggregateNotFoundException;
import com.myorg.esf.eventstore.memory.InMemoryEventStore;
import com.myorg.esf.eventstore.memory.InMemorySnapshotStore;
import com.myorg.esf.eventstore.repository.EventSourcedAggregateRepository;
import com.myorg.esf.eventstore.support.Counter;
import com.myorg.esf.eventstore.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SnapshotServiceTest {

    private final Clock clock = Fixtures.fixedClock();
    private final List<Runnable> submitted = new ArrayList<>();
    private final List<SnapshotRecord> created = new ArrayList<>();

    private SnapshotProperties props;
    private InMemoryEventStore events;
    private InMemorySnapshotStore snapshots;
    private EventSourcedAggregateRepository<Counter> repository;
    private SnapshotService<Counter> service;

    @BeforeEach
    void setUp() {
        props = new SnapshotProperties();
        props.setMinEventsForFirstSnapshot(10);
        props.setEventCountThreshold(20);
        props.setMaxSnapshotsPerAggregate(2);
        props.setBackgroundBatchSize(2);

        EventPayloadCodec codec = Fixtures.codec();
        events = new InMemoryEventStore(codec);
        snapshots = new InMemorySnapshotStore(events);
        repository = new EventSourcedAggregateRepository<>(Counter.DEFINITION, events, snapshots, codec, clock, true);
        Executor queued = submitted::add;
        service = new SnapshotService<>(repository, events, snapshots, new DefaultSnapshotStrategy(props, clock),
                props, codec, clock, queued, List.<SnapshotService.SnapshotListener>of(created::add));
    }

    @Test
    void createSnapshotIfNeeded_belowThreshold_doesNothing() {
        UUID id = persisted(9);

        assertThat(service.createSnapshotIfNeeded(id)).isEmpty();
        assertThat(snapshots.list(id)).isEmpty();
    }

    @Test
    void createSnapshotIfNeeded_atThreshold_savesSnapshotAtHead() {
        UUID id = persisted(10);

        Optional<SnapshotRecord> snapshot = service.createSnapshotIfNeeded(id);

        assertThat(snapshot).isPresent();
        assertEquals(10, snapshot.get().getVersion());
        assertEquals(10, snapshot.get().getEventCountAtSnapshot());
        assertEquals(Fixtures.NOW, snapshot.get().getCreatedAt());
        assertThat(snapshot.get().getStateSize()).isPositive();
        assertThat(snapshots.latest(id)).contains(snapshot.get());
        assertThat(created).containsExactly(snapshot.get());

        // nothing new since the snapshot
        assertThat(service.createSnapshotIfNeeded(id)).isEmpty();
    }

    @Test
    void createSnapshotIfNeeded_unknownAggregate_isEmpty() {
        assertThat(service.createSnapshotIfNeeded(UUID.randomUUID())).isEmpty();
    }

    @Test
    void createSnapshot_forcesAndPrunesToRetention() {
        UUID id = persisted(3);

        service.createSnapshot(id);
        appendMore(id, 1);
        service.createSnapshot(id);
        appendMore(id, 1);
        SnapshotRecord newest = service.createSnapshot(id);

        assertThat(snapshots.list(id)).hasSize(2);
        assertThat(snapshots.latest(id)).contains(newest);
        assertEquals(5, newest.getVersion());
    }

    @Test
    void createSnapshot_unknownAggregate_throws() {
        assertThatThrownBy(() -> service.createSnapshot(UUID.randomUUID()))
                .isInstanceOf(AggregateNotFoundException.class);
    }

    @Test
    void statistics_reportsCountsAndRecommendation() {
        UUID id = persisted(12);
        assertThat(service.statistics(id).isSnapshotRecommended()).isTrue();

        service.createSnapshot(id);
        appendMore(id, 4);

        SnapshotStatistics stats = service.statistics(id);
        assertEquals(16, stats.getTotalEvents());
        assertEquals(1, stats.getTotalSnapshots());
        assertEquals(12, stats.getLatestSnapshotVersion());
        assertEquals(4, stats.getEventsSinceLastSnapshot());
        assertEquals(Fixtures.NOW, stats.getLastSnapshotAt());
        assertThat(stats.getAverageSnapshotSize()).isPositive();
        assertThat(stats.isSnapshotRecommended()).isFalse();
    }

    @Test
    void processPending_handlesAtMostOneBatch() {
        persisted(25);
        persisted(30);
        persisted(40);
        persisted(5);

        int processed = service.processPending();

        assertEquals(2, processed);
        assertThat(created).hasSize(2);
    }

    @Test
    void processPending_stopsWhenInterrupted() {
        persisted(25);
        Thread.currentThread().interrupt();
        try {
            assertEquals(0, service.processPending());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void cleanup_prunesEveryAggregateOfTheKind() {
        UUID a = persisted(1);
        UUID b = persisted(1);
        props.setMaxSnapshotsPerAggregate(5);
        for (int i = 0; i < 3; i++) {
            service.createSnapshot(a);
            service.createSnapshot(b);
        }
        props.setMaxSnapshotsPerAggregate(1);

        assertEquals(4, service.cleanup());
        assertThat(snapshots.list(a)).hasSize(1);
        assertThat(snapshots.list(b)).hasSize(1);
    }

    @Test
    void reads_scheduleAnOutOfBandCheck() {
        UUID id = persisted(10);
        repository.addListener(service);

        repository.findById(id);

        assertThat(snapshots.list(id)).isEmpty();
        assertThat(submitted).hasSize(1);
        submitted.get(0).run();
        assertThat(snapshots.list(id)).hasSize(1);
    }

    @Test
    void disabled_neverSchedulesOrCreates() {
        UUID id = persisted(50);
        props.setEnabled(false);

        service.scheduleCheck(id);

        assertThat(submitted).isEmpty();
        assertThat(service.createSnapshotIfNeeded(id)).isEmpty();
        assertEquals(0, service.processPending());
    }

    private UUID persisted(int n) {
        Counter c = Fixtures.counterWith(n);
        events.append(c.id(), Counter.KIND, 0, c.uncommittedEvents(), null);
        return c.id();
    }

    private void appendMore(UUID id, int n) {
        Counter c = repository.getById(id);
        for (int i = 0; i < n; i++) c.increment(1);
        events.append(id, Counter.KIND, c.uncommittedEvents(), null);
    }
}
