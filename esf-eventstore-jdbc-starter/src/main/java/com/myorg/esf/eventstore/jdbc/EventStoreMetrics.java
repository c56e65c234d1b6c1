package com.myorg.esf.eventstore.jdbc;

import com.myorg.esf.eventstore.snapshot.SnapshotRecord;
import com.myorg.esf.eventstore.snapshot.SnapshotService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

import java.util.Collection;

@RequiredArgsConstructor
public class EventStoreMetrics implements SnapshotService.SnapshotListener {

    static final String APPENDED = "esf.events.appended";
    static final String CONFLICTS = "esf.events.conflicts";
    static final String SNAPSHOTS_CREATED = "esf.snapshots.created";

    private final MeterRegistry registry;

    /** Registers the meters of each known kind so they show up before first use. */
    public void preRegister(Collection<String> aggregateKinds) {
        for (String kind : aggregateKinds) {
            counter(APPENDED, kind);
            counter(CONFLICTS, kind);
            counter(SNAPSHOTS_CREATED, kind);
        }
    }

    public void appended(String aggregateKind, int count) {
        counter(APPENDED, aggregateKind).increment(count);
    }

    public void conflict(String aggregateKind) {
        counter(CONFLICTS, aggregateKind).increment();
    }

    @Override
    public void onSnapshotCreated(SnapshotRecord snapshot) {
        counter(SNAPSHOTS_CREATED, snapshot.getAggregateKind()).increment();
    }

    private Counter counter(String name, String aggregateKind) {
        return Counter.builder(name).tag("aggregateKind", aggregateKind).register(registry);
    }
}
