package com.myorg.esf.eventstore.snapshot;

import com.myorg.esf.eventstore.aggregate.Aggregate;

import java.time.Duration;

public interface SnapshotStrategy {

    /**
     * @param aggregate current state, may be null when only counts are known
     * @param currentEventCount number of events of the aggregate (its head version)
     * @param latest newest snapshot, null when there is none
     */
    boolean shouldSnapshot(Aggregate aggregate, long currentEventCount, SnapshotRecord latest);

    long eventCountThreshold();

    Duration maxSnapshotAge();

    Duration minSnapshotInterval();
}
