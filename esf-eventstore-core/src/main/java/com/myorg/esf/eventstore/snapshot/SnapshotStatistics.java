package com.myorg.esf.eventstore.snapshot;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SnapshotStatistics {
    UUID aggregateId;
    long totalEvents;
    int totalSnapshots;
    long latestSnapshotVersion;       // 0 when there is no snapshot
    long eventsSinceLastSnapshot;
    Instant lastSnapshotAt;           // null when there is no snapshot
    double averageSnapshotSize;
    boolean snapshotRecommended;
}
