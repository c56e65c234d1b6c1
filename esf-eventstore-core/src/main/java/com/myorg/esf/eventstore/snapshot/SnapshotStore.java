package com.myorg.esf.eventstore.snapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SnapshotStore {

    Optional<SnapshotRecord> latest(UUID aggregateId);

    /** All snapshots of the aggregate, newest first. */
    List<SnapshotRecord> list(UUID aggregateId);

    void save(SnapshotRecord snapshot);

    /** Deletes all but the {@code keep} newest snapshots of one aggregate. */
    int prune(UUID aggregateId, int keep);

    /** Applies {@link #prune} to every aggregate of the kind. */
    int pruneAll(String aggregateKind, int keep);

    /**
     * Aggregates of the kind that likely need a new snapshot: at least {@code eventCountThreshold}
     * events since their latest snapshot (or in total when they have none), or a latest snapshot
     * older than {@code maxAge}.
     */
    List<UUID> findCandidates(String aggregateKind, long eventCountThreshold, Duration maxAge, Instant now, int limit);
}
