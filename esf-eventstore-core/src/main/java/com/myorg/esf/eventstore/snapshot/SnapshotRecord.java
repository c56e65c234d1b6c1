package com.myorg.esf.eventstore.snapshot;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Serialized baseline of an aggregate at {@code version}. Replaying events from
 * {@code version + 1} on top of the decoded state gives the same result as a full replay.
 */
@Value
@Builder
public class SnapshotRecord {
    @NonNull UUID id;
    @NonNull UUID aggregateId;
    @NonNull String aggregateKind;
    long version;
    long eventCountAtSnapshot;
    @NonNull Instant createdAt;
    @NonNull String state;
    int stateSize;
    Duration creationDuration;
}
