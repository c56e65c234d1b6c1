package com.myorg.esf.eventstore.snapshot;

import lombok.Data;

import java.time.Duration;

/**
 * Snapshot tuning, bound to {@code esf.snapshot.*} by the starters.
 */
@Data
public class SnapshotProperties {

    private boolean enabled = true;

    /** Schedule an out-of-band check after each successful read. */
    private boolean checkAfterRead = true;

    private int minEventsForFirstSnapshot = 100;
    private int eventCountThreshold = 500;
    private Duration maxSnapshotAge = Duration.ofDays(30);
    private Duration minSnapshotInterval = Duration.ofHours(1);

    private int highTierThreshold = 50;
    private int highTierEventThreshold = 250;

    private int maxSnapshotsPerAggregate = 5;
    private int backgroundBatchSize = 10;
}
