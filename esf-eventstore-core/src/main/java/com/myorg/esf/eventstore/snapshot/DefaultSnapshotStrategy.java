package com.myorg.esf.eventstore.snapshot;

import com.myorg.esf.eventstore.aggregate.Aggregate;
import com.myorg.esf.eventstore.aggregate.Tiered;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Duration;

/**
 * Threshold rules, evaluated in order; the first one that decides wins:
 * <ol>
 *   <li>no snapshot yet: enough events for a first one</li>
 *   <li>latest snapshot older than the max age: always</li>
 *   <li>enough events since the latest snapshot: always</li>
 *   <li>latest snapshot younger than the min interval: never</li>
 *   <li>high-tier aggregates use a lower events-since threshold</li>
 * </ol>
 */
@RequiredArgsConstructor
public class DefaultSnapshotStrategy implements SnapshotStrategy {

    private final SnapshotProperties props;
    private final Clock clock;

    @Override
    public boolean shouldSnapshot(Aggregate aggregate, long currentEventCount, SnapshotRecord latest) {
        if (latest == null) {
            return currentEventCount >= props.getMinEventsForFirstSnapshot();
        }

        Duration age = Duration.between(latest.getCreatedAt(), clock.instant());
        if (age.compareTo(props.getMaxSnapshotAge()) > 0) {
            return true;
        }

        long eventsSince = currentEventCount - latest.getEventCountAtSnapshot();
        if (eventsSince >= props.getEventCountThreshold()) {
            return true;
        }

        if (age.compareTo(props.getMinSnapshotInterval()) < 0) {
            return false;
        }

        if (aggregate instanceof Tiered tiered && tiered.tier() >= props.getHighTierThreshold()) {
            return eventsSince >= props.getHighTierEventThreshold();
        }
        return false;
    }

    @Override
    public long eventCountThreshold() {
        return props.getEventCountThreshold();
    }

    @Override
    public Duration maxSnapshotAge() {
        return props.getMaxSnapshotAge();
    }

    @Override
    public Duration minSnapshotInterval() {
        return props.getMinSnapshotInterval();
    }
}
