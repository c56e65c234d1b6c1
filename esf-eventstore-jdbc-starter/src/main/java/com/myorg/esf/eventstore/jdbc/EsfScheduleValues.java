package com.myorg.esf.eventstore.jdbc;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class EsfScheduleValues {
    private final EsfEventStoreJdbcProperties props;

    public long getPollIntervalMs() { return props.getScheduler().getPollInterval().toMillis(); }
    public long getInitialDelayMs() { return props.getScheduler().getInitialDelay().toMillis(); }
    public long getCleanupIntervalMs() { return props.getScheduler().getCleanupInterval().toMillis(); }
}
