package com.myorg.esf.contracts.core.exception;

import java.util.UUID;

/**
 * An append assumed a predecessor version that is no longer the head of the aggregate's stream.
 * The command should be re-run against freshly loaded state.
 */
public class ConcurrencyConflictException extends EsfRetryableException {

    private final UUID aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(UUID aggregateId, long expectedVersion, long actualVersion) {
        this(aggregateId, expectedVersion, actualVersion, null);
    }

    public ConcurrencyConflictException(UUID aggregateId, long expectedVersion, long actualVersion, Throwable cause) {
        super("Concurrency conflict on aggregateId=" + aggregateId
                + ": expectedVersion=" + expectedVersion + ", actualVersion=" + actualVersion, cause);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public UUID getAggregateId() { return aggregateId; }
    public long getExpectedVersion() { return expectedVersion; }
    public long getActualVersion() { return actualVersion; }
}
