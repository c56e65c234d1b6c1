package com.myorg.esf.contracts.core.exception;

import java.util.UUID;

public class AggregateNotFoundException extends EsfNonRetryableException {

    private final UUID aggregateId;

    public AggregateNotFoundException(String aggregateKind, UUID aggregateId) {
        super("NOT_FOUND", "No events or snapshot for " + aggregateKind + " aggregateId=" + aggregateId);
        this.aggregateId = aggregateId;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }
}
