package com.myorg.esf.eventstore.repository;

import com.myorg.esf.contracts.core.exception.AggregateNotFoundException;
import com.myorg.esf.eventstore.aggregate.EventSourcedAggregate;

import java.util.Optional;
import java.util.UUID;

public interface AggregateRepository<A extends EventSourcedAggregate> {

    String aggregateKind();

    /** Current state, empty when the aggregate has neither events nor a snapshot. */
    Optional<A> findById(UUID aggregateId);

    default A getById(UUID aggregateId) {
        return findById(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateKind(), aggregateId));
    }
}
