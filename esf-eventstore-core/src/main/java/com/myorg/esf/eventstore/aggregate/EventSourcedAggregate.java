package com.myorg.esf.eventstore.aggregate;

import com.myorg.esf.contracts.core.event.DomainEvent;

import java.util.List;
import java.util.UUID;

/**
 * Aggregate built by composition: the entity embeds an {@link AggregateEvents} buffer, and its
 * state transitions live in the {@link AggregateDefinition} of its kind.
 */
public interface EventSourcedAggregate extends Aggregate {

    AggregateEvents events();

    @Override
    default UUID id() {
        return events().aggregateId();
    }

    @Override
    default long version() {
        return events().version();
    }

    @Override
    default List<DomainEvent> uncommittedEvents() {
        return events().uncommitted();
    }

    @Override
    default void clearEvents() {
        events().clear();
    }
}
