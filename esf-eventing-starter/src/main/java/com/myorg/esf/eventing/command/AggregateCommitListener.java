package com.myorg.esf.eventing.command;

import com.myorg.esf.eventstore.aggregate.EventSourcedAggregate;

/**
 * Called after an aggregate's events were appended and dispatched. Must not block.
 */
@FunctionalInterface
public interface AggregateCommitListener {
    void onCommitted(EventSourcedAggregate aggregate);
}
