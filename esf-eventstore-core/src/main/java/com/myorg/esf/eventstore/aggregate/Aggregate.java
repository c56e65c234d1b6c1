package com.myorg.esf.eventstore.aggregate;

import com.myorg.esf.contracts.core.event.DomainEvent;

import java.util.List;
import java.util.UUID;

/**
 * Capability of an entity whose state is derived from its event history.
 */
public interface Aggregate {

    UUID id();

    String aggregateKind();

    /** Number of events applied to this instance so far, replayed or newly raised. */
    long version();

    /** Events raised since the last successful commit, in raise order. */
    List<DomainEvent> uncommittedEvents();

    void clearEvents();
}
