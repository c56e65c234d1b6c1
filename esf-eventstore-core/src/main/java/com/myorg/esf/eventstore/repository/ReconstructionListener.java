package com.myorg.esf.eventstore.repository;

import com.myorg.esf.eventstore.aggregate.EventSourcedAggregate;

/**
 * Notified after an aggregate was successfully reconstructed for a caller. Must not block.
 */
@FunctionalInterface
public interface ReconstructionListener {
    void onReconstructed(EventSourcedAggregate aggregate);
}
