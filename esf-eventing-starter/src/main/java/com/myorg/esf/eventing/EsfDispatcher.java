package com.myorg.esf.eventing;

import com.myorg.esf.contracts.core.event.DomainEvent;

import java.util.List;

public interface EsfDispatcher {

    /**
     * Notifies the handlers of each event, in order. Handler failures are reported, never thrown.
     * A handler that throws {@link InterruptedException} fails like any other and the batch goes on;
     * the thread's interrupt flag is restored on return. Only an interrupt already set when the next
     * event comes up stops the batch.
     */
    DispatchReport dispatch(List<DomainEvent> events);
}
