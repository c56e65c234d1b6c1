package com.myorg.esf.eventing;

import com.myorg.esf.contracts.core.event.DomainEvent;

@FunctionalInterface
public interface EventHandler {
    void handle(DomainEvent event) throws Exception;
}
