package com.myorg.esf.observability;

import com.myorg.esf.contracts.core.event.DomainEvent;
import org.slf4j.MDC;

public final class EsfMdc {
    public static final String EVENT_ID = "eventId";
    public static final String EVENT_KIND = "eventKind";
    public static final String AGGREGATE_ID = "aggregateId";
    public static final String AGGREGATE_VERSION = "aggregateVersion";

    private EsfMdc() {}

    public static void put(DomainEvent e) {
        if (e == null) return;
        if (e.getEventId() != null) MDC.put(EVENT_ID, e.getEventId().toString());
        if (e.getEventKind() != null) MDC.put(EVENT_KIND, e.getEventKind());
        if (e.getAggregateId() != null) MDC.put(AGGREGATE_ID, e.getAggregateId().toString());
        MDC.put(AGGREGATE_VERSION, String.valueOf(e.getVersion()));
    }

    public static void clear() {
        MDC.remove(EVENT_ID);
        MDC.remove(EVENT_KIND);
        MDC.remove(AGGREGATE_ID);
        MDC.remove(AGGREGATE_VERSION);
    }
}
