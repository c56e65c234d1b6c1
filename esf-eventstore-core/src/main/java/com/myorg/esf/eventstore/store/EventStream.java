package com.myorg.esf.eventstore.store;

import com.myorg.esf.contracts.core.event.DomainEvent;
import com.myorg.esf.contracts.core.event.EventReadFailure;
import com.myorg.esf.contracts.core.exception.EventSerializationException;

import java.util.List;
import java.util.UUID;

/**
 * Result of a read: the decoded events in ascending version order, plus the stored events
 * that could not be decoded.
 */
public record EventStream(UUID aggregateId, List<DomainEvent> events, List<EventReadFailure> failures) {

    public EventStream {
        events = List.copyOf(events);
        failures = List.copyOf(failures);
    }

    public static EventStream empty(UUID aggregateId) {
        return new EventStream(aggregateId, List.of(), List.of());
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }

    public boolean isEmpty() {
        return events.isEmpty() && failures.isEmpty();
    }

    /** Version of the last decoded event, 0 when none. */
    public long lastVersion() {
        return events.isEmpty() ? 0 : events.get(events.size() - 1).getVersion();
    }

    public EventStream requireComplete() {
        if (!isComplete()) {
            throw new EventSerializationException(
                    "Cannot decode " + failures.size() + " event(s) of aggregateId=" + aggregateId, failures);
        }
        return this;
    }
}
