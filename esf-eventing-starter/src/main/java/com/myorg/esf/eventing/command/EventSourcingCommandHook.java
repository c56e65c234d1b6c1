package com.myorg.esf.eventing.command;

import com.myorg.esf.contracts.core.event.DomainEvent;
import com.myorg.esf.eventing.DispatchReport;
import com.myorg.esf.eventing.EsfDispatcher;
import com.myorg.esf.eventstore.aggregate.EventSourcedAggregate;
import com.myorg.esf.eventstore.store.EventStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Runs after a successful state-changing operation: appends the aggregate's uncommitted events,
 * dispatches them, then clears the buffer.
 *
 * <p>If the append fails the exception reaches the caller, nothing is dispatched and the buffer
 * is left as it was. Handler failures never fail the command; they are in the returned report.
 */
@Slf4j
public class EventSourcingCommandHook {

    private final EventStore eventStore;
    private final EsfDispatcher dispatcher;
    private final List<AggregateCommitListener> listeners;

    public EventSourcingCommandHook(EventStore eventStore, EsfDispatcher dispatcher,
                                    List<AggregateCommitListener> listeners) {
        this.eventStore = eventStore;
        this.dispatcher = dispatcher;
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    public <R> CommandOutcome<R> afterCommand(CommandResult<R> result) {
        Optional<EventSourcedAggregate> maybeAggregate = result.aggregate();
        if (maybeAggregate.isEmpty()) {
            return new CommandOutcome<>(result.value(), 0, 0, DispatchReport.empty());
        }
        EventSourcedAggregate aggregate = maybeAggregate.get();
        List<DomainEvent> pending = aggregate.uncommittedEvents();
        if (pending.isEmpty()) {
            return new CommandOutcome<>(result.value(), aggregate.version(), 0, DispatchReport.empty());
        }

        long expected = aggregate.version() - pending.size();
        long head = eventStore.append(aggregate.id(), aggregate.aggregateKind(), expected, pending, result.actorId());

        DispatchReport report = dispatcher.dispatch(pending);
        aggregate.clearEvents();
        if (!report.allSucceeded()) {
            log.warn("Committed aggregateId={} head={} but {} handler(s) failed",
                    aggregate.id(), head, report.failures().size());
        }

        for (AggregateCommitListener l : listeners) {
            try {
                l.onCommitted(aggregate);
            } catch (RuntimeException e) {
                log.warn("Commit listener failed for aggregateId={}", aggregate.id(), e);
            }
        }
        return new CommandOutcome<>(result.value(), head, pending.size(), report);
    }
}
