package com.myorg.esf.eventing;

import com.myorg.esf.contracts.core.event.DomainEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@RequiredArgsConstructor
public class DefaultEsfDispatcher implements EsfDispatcher {

    private final EventHandlerRegistry registry;

    @Override
    public DispatchReport dispatch(List<DomainEvent> events) {
        List<HandlerOutcome> outcomes = new ArrayList<>();
        int processed = 0;
        boolean handlerInterrupted = false;

        for (DomainEvent event : events) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Dispatch interrupted, {} of {} events not dispatched", events.size() - processed, events.size());
                return new DispatchReport(List.copyOf(outcomes), processed, true);
            }

            List<EventHandlerRegistry.RegisteredHandler> handlers = registry.handlersFor(event.getEventKind());
            if (handlers.isEmpty()) {
                log.debug("No handler for eventKind={}, eventId={}", event.getEventKind(), event.getEventId());
            }
            for (EventHandlerRegistry.RegisteredHandler h : handlers) {
                HandlerOutcome outcome = invoke(h, event);
                handlerInterrupted |= outcome.getError() instanceof InterruptedException;
                outcomes.add(outcome);
            }
            processed++;
        }
        if (handlerInterrupted) {
            Thread.currentThread().interrupt();
        }
        return new DispatchReport(List.copyOf(outcomes), processed, false);
    }

    private HandlerOutcome invoke(EventHandlerRegistry.RegisteredHandler h, DomainEvent event) {
        try {
            h.handler().handle(event);
            return outcome(h, event, null);
        } catch (InterruptedException e) {
            // flag restored once the batch is done
            log.warn("Handler {} interrupted eventKind={} eventId={}", h.name(), event.getEventKind(), event.getEventId());
            return outcome(h, event, e);
        } catch (Exception e) {
            log.error("Handler {} failed eventKind={} eventId={} aggregateId={} version={}",
                    h.name(), event.getEventKind(), event.getEventId(), event.getAggregateId(), event.getVersion(), e);
            return outcome(h, event, e);
        }
    }

    private static HandlerOutcome outcome(EventHandlerRegistry.RegisteredHandler h, DomainEvent event, Throwable error) {
        return new HandlerOutcome(event.getEventId(), event.getEventKind(), event.getAggregateId(),
                event.getVersion(), h.name(), error == null, error);
    }
}
