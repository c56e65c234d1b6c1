package com.myorg.esf.eventing;

import com.myorg.esf.contracts.core.conventions.EventKindFormat;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Event kind to handlers, kept in registration order.
 */
public class EventHandlerRegistry {

    public record RegisteredHandler(String name, EventHandler handler) {
    }

    private final Map<String, List<RegisteredHandler>> handlers = new ConcurrentHashMap<>();

    public EventHandlerRegistry register(String eventKind, String name, EventHandler handler) {
        EventKindFormat.requireWellFormed(eventKind);
        handlers.computeIfAbsent(eventKind, k -> new CopyOnWriteArrayList<>())
                .add(new RegisteredHandler(name, handler));
        return this;
    }

    public List<RegisteredHandler> handlersFor(String eventKind) {
        List<RegisteredHandler> list = handlers.get(eventKind);
        return list == null ? List.of() : List.copyOf(list);
    }

    public Set<String> registeredKinds() {
        return Set.copyOf(handlers.keySet());
    }
}
