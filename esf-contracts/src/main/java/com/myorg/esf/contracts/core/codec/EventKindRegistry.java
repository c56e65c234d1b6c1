package com.myorg.esf.contracts.core.codec;

import com.myorg.esf.contracts.core.conventions.EventKindFormat;
import com.myorg.esf.contracts.core.exception.UnknownEventKindException;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Table from a stable event kind tag to the payload contract it decodes into.
 * The stored form of an event only ever carries the tag.
 */
public class EventKindRegistry {

    private final Map<String, Class<?>> payloadTypes = new ConcurrentHashMap<>();

    public EventKindRegistry register(String eventKind, Class<?> payloadType) {
        EventKindFormat.requireWellFormed(eventKind);
        Class<?> prev = payloadTypes.putIfAbsent(eventKind, payloadType);
        if (prev != null && !prev.equals(payloadType)) {
            throw new IllegalStateException("eventKind=" + eventKind + " already mapped to "
                    + prev.getName() + ", cannot remap to " + payloadType.getName());
        }
        return this;
    }

    public Class<?> payloadType(String eventKind) {
        Class<?> type = payloadTypes.get(eventKind);
        if (type == null) throw new UnknownEventKindException(eventKind);
        return type;
    }

    public boolean isKnown(String eventKind) {
        return payloadTypes.containsKey(eventKind);
    }

    public Set<String> kinds() {
        return Set.copyOf(payloadTypes.keySet());
    }
}
