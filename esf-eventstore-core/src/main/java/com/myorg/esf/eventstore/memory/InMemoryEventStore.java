package com.myorg.esf.eventstore.memory;

import com.myorg.esf.contracts.core.codec.EventPayloadCodec;
import com.myorg.esf.contracts.core.event.DomainEvent;
import com.myorg.esf.contracts.core.exception.ConcurrencyConflictException;
import com.myorg.esf.eventstore.store.EventStore;
import com.myorg.esf.eventstore.store.EventStream;
import com.myorg.esf.eventstore.store.StoredEvent;
import com.myorg.esf.eventstore.store.StoredEventMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process event store. Appends to one aggregate are serialized by the map's per-key
 * compute; a conflicting or invalid batch leaves the stream untouched.
 */
@Slf4j
public class InMemoryEventStore implements EventStore {

    private final StoredEventMapper mapper;
    private final Map<UUID, List<StoredEvent>> streams = new ConcurrentHashMap<>();

    public InMemoryEventStore(EventPayloadCodec codec) {
        this.mapper = new StoredEventMapper(codec);
    }

    @Override
    public long append(UUID aggregateId, String aggregateKind, long expectedVersion,
                       List<DomainEvent> events, String actorId) {
        List<StoredEvent> batch = mapper.toStored(aggregateId, aggregateKind, expectedVersion, events, actorId);
        List<StoredEvent> stream = streams.compute(aggregateId, (id, current) -> {
            long head = current == null ? 0 : current.size();
            if (head != expectedVersion) {
                throw new ConcurrencyConflictException(aggregateId, expectedVersion, head);
            }
            List<StoredEvent> next = new ArrayList<>(current == null ? List.of() : current);
            next.addAll(batch);
            return List.copyOf(next);
        });
        log.debug("Appended aggregateId={} events={} head={}", aggregateId, batch.size(), stream.size());
        return stream.size();
    }

    @Override
    public EventStream read(UUID aggregateId, long fromVersion) {
        List<StoredEvent> stream = streams.getOrDefault(aggregateId, List.of());
        int from = (int) Math.max(0, Math.min(stream.size(), fromVersion - 1));
        return mapper.toStream(aggregateId, stream.subList(from, stream.size()));
    }

    @Override
    public long headVersion(UUID aggregateId) {
        return streams.getOrDefault(aggregateId, List.of()).size();
    }

    /** Raw stored rows of one aggregate. */
    public List<StoredEvent> storedEvents(UUID aggregateId) {
        return streams.getOrDefault(aggregateId, List.of());
    }

    Map<UUID, Long> headVersions(String aggregateKind) {
        Map<UUID, Long> out = new HashMap<>();
        streams.forEach((id, stream) -> {
            if (!stream.isEmpty() && aggregateKind.equals(stream.get(0).aggregateKind())) {
                out.put(id, (long) stream.size());
            }
        });
        return out;
    }
}
