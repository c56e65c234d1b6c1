package com.demo.rpg.app;

import com.demo.rpg.domain.Character;
import com.myorg.esf.contracts.core.event.DomainEvent;
import com.myorg.esf.contracts.core.exception.AggregateNotFoundException;
import com.myorg.esf.contracts.rpg.RpgEventKinds;
import com.myorg.esf.eventstore.EventSourcingRuntime;
import com.myorg.esf.eventstore.repository.EventSourcedAggregateRepository;
import com.myorg.esf.eventstore.snapshot.SnapshotRecord;
import com.myorg.esf.eventstore.snapshot.SnapshotService;
import com.myorg.esf.eventstore.snapshot.SnapshotStatistics;
import com.myorg.esf.eventstore.store.EventStream;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class CharacterQueryService {

    private final EventSourcingRuntime runtime;
    private final EventSourcedAggregateRepository<Character> characters;

    public CharacterQueryService(EventSourcingRuntime runtime) {
        this.runtime = runtime;
        this.characters = runtime.repository(Character.DEFINITION);
    }

    public CharacterView get(UUID id) {
        return CharacterView.of(characters.getById(id));
    }

    /** Full history, oldest first. */
    public List<EventView> events(UUID id, long fromVersion) {
        EventStream stream = runtime.eventStore().read(id, Math.max(1, fromVersion)).requireComplete();
        if (stream.isEmpty() && runtime.eventStore().headVersion(id) == 0) {
            throw new AggregateNotFoundException(RpgEventKinds.CHARACTER_AGGREGATE, id);
        }
        return stream.events().stream().map(EventView::of).toList();
    }

    public SnapshotStatistics snapshotStatistics(UUID id) {
        if (runtime.eventStore().headVersion(id) == 0) {
            throw new AggregateNotFoundException(RpgEventKinds.CHARACTER_AGGREGATE, id);
        }
        return snapshots().statistics(id);
    }

    public SnapshotView createSnapshot(UUID id) {
        return SnapshotView.of(snapshots().createSnapshot(id));
    }

    private SnapshotService<?> snapshots() {
        return runtime.snapshots(RpgEventKinds.CHARACTER_AGGREGATE)
                .orElseThrow(() -> new IllegalStateException("Snapshots are disabled"));
    }

    public record EventView(UUID eventId, long version, String eventKind, Instant occurredAt,
                            String actorId, Object payload) {
        static EventView of(DomainEvent e) {
            return new EventView(e.getEventId(), e.getVersion(), e.getEventKind(), e.getOccurredAt(),
                    e.getActorId(), e.getPayload());
        }
    }

    public record SnapshotView(UUID snapshotId, UUID aggregateId, long version, Instant createdAt,
                               int stateSize, Long creationMs) {
        static SnapshotView of(SnapshotRecord r) {
            return new SnapshotView(r.getId(), r.getAggregateId(), r.getVersion(), r.getCreatedAt(),
                    r.getStateSize(), r.getCreationDuration() == null ? null : r.getCreationDuration().toMillis());
        }
    }
}
