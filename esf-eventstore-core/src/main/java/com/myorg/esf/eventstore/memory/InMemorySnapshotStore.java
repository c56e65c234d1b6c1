package com.myorg.esf.eventstore.memory;

import com.myorg.esf.eventstore.snapshot.SnapshotRecord;
import com.myorg.esf.eventstore.snapshot.SnapshotStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySnapshotStore implements SnapshotStore {

    private static final Comparator<SnapshotRecord> NEWEST_FIRST =
            Comparator.comparingLong(SnapshotRecord::getVersion)
                    .thenComparing(SnapshotRecord::getCreatedAt)
                    .reversed();

    private final InMemoryEventStore eventStore;
    private final Map<UUID, List<SnapshotRecord>> snapshots = new ConcurrentHashMap<>();

    /**
     * @param eventStore consulted by {@link #findCandidates} for head versions
     */
    public InMemorySnapshotStore(InMemoryEventStore eventStore) {
        this.eventStore = eventStore;
    }

    @Override
    public Optional<SnapshotRecord> latest(UUID aggregateId) {
        List<SnapshotRecord> list = list(aggregateId);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public List<SnapshotRecord> list(UUID aggregateId) {
        List<SnapshotRecord> list = new ArrayList<>(snapshots.getOrDefault(aggregateId, List.of()));
        list.sort(NEWEST_FIRST);
        return list;
    }

    @Override
    public void save(SnapshotRecord snapshot) {
        snapshots.compute(snapshot.getAggregateId(), (id, current) -> {
            List<SnapshotRecord> next = new ArrayList<>(current == null ? List.of() : current);
            next.add(snapshot);
            return List.copyOf(next);
        });
    }

    @Override
    public int prune(UUID aggregateId, int keep) {
        int[] deleted = {0};
        snapshots.computeIfPresent(aggregateId, (id, current) -> {
            if (current.size() <= keep) {
                return current;
            }
            List<SnapshotRecord> sorted = new ArrayList<>(current);
            sorted.sort(NEWEST_FIRST);
            deleted[0] = sorted.size() - Math.max(keep, 0);
            return List.copyOf(sorted.subList(0, Math.max(keep, 0)));
        });
        return deleted[0];
    }

    @Override
    public int pruneAll(String aggregateKind, int keep) {
        int deleted = 0;
        for (Map.Entry<UUID, List<SnapshotRecord>> e : snapshots.entrySet()) {
            if (!e.getValue().isEmpty() && aggregateKind.equals(e.getValue().get(0).getAggregateKind())) {
                deleted += prune(e.getKey(), keep);
            }
        }
        return deleted;
    }

    @Override
    public List<UUID> findCandidates(String aggregateKind, long eventCountThreshold, Duration maxAge,
                                     Instant now, int limit) {
        List<UUID> out = new ArrayList<>();
        for (Map.Entry<UUID, Long> e : eventStore.headVersions(aggregateKind).entrySet()) {
            if (out.size() >= limit) break;
            long head = e.getValue();
            Optional<SnapshotRecord> latest = latest(e.getKey());
            boolean due = latest
                    .map(s -> head - s.getEventCountAtSnapshot() >= eventCountThreshold
                            || s.getCreatedAt().isBefore(now.minus(maxAge)))
                    .orElse(head >= eventCountThreshold);
            if (due) {
                out.add(e.getKey());
            }
        }
        return out;
    }
}
