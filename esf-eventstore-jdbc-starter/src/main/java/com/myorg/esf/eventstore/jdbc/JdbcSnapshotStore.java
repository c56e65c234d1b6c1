package com.myorg.esf.eventstore.jdbc;

import com.myorg.esf.contracts.core.exception.StorageException;
import com.myorg.esf.eventstore.snapshot.SnapshotRecord;
import com.myorg.esf.eventstore.snapshot.SnapshotStore;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RequiredArgsConstructor
public class JdbcSnapshotStore implements SnapshotStore {

    private final JdbcTemplate jdbc;
    private final EsfEventStoreJdbcProperties props;

    private String s() { return props.getSnapshotsTable(); }
    private String e() { return props.getEventsTable(); }

    private static final RowMapper<SnapshotRecord> ROW = (rs, i) -> {
        long creationMs = rs.getLong("creation_ms");
        Duration creation = rs.wasNull() ? null : Duration.ofMillis(creationMs);
        return SnapshotRecord.builder()
                .id(rs.getObject("id", UUID.class))
                .aggregateId(rs.getObject("aggregate_id", UUID.class))
                .aggregateKind(rs.getString("aggregate_kind"))
                .version(rs.getLong("version"))
                .eventCountAtSnapshot(rs.getLong("event_count"))
                .createdAt(UtcTimestamps.read(rs, "created_at"))
                .state(rs.getString("state"))
                .stateSize(rs.getInt("state_size"))
                .creationDuration(creation)
                .build();
    };

    @Override
    public Optional<SnapshotRecord> latest(UUID aggregateId) {
        String sql = """
                SELECT id, aggregate_id, aggregate_kind, version, event_count, created_at, state, state_size, creation_ms
                FROM %s
                WHERE aggregate_id = ?
                ORDER BY version DESC, created_at DESC
                LIMIT 1
                """.formatted(s());
        return query(sql, aggregateId).stream().findFirst();
    }

    @Override
    public List<SnapshotRecord> list(UUID aggregateId) {
        String sql = """
                SELECT id, aggregate_id, aggregate_kind, version, event_count, created_at, state, state_size, creation_ms
                FROM %s
                WHERE aggregate_id = ?
                ORDER BY version DESC, created_at DESC
                """.formatted(s());
        return query(sql, aggregateId);
    }

    @Override
    public void save(SnapshotRecord snapshot) {
        String sql = """
                INSERT INTO %s
                  (id, aggregate_id, aggregate_kind, version, event_count, created_at, state, state_size, creation_ms)
                VALUES
                  (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """.formatted(s());
        try {
            jdbc.update(sql,
                    snapshot.getId(),
                    snapshot.getAggregateId(),
                    snapshot.getAggregateKind(),
                    snapshot.getVersion(),
                    snapshot.getEventCountAtSnapshot(),
                    UtcTimestamps.bind(snapshot.getCreatedAt()),
                    snapshot.getState(),
                    snapshot.getStateSize(),
                    snapshot.getCreationDuration() == null ? null : snapshot.getCreationDuration().toMillis()
            );
        } catch (DataAccessException ex) {
            throw new StorageException("Cannot save snapshot of aggregateId=" + snapshot.getAggregateId(), ex);
        }
    }

    @Override
    public int prune(UUID aggregateId, int keep) {
        String sql = """
                DELETE FROM %s
                WHERE aggregate_id = ?
                  AND id NOT IN (
                    SELECT id FROM (
                        SELECT id FROM %s
                        WHERE aggregate_id = ?
                        ORDER BY version DESC, created_at DESC
                        LIMIT ?
                    ) k
                  )
                """.formatted(s(), s());
        try {
            return jdbc.update(sql, aggregateId, aggregateId, Math.max(keep, 0));
        } catch (DataAccessException ex) {
            throw new StorageException("Cannot prune snapshots of aggregateId=" + aggregateId, ex);
        }
    }

    @Override
    public int pruneAll(String aggregateKind, int keep) {
        String sql = """
                SELECT aggregate_id FROM %s
                WHERE aggregate_kind = ?
                GROUP BY aggregate_id
                HAVING COUNT(*) > ?
                """.formatted(s());
        try {
            List<UUID> ids = jdbc.query(sql, (rs, i) -> rs.getObject(1, UUID.class), aggregateKind, keep);
            int deleted = 0;
            for (UUID id : ids) {
                deleted += prune(id, keep);
            }
            return deleted;
        } catch (DataAccessException ex) {
            throw new StorageException("Cannot prune snapshots of aggregateKind=" + aggregateKind, ex);
        }
    }

    @Override
    public List<UUID> findCandidates(String aggregateKind, long eventCountThreshold, Duration maxAge,
                                     Instant now, int limit) {
        String sql = """
                SELECT h.aggregate_id
                FROM (
                    SELECT aggregate_id, MAX(version) AS head
                    FROM %s
                    WHERE aggregate_kind = ?
                    GROUP BY aggregate_id
                ) h
                LEFT JOIN (
                    SELECT aggregate_id, MAX(event_count) AS snap_count, MAX(created_at) AS snap_at
                    FROM %s
                    GROUP BY aggregate_id
                ) s ON s.aggregate_id = h.aggregate_id
                WHERE (s.aggregate_id IS NULL AND h.head >= ?)
                   OR (s.aggregate_id IS NOT NULL AND (h.head - s.snap_count >= ? OR s.snap_at < ?))
                ORDER BY h.head DESC
                LIMIT ?
                """.formatted(e(), s());
        try {
            return jdbc.query(sql, (rs, i) -> rs.getObject(1, UUID.class),
                    aggregateKind,
                    eventCountThreshold,
                    eventCountThreshold,
                    UtcTimestamps.bind(now.minus(maxAge)),
                    limit);
        } catch (DataAccessException ex) {
            throw new StorageException("Cannot find snapshot candidates of aggregateKind=" + aggregateKind, ex);
        }
    }

    private List<SnapshotRecord> query(String sql, UUID aggregateId) {
        try {
            return jdbc.query(sql, ROW, aggregateId);
        } catch (DataAccessException ex) {
            throw new StorageException("Cannot read snapshots of aggregateId=" + aggregateId, ex);
        }
    }
}
