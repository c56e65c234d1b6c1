package com.myorg.esf.eventstore.jdbc;

import com.myorg.esf.contracts.core.codec.EventPayloadCodec;
import com.myorg.esf.contracts.core.event.DomainEvent;
import com.myorg.esf.contracts.core.exception.ConcurrencyConflictException;
import com.myorg.esf.contracts.core.exception.StorageException;
import com.myorg.esf.eventstore.store.EventStore;
import com.myorg.esf.eventstore.store.EventStream;
import com.myorg.esf.eventstore.store.StoredEvent;
import com.myorg.esf.eventstore.store.StoredEventMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;

/**
 * Event store over one table. The unique {@code (aggregate_id, version)} constraint makes
 * concurrent appends assuming the same head fail in all but one transaction.
 */
@Slf4j
public class JdbcEventStore implements EventStore {

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final StoredEventMapper mapper;
    private final EsfEventStoreJdbcProperties props;
    private final EventStoreMetrics metrics; // may be null

    public JdbcEventStore(JdbcTemplate jdbc, TransactionTemplate tx, EventPayloadCodec codec,
                          EsfEventStoreJdbcProperties props, EventStoreMetrics metrics) {
        this.jdbc = jdbc;
        this.tx = tx;
        this.mapper = new StoredEventMapper(codec);
        this.props = props;
        this.metrics = metrics;
    }

    private String t() { return props.getEventsTable(); }

    @Override
    public long append(UUID aggregateId, String aggregateKind, long expectedVersion,
                       List<DomainEvent> events, String actorId) {
        List<StoredEvent> batch = mapper.toStored(aggregateId, aggregateKind, expectedVersion, events, actorId);
        if (batch.isEmpty()) {
            return headVersion(aggregateId);
        }

        String sql = """
                INSERT INTO %s
                  (id, aggregate_id, aggregate_kind, version, event_kind, payload, occurred_at, actor_id)
                VALUES
                  (?, ?, ?, ?, ?, ?, ?, ?)
                """.formatted(t());

        try {
            Long head = tx.execute(st -> {
                long current = headVersion(aggregateId);
                if (current != expectedVersion) {
                    throw new ConcurrencyConflictException(aggregateId, expectedVersion, current);
                }
                jdbc.batchUpdate(sql, batch, batch.size(), (ps, e) -> {
                    ps.setObject(1, e.id());
                    ps.setObject(2, e.aggregateId());
                    ps.setString(3, e.aggregateKind());
                    ps.setLong(4, e.version());
                    ps.setString(5, e.eventKind());
                    ps.setString(6, e.payload());
                    ps.setObject(7, UtcTimestamps.bind(e.timestamp()));
                    ps.setString(8, e.actorId());
                });
                return current + batch.size();
            });
            if (head == null) throw new IllegalStateException("No head version returned from append");

            if (metrics != null) metrics.appended(aggregateKind, batch.size());
            log.debug("Appended aggregateKind={} aggregateId={} events={} head={}",
                    aggregateKind, aggregateId, batch.size(), head);
            return head;
        } catch (ConcurrencyConflictException e) {
            conflict(aggregateKind, e);
            throw e;
        } catch (DuplicateKeyException e) {
            ConcurrencyConflictException conflict = new ConcurrencyConflictException(
                    aggregateId, expectedVersion, headVersion(aggregateId), e);
            conflict(aggregateKind, conflict);
            throw conflict;
        } catch (DataAccessException | TransactionException e) {
            throw new StorageException("Append failed for aggregateId=" + aggregateId, e);
        }
    }

    @Override
    public EventStream read(UUID aggregateId, long fromVersion) {
        String sql = """
                SELECT id, aggregate_id, aggregate_kind, version, event_kind, payload, occurred_at, actor_id
                FROM %s
                WHERE aggregate_id = ? AND version >= ?
                ORDER BY version
                """.formatted(t());
        try {
            List<StoredEvent> rows = jdbc.query(sql,
                    (rs, i) -> new StoredEvent(
                            rs.getObject("id", UUID.class),
                            rs.getObject("aggregate_id", UUID.class),
                            rs.getString("aggregate_kind"),
                            rs.getLong("version"),
                            rs.getString("event_kind"),
                            rs.getString("payload"),
                            UtcTimestamps.read(rs, "occurred_at"),
                            rs.getString("actor_id")
                    ),
                    aggregateId,
                    Math.max(1, fromVersion)
            );
            return mapper.toStream(aggregateId, rows);
        } catch (DataAccessException e) {
            throw new StorageException("Read failed for aggregateId=" + aggregateId, e);
        }
    }

    @Override
    public long headVersion(UUID aggregateId) {
        String sql = "SELECT COALESCE(MAX(version), 0) FROM %s WHERE aggregate_id = ?".formatted(t());
        try {
            Long head = jdbc.queryForObject(sql, Long.class, aggregateId);
            return head == null ? 0 : head;
        } catch (DataAccessException e) {
            throw new StorageException("Cannot read head version of aggregateId=" + aggregateId, e);
        }
    }

    private void conflict(String aggregateKind, ConcurrencyConflictException e) {
        if (metrics != null) metrics.conflict(aggregateKind);
        log.info("Concurrency conflict aggregateKind={} aggregateId={} expectedVersion={} actualVersion={}",
                aggregateKind, e.getAggregateId(), e.getExpectedVersion(), e.getActualVersion());
    }
}
