package com.myorg.esf.eventstore.jdbc;

import com.myorg.esf.contracts.core.event.DomainEvent;
import com.myorg.esf.contracts.core.exception.ConcurrencyConflictException;
import com.myorg.esf.eventstore.store.EventStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.TimeZone;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class JdbcEventStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private JdbcTemplate jdbc;
    private JdbcEventStore store;

    @BeforeEach
    void setUp() {
        DataSource ds = H2Support.migratedDataSource("esf_event_store_test");
        jdbc = new JdbcTemplate(ds);
        TransactionTemplate tx = new TransactionTemplate(new DataSourceTransactionManager(ds));
        store = new JdbcEventStore(jdbc, tx, Tally.codec(), new EsfEventStoreJdbcProperties(), null);
    }

    @Test
    void append_thenRead_returnsEventsInVersionOrder() {
        Tally t = tally(3);

        long head = store.append(t.id(), Tally.KIND, 0, t.uncommittedEvents(), "alice");

        EventStream stream = store.read(t.id());
        assertEquals(3, head);
        assertEquals(3, store.headVersion(t.id()));
        assertTrue(stream.isComplete());
        assertThat(stream.events()).extracting(DomainEvent::getVersion).containsExactly(1L, 2L, 3L);

        DomainEvent first = stream.events().get(0);
        DomainEvent raised = t.uncommittedEvents().get(0);
        assertEquals(raised.getEventId(), first.getEventId());
        assertEquals(raised.getOccurredAt(), first.getOccurredAt());
        assertEquals(raised.getPayload(), first.getPayload());
        assertEquals("alice", first.getActorId());
    }

    @Test
    void read_fromVersion() {
        Tally t = tally(4);
        store.append(t.id(), Tally.KIND, t.uncommittedEvents(), null);

        assertThat(store.read(t.id(), 3).events()).extracting(DomainEvent::getVersion).containsExactly(3L, 4L);
        assertThat(store.read(UUID.randomUUID()).isEmpty()).isTrue();
    }

    @Test
    void staleExpectedVersion_isRejectedAndWritesNothing() {
        Tally t = tally(2);
        store.append(t.id(), Tally.KIND, 0, t.uncommittedEvents(), null);

        Tally stale = new Tally(t.id(), CLOCK);
        stale.add(5);

        assertThatThrownBy(() -> store.append(t.id(), Tally.KIND, 0, stale.uncommittedEvents(), null))
                .isInstanceOf(ConcurrencyConflictException.class);
        assertEquals(2, store.headVersion(t.id()));
    }

    @Test
    void concurrentAppendsOnSameHead_exactlyOneWins() throws Exception {
        UUID id = UUID.randomUUID();
        int writers = 4;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                Tally t = new Tally(id, CLOCK);
                t.add(1);
                t.add(1);
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        store.append(id, Tally.KIND, 0, t.uncommittedEvents(), null);
                        return true;
                    } catch (ConcurrencyConflictException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int wins = 0;
            for (Future<Boolean> f : results) {
                if (f.get(10, TimeUnit.SECONDS)) wins++;
            }
            assertEquals(1, wins);
            assertEquals(2, store.headVersion(id));
            assertEquals(2, store.read(id).events().size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void payloadColumn_holdsPlainJson() {
        Tally t = tally(1);
        store.append(t.id(), Tally.KIND, 0, t.uncommittedEvents(), null);

        String payload = jdbc.queryForObject("SELECT payload FROM esf_events WHERE aggregate_id = ?", String.class, t.id());
        String kind = jdbc.queryForObject("SELECT event_kind FROM esf_events WHERE aggregate_id = ?", String.class, t.id());

        assertEquals("{\"amount\":1}", payload);
        assertEquals(Tally.ADDED, kind);
    }

    @Test
    void occurredAt_isStoredAsUtcWhateverTheJvmZone() {
        TimeZone original = TimeZone.getDefault();
        TimeZone.setDefault(TimeZone.getTimeZone("America/New_York"));
        try {
            Tally t = tally(1);
            store.append(t.id(), Tally.KIND, 0, t.uncommittedEvents(), null);

            OffsetDateTime stored = jdbc.queryForObject("SELECT occurred_at FROM esf_events WHERE aggregate_id = ?",
                    OffsetDateTime.class, t.id());

            assertEquals(ZoneOffset.UTC, stored.getOffset());
            assertEquals(CLOCK.instant(), stored.toInstant());
            assertEquals(CLOCK.instant(), store.read(t.id()).events().get(0).getOccurredAt());
        } finally {
            TimeZone.setDefault(original);
        }
    }

    @Test
    void driftedRow_isReportedAsFailure() {
        Tally t = tally(2);
        store.append(t.id(), Tally.KIND, 0, t.uncommittedEvents(), null);
        jdbc.update("INSERT INTO esf_events (id, aggregate_id, aggregate_kind, version, event_kind, payload, occurred_at) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                UUID.randomUUID(), t.id(), Tally.KIND, 3L, Tally.ADDED, "{\"amount\":\"many\"}",
                OffsetDateTime.ofInstant(CLOCK.instant(), ZoneOffset.UTC));

        EventStream stream = store.read(t.id());

        assertThat(stream.events()).hasSize(2);
        assertThat(stream.failures()).singleElement().satisfies(f -> assertEquals(3, f.version()));
    }

    private static Tally tally(int n) {
        Tally t = new Tally(UUID.randomUUID(), CLOCK);
        for (int i = 0; i < n; i++) t.add(1);
        return t;
    }
}
