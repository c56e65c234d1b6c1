package com.myorg.esf.eventstore.jdbc;

import com.myorg.esf.eventstore.EventSourcingRuntime;
import com.myorg.esf.eventstore.snapshot.SnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodic snapshotting of aggregates that reached a threshold without being read, plus
 * retention cleanup. Each loop covers every bound aggregate kind.
 */
@Slf4j
@RequiredArgsConstructor
public class SnapshotScheduler {

    private final EventSourcingRuntime runtime;
    private final EsfEventStoreJdbcProperties props;

    @Scheduled(
            initialDelayString = "#{@esfSnapshotSchedule.initialDelayMs}",
            fixedDelayString = "#{@esfSnapshotSchedule.pollIntervalMs}"
    )
    public void scheduledLoop() {
        if (!props.getScheduler().isEnabled()) return;
        runOnce();
    }

    @Scheduled(
            initialDelayString = "#{@esfSnapshotSchedule.initialDelayMs}",
            fixedDelayString = "#{@esfSnapshotSchedule.cleanupIntervalMs}"
    )
    public void scheduledCleanup() {
        if (!props.getScheduler().isEnabled()) return;
        cleanupOnce();
    }

    /** @return snapshots created across all kinds */
    public int runOnce() {
        int created = 0;
        for (SnapshotService<?> service : runtime.snapshotServices()) {
            if (Thread.currentThread().isInterrupted()) break;
            try {
                created += service.processPending();
            } catch (RuntimeException e) {
                log.error("Pending snapshot run failed aggregateKind={}", service.aggregateKind(), e);
            }
        }
        return created;
    }

    public int cleanupOnce() {
        int deleted = 0;
        for (SnapshotService<?> service : runtime.snapshotServices()) {
            try {
                deleted += service.cleanup();
            } catch (RuntimeException e) {
                log.error("Snapshot cleanup failed aggregateKind={}", service.aggregateKind(), e);
            }
        }
        return deleted;
    }
}
