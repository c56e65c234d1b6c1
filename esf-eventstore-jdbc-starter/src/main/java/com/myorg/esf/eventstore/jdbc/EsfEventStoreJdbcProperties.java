package com.myorg.esf.eventstore.jdbc;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "esf.eventstore")
public class EsfEventStoreJdbcProperties {

    private boolean enabled = true;
    private String eventsTable = "esf_events";
    private String snapshotsTable = "esf_snapshots";

    private Scheduler scheduler = new Scheduler();
    private Executor executor = new Executor();
    private Metrics metrics = new Metrics();

    @Data
    public static class Scheduler {
        // background snapshotting of aggregates that were not read recently
        private boolean enabled = true;
        private Duration initialDelay = Duration.ofSeconds(30);
        private Duration pollInterval = Duration.ofMinutes(5);
        private Duration cleanupInterval = Duration.ofHours(1);
    }

    @Data
    public static class Executor {
        // out-of-band snapshot checks after reads and commits
        private int corePoolSize = 1;
        private int maxPoolSize = 2;
        private int queueCapacity = 100;
    }

    @Data
    public static class Metrics {
        private boolean enabled = true;
    }
}
