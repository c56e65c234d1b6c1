package com.myorg.esf.eventstore.jdbc;

import com.myorg.esf.contracts.core.codec.EventPayloadCodec;
import com.myorg.esf.eventing.autoconfig.EsfEventingAutoConfiguration;
import com.myorg.esf.eventing.command.AggregateCommitListener;
import com.myorg.esf.eventstore.EventSourcingRuntime;
import com.myorg.esf.eventstore.aggregate.AggregateDefinition;
import com.myorg.esf.eventstore.snapshot.DefaultSnapshotStrategy;
import com.myorg.esf.eventstore.snapshot.SnapshotProperties;
import com.myorg.esf.eventstore.snapshot.SnapshotService;
import com.myorg.esf.eventstore.snapshot.SnapshotStore;
import com.myorg.esf.eventstore.snapshot.SnapshotStrategy;
import com.myorg.esf.eventstore.store.EventStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.autoconfigure.task.TaskExecutionAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;

@AutoConfiguration(after = {
        DataSourceAutoConfiguration.class,
        JdbcTemplateAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        FlywayAutoConfiguration.class,
        TaskExecutionAutoConfiguration.class,
        EsfEventingAutoConfiguration.class
})
@EnableConfigurationProperties(EsfEventStoreJdbcProperties.class)
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnProperty(prefix = "esf.eventstore", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EsfEventStoreJdbcAutoConfiguration {

    @Bean
    @ConfigurationProperties(prefix = "esf.snapshot")
    @ConditionalOnMissingBean
    public SnapshotProperties esfSnapshotProperties() {
        return new SnapshotProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    public SnapshotStrategy esfSnapshotStrategy(SnapshotProperties props, Clock clock) {
        return new DefaultSnapshotStrategy(props, clock);
    }

    @Bean
    @ConditionalOnMissingBean(name = "esfTxTemplate")
    public TransactionTemplate esfTxTemplate(PlatformTransactionManager txManager) {
        return new TransactionTemplate(txManager);
    }

    @Bean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "esf.eventstore.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    public EventStoreMetrics esfEventStoreMetrics(MeterRegistry registry,
                                                  ObjectProvider<AggregateDefinition<?>> definitions) {
        EventStoreMetrics m = new EventStoreMetrics(registry);
        m.preRegister(definitions.orderedStream().map(AggregateDefinition::aggregateKind).toList());
        return m;
    }

    @Bean
    @ConditionalOnBean(JdbcTemplate.class)
    @ConditionalOnMissingBean(EventStore.class)
    public JdbcEventStore jdbcEventStore(JdbcTemplate jdbc,
                                         @Qualifier("esfTxTemplate") TransactionTemplate esfTxTemplate,
                                         EventPayloadCodec codec,
                                         EsfEventStoreJdbcProperties props,
                                         ObjectProvider<EventStoreMetrics> metrics) {
        return new JdbcEventStore(jdbc, esfTxTemplate, codec, props, metrics.getIfAvailable());
    }

    @Bean
    @ConditionalOnBean(JdbcTemplate.class)
    @ConditionalOnMissingBean(SnapshotStore.class)
    public JdbcSnapshotStore jdbcSnapshotStore(JdbcTemplate jdbc, EsfEventStoreJdbcProperties props) {
        return new JdbcSnapshotStore(jdbc, props);
    }

    @Bean(name = "esfSnapshotExecutor")
    @ConditionalOnMissingBean(name = "esfSnapshotExecutor")
    public ThreadPoolTaskExecutor esfSnapshotExecutor(EsfEventStoreJdbcProperties props) {
        EsfEventStoreJdbcProperties.Executor cfg = props.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getCorePoolSize());
        executor.setMaxPoolSize(cfg.getMaxPoolSize());
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setThreadNamePrefix("esf-snapshot-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    /** Binds every {@link AggregateDefinition} bean to the stores. */
    @Bean
    @ConditionalOnBean(EventStore.class)
    @ConditionalOnMissingBean
    public EventSourcingRuntime eventSourcingRuntime(EventStore eventStore,
                                                     ObjectProvider<SnapshotStore> snapshotStore,
                                                     EventPayloadCodec codec,
                                                     SnapshotStrategy strategy,
                                                     SnapshotProperties snapshotProperties,
                                                     Clock clock,
                                                     @Qualifier("esfSnapshotExecutor") ThreadPoolTaskExecutor esfSnapshotExecutor,
                                                     ObjectProvider<EventStoreMetrics> metrics,
                                                     ObjectProvider<AggregateDefinition<?>> definitions) {
        EventStoreMetrics m = metrics.getIfAvailable();
        List<SnapshotService.SnapshotListener> listeners = m == null ? List.of() : List.of(m);

        EventSourcingRuntime runtime = EventSourcingRuntime.builder()
                .eventStore(eventStore)
                .snapshotStore(snapshotStore.getIfAvailable())
                .codec(codec)
                .strategy(strategy)
                .snapshotProperties(snapshotProperties)
                .clock(clock)
                .snapshotExecutor(esfSnapshotExecutor)
                .snapshotListeners(listeners)
                .build();
        definitions.orderedStream().forEach(runtime::repository);
        return runtime;
    }

    /** After a commit, schedules an out-of-band snapshot check for the aggregate. */
    @Bean
    @ConditionalOnBean(EventSourcingRuntime.class)
    public AggregateCommitListener esfSnapshotOnCommit(EventSourcingRuntime runtime) {
        return aggregate -> runtime.snapshots(aggregate.aggregateKind())
                .ifPresent(s -> s.scheduleCheck(aggregate.id()));
    }

    @Bean(name = "esfSnapshotSchedule")
    public EsfScheduleValues esfSnapshotSchedule(EsfEventStoreJdbcProperties props) {
        return new EsfScheduleValues(props);
    }

    @Bean
    @ConditionalOnBean(EventSourcingRuntime.class)
    @ConditionalOnProperty(prefix = "esf.eventstore.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SnapshotScheduler esfSnapshotScheduler(EventSourcingRuntime runtime, EsfEventStoreJdbcProperties props) {
        return new SnapshotScheduler(runtime, props);
    }

    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(prefix = "esf.eventstore.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class SchedulingConfig {}
}
