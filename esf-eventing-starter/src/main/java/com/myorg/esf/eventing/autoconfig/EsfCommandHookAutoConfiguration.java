package com.myorg.esf.eventing.autoconfig;

import com.myorg.esf.eventing.EsfDispatcher;
import com.myorg.esf.eventing.command.AggregateCommitListener;
import com.myorg.esf.eventing.command.EventSourcingCommandHook;
import com.myorg.esf.eventstore.store.EventStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * The hook needs an {@link EventStore}, which a store starter or the application provides.
 */
@AutoConfiguration(
        after = EsfEventingAutoConfiguration.class,
        afterName = "com.myorg.esf.eventstore.jdbc.EsfEventStoreJdbcAutoConfiguration"
)
public class EsfCommandHookAutoConfiguration {

    @Bean
    @ConditionalOnBean(EventStore.class)
    @ConditionalOnMissingBean
    public EventSourcingCommandHook eventSourcingCommandHook(EventStore eventStore,
                                                             EsfDispatcher dispatcher,
                                                             ObjectProvider<AggregateCommitListener> listeners) {
        return new EventSourcingCommandHook(eventStore, dispatcher, listeners.orderedStream().toList());
    }
}
