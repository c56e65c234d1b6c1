package com.myorg.esf.eventing;

import com.myorg.esf.contracts.core.codec.EventKindRegistry;
import com.myorg.esf.contracts.core.event.DomainEvent;
import com.myorg.esf.eventing.autoconfig.EsfEventingAutoConfiguration;
import com.myorg.esf.eventing.command.EventSourcingCommandHook;
import com.myorg.esf.eventing.support.Lamp;
import com.myorg.esf.eventstore.aggregate.AggregateDefinition;
import org.aopalliance.intercept.MethodInterceptor;
import org.junit.jupiter.api.Test;
import org.springframework.aop.framework.ProxyFactory;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Handler beans are often proxied (AOP, @Transactional, tracing). Scanning bean.getClass()
 * would miss annotations declared on the target class.
 */
class ProxySafeHandlerScanningTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(EsfEventingAutoConfiguration.class));

    @Test
    void shouldRegisterHandlerEvenWhenBeanIsProxied() {
        runner.withUserConfiguration(TestConfig.class)
                .run(ctx -> {
                    EventHandlerRegistry registry = ctx.getBean(EventHandlerRegistry.class);

                    assertThat(registry.handlersFor(Lamp.SWITCHED))
                            .as("handler for %s should be registered", Lamp.SWITCHED)
                            .extracting(EventHandlerRegistry.RegisteredHandler::name)
                            .containsExactly("LampHandler#onSwitched");
                });
    }

    @Test
    void proxiedHandlerIsInvokedThroughDispatcher() {
        runner.withUserConfiguration(TestConfig.class)
                .run(ctx -> {
                    Lamp lamp = new Lamp(UUID.randomUUID(), Clock.systemUTC());
                    lamp.toggle();

                    DispatchReport report = ctx.getBean(EsfDispatcher.class).dispatch(lamp.uncommittedEvents());

                    assertThat(report.allSucceeded()).isTrue();
                    assertThat(ctx.getBean(TestConfig.class).seen).containsExactly(true);
                });
    }

    @Test
    void definitionBeansFeedTheKindRegistry() {
        runner.withUserConfiguration(TestConfig.class)
                .run(ctx -> assertThat(ctx.getBean(EventKindRegistry.class).isKnown(Lamp.SWITCHED)).isTrue());
    }

    @Test
    void noEventStore_meansNoHook() {
        runner.withUserConfiguration(TestConfig.class)
                .run(ctx -> assertThat(ctx).doesNotHaveBean(EventSourcingCommandHook.class));
    }

    @Test
    void forwarderStaysOffByDefault() {
        runner.withUserConfiguration(TestConfig.class)
                .run(ctx -> assertThat(ctx).doesNotHaveBean("domainEventForwarder"));
    }

    @Configuration
    static class TestConfig {

        final List<Boolean> seen = new ArrayList<>();

        @Bean
        AggregateDefinition<Lamp> lampDefinition() {
            return Lamp.DEFINITION;
        }

        @Bean
        LampHandler lampHandler() {
            return new LampHandler(seen);
        }

        /**
         * Proxies LampHandler after init, the way production infrastructure would.
         */
        @Bean
        static BeanPostProcessor proxyingPostProcessor() {
            return new BeanPostProcessor() {
                @Override
                public Object postProcessAfterInitialization(Object bean, String beanName) {
                    if (bean instanceof LampHandler) {
                        ProxyFactory pf = new ProxyFactory(bean);
                        pf.setProxyTargetClass(true); // CGLIB proxy
                        pf.addAdvice((MethodInterceptor) invocation -> invocation.proceed());
                        return pf.getProxy();
                    }
                    return bean;
                }
            };
        }
    }

    @Component
    static class LampHandler {
        private final List<Boolean> seen;

        LampHandler(List<Boolean> seen) {
            this.seen = seen;
        }

        LampHandler() {
            this(new ArrayList<>());
        }

        @EsfEventHandler(value = Lamp.SWITCHED, payload = Lamp.Switched.class)
        public void onSwitched(DomainEvent event, Lamp.Switched payload) {
            seen.add(payload.isOn());
        }
    }
}
