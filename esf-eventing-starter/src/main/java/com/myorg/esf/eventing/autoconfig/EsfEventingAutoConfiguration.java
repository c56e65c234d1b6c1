package com.myorg.esf.eventing.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.esf.contracts.core.codec.EventKindRegistry;
import com.myorg.esf.contracts.core.codec.EventPayloadCodec;
import com.myorg.esf.contracts.core.codec.JacksonEventPayloadCodec;
import com.myorg.esf.eventing.DefaultEsfDispatcher;
import com.myorg.esf.eventing.EsfDispatcher;
import com.myorg.esf.eventing.EsfEventHandler;
import com.myorg.esf.eventing.EsfEventingProperties;
import com.myorg.esf.eventing.EventHandlerRegistry;
import com.myorg.esf.eventing.HandlerMethodInvoker;
import com.myorg.esf.eventing.forward.DomainEventForwarder;
import com.myorg.esf.eventstore.aggregate.AggregateDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.framework.AopProxyUtils;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.MethodIntrospector;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.core.env.Environment;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.ReflectionUtils;
import org.springframework.util.StringUtils;

import java.lang.reflect.Method;
import java.time.Clock;
import java.util.Map;

@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
        "org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration"
})
@EnableConfigurationProperties(EsfEventingProperties.class)
public class EsfEventingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock esfClock() {
        return Clock.systemUTC();
    }

    /** Kinds of every {@link AggregateDefinition} bean are registered up front. */
    @Bean
    @ConditionalOnMissingBean
    public EventKindRegistry eventKindRegistry(ObjectProvider<AggregateDefinition<?>> definitions) {
        EventKindRegistry registry = new EventKindRegistry();
        definitions.orderedStream().forEach(d -> {
            d.registerKinds(registry);
            log.info("Registered aggregateKind={} eventKinds={}", d.aggregateKind(), d.eventKinds());
        });
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public EventPayloadCodec eventPayloadCodec(ObjectProvider<ObjectMapper> mapper, EventKindRegistry kinds) {
        return new JacksonEventPayloadCodec(mapper.getIfAvailable(JacksonEventPayloadCodec::defaultMapper), kinds);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventHandlerRegistry eventHandlerRegistry() {
        return new EventHandlerRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public EsfDispatcher esfDispatcher(EventHandlerRegistry registry) {
        return new DefaultEsfDispatcher(registry);
    }

    /**
     * Registers {@link EsfEventHandler} methods once every singleton exists. Annotations are read
     * from the ultimate target class so proxied beans are found too.
     */
    @Bean
    @ConditionalOnMissingBean(name = "esfHandlerScanner")
    public SmartInitializingSingleton esfHandlerScanner(ApplicationContext ctx, EventHandlerRegistry registry) {
        return () -> {
            Map<String, Object> beans = ctx.getBeansWithAnnotation(Component.class);

            beans.values().forEach(bean -> {
                Class<?> targetClass = AopProxyUtils.ultimateTargetClass(bean);

                Map<Method, EsfEventHandler> methods = MethodIntrospector.selectMethods(
                        targetClass,
                        (MethodIntrospector.MetadataLookup<EsfEventHandler>) m ->
                                AnnotatedElementUtils.findMergedAnnotation(m, EsfEventHandler.class)
                );

                methods.forEach((method, ann) -> {
                    // invoke through the proxy so advice still applies
                    Method invocable = AopUtils.selectInvocableMethod(method, bean.getClass());
                    ReflectionUtils.makeAccessible(invocable);
                    String name = targetClass.getSimpleName() + "#" + method.getName();
                    registry.register(ann.value(), name, new HandlerMethodInvoker(bean, invocable, ann.payload()));
                    log.info("Registered handler {} for eventKind={}", name, ann.value());
                });
            });
        };
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(KafkaTemplate.class)
    @ConditionalOnProperty(prefix = "esf.eventing.forward", name = "enabled", havingValue = "true")
    static class ForwarderConfig {

        @Bean
        @ConditionalOnBean(KafkaTemplate.class)
        @ConditionalOnMissingBean
        public DomainEventForwarder domainEventForwarder(KafkaTemplate<String, Object> template,
                                                         ObjectProvider<ObjectMapper> mapper,
                                                         EsfEventingProperties props,
                                                         Environment env) {
            String producer = props.getProducerName();
            if (!StringUtils.hasText(producer)) {
                producer = env.getProperty("spring.application.name", "unknown-service");
            }
            EsfEventingProperties.Forward fwd = props.getForward();
            return new DomainEventForwarder(template, mapper.getIfAvailable(JacksonEventPayloadCodec::defaultMapper),
                    fwd.getTopic(), producer, fwd.getSendTimeout());
        }

        /** Subscribes the forwarder to every known kind after the definitions are in. */
        @Bean
        @ConditionalOnBean(DomainEventForwarder.class)
        public SmartInitializingSingleton esfForwarderRegistration(DomainEventForwarder forwarder,
                                                                   EventKindRegistry kinds,
                                                                   EventHandlerRegistry registry) {
            return () -> kinds.kinds().stream().sorted().forEach(kind ->
                    registry.register(kind, DomainEventForwarder.HANDLER_NAME, forwarder));
        }
    }
}
