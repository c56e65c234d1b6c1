package com.myorg.esf.observability;

import com.myorg.esf.contracts.core.codec.EventKindRegistry;
import com.myorg.esf.eventing.EsfDispatcher;
import com.myorg.esf.eventing.autoconfig.EsfEventingAutoConfiguration;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import java.util.List;

@AutoConfiguration(
        after = EsfEventingAutoConfiguration.class,
        afterName = {
                "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
                "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
        })
@ConditionalOnClass(EsfDispatcher.class)
@EnableConfigurationProperties(EsfObservabilityProperties.class)
public class EsfObservabilityAutoConfiguration {

    @Bean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    public EsfMetrics esfMetrics(MeterRegistry registry, Environment env, EsfObservabilityProperties props) {
        String app = env.getProperty("spring.application.name", "unknown-service");
        return new EsfMetrics(registry, app, props);
    }

    @Bean
    public SmartLifecycle esfMetricsPreRegisterLifecycle(
            EsfObservabilityProperties props,
            ObjectProvider<EsfMetrics> metricsProvider,
            ObjectProvider<EventKindRegistry> kinds
    ) {
        return new SmartLifecycle() {
            private boolean running = false;

            @Override public void start() {
                EsfMetrics m = metricsProvider.getIfAvailable();
                if (props.isEnabled() && props.isMetricsEnabled() && m != null) {
                    EventKindRegistry registry = kinds.getIfAvailable();
                    m.preRegisterBaseMeters(registry == null ? List.of() : registry.kinds());
                }
                running = true;
            }

            @Override public void stop() { running = false; }
            @Override public boolean isRunning() { return running; }
            @Override public int getPhase() { return Integer.MIN_VALUE; }
        };
    }

    /** Wraps every {@link EsfDispatcher} bean, so the command hook dispatches through it. */
    @Bean
    public static BeanPostProcessor observingEsfDispatcherBpp(
            ObjectProvider<EsfObservabilityProperties> propsProvider,
            ObjectProvider<EsfMetrics> metricsProvider
    ) {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (!(bean instanceof EsfDispatcher dispatcher)) return bean;
                if (bean instanceof ObservingEsfDispatcher) return bean;

                EsfObservabilityProperties props = propsProvider.getObject();
                if (!props.isEnabled()) return bean;
                return new ObservingEsfDispatcher(dispatcher, props, metricsProvider.getIfAvailable());
            }
        };
    }
}
