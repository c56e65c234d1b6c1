package com.myorg.esf.observability;

import com.myorg.esf.eventing.EsfDispatcher;
import com.myorg.esf.eventing.autoconfig.EsfEventingAutoConfiguration;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class EsfObservabilityAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    JacksonAutoConfiguration.class,
                    EsfEventingAutoConfiguration.class,
                    EsfObservabilityAutoConfiguration.class))
            .withUserConfiguration(MetricsConfig.class)
            .withPropertyValues("spring.application.name=observed");

    @Configuration
    static class MetricsConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Test
    void dispatcherIsWrapped_andBaseMetersExistBeforeFirstDispatch() {
        runner.run(ctx -> {
            assertThat(ctx.getBean(EsfDispatcher.class)).isInstanceOf(ObservingEsfDispatcher.class);

            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertThat(registry.find(EsfMetrics.HANDLER_SUCCESS).tag("service", "observed").counter()).isNotNull();
            assertThat(registry.find(EsfMetrics.HANDLER_FAIL).tag("service", "observed").counter()).isNotNull();
        });
    }

    @Test
    void disabled_leavesDispatcherAlone() {
        runner.withPropertyValues("esf.observability.enabled=false")
                .run(ctx -> assertThat(ctx.getBean(EsfDispatcher.class)).isNotInstanceOf(ObservingEsfDispatcher.class));
    }
}
