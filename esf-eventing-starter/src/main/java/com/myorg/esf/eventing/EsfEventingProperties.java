package com.myorg.esf.eventing;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "esf.eventing")
public class EsfEventingProperties {
    // empty -> spring.application.name
    private String producerName;

    private Forward forward = new Forward();

    @Data
    public static class Forward {
        // publish every committed event to Kafka as an EventEnvelope
        private boolean enabled = false;
        private String topic = "esf.domain-events";
        private Duration sendTimeout = Duration.ofSeconds(10);
    }
}
