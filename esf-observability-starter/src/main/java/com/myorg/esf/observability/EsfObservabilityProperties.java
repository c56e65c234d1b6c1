package com.myorg.esf.observability;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "esf.observability")
public class EsfObservabilityProperties {
    private boolean enabled = true;

    private boolean mdcEnabled = true;
    private boolean metricsEnabled = true;

    // low-cardinality tags only, never eventId or aggregateId
    private boolean tagEventKind = true;
    private boolean tagOutcome = true;
}
