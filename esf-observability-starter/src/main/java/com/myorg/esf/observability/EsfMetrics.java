package com.myorg.esf.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;

import java.util.Collection;

@RequiredArgsConstructor
public class EsfMetrics {

    public static final String HANDLER_SUCCESS = "esf.dispatch.handler.success";
    public static final String HANDLER_FAIL = "esf.dispatch.handler.fail";
    public static final String PROCESSING = "esf.dispatch.processing";

    private final MeterRegistry registry;
    private final String serviceName;
    private final EsfObservabilityProperties props;

    private Counter cHandlerSuccess;
    private Counter cHandlerFail;

    /**
     * Call once on startup, so /actuator/metrics/&lt;name&gt; answers before the first dispatch.
     * The timer is registered per known event kind to keep one tag-key set per meter name.
     */
    public void preRegisterBaseMeters(Collection<String> eventKinds) {
        cHandlerSuccess = Counter.builder(HANDLER_SUCCESS).tag("service", serviceName).register(registry);
        cHandlerFail = Counter.builder(HANDLER_FAIL).tag("service", serviceName).register(registry);

        for (String kind : eventKinds) {
            timer(kind, "success");
            timer(kind, "fail");
        }
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopTimer(Timer.Sample sample, String eventKind, String outcome) {
        if (sample == null) return;
        sample.stop(timer(eventKind, outcome));
    }

    public void incHandlerSuccess(int n) {
        if (n > 0) successCounter().increment(n);
    }

    public void incHandlerFail(int n) {
        if (n > 0) failCounter().increment(n);
    }

    private Timer timer(String eventKind, String outcome) {
        Timer.Builder b = Timer.builder(PROCESSING).tag("service", serviceName);
        if (props.isTagOutcome()) b.tag("outcome", outcome);
        if (props.isTagEventKind()) b.tag("eventKind", eventKind == null ? "unknown" : eventKind);
        return b.register(registry);
    }

    private Counter successCounter() {
        if (cHandlerSuccess == null) {
            cHandlerSuccess = Counter.builder(HANDLER_SUCCESS).tag("service", serviceName).register(registry);
        }
        return cHandlerSuccess;
    }

    private Counter failCounter() {
        if (cHandlerFail == null) {
            cHandlerFail = Counter.builder(HANDLER_FAIL).tag("service", serviceName).register(registry);
        }
        return cHandlerFail;
    }
}
