package com.myorg.esf.observability;

import com.myorg.esf.contracts.core.event.DomainEvent;
import com.myorg.esf.eventing.DispatchReport;
import com.myorg.esf.eventing.EsfDispatcher;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Dispatches one event at a time so each handler runs with that event's MDC, and counts
 * handler outcomes.
 */
@RequiredArgsConstructor
public class ObservingEsfDispatcher implements EsfDispatcher {

    private final EsfDispatcher delegate;
    private final EsfObservabilityProperties props;
    private final EsfMetrics metrics; // can be null if metrics disabled

    @Override
    public DispatchReport dispatch(List<DomainEvent> events) {
        DispatchReport report = DispatchReport.empty();
        boolean handlerInterrupted = false;
        try {
            for (DomainEvent event : events) {
                DispatchReport one = dispatchOne(event);
                report = report.merge(one);
                if (one.isInterrupted()) {
                    return new DispatchReport(report.getOutcomes(), report.getEventsProcessed(), true);
                }
                // a handler's own interrupt must not cancel the next event
                if (interruptedByHandler(one)) {
                    Thread.interrupted();
                    handlerInterrupted = true;
                }
            }
            return report;
        } finally {
            if (handlerInterrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static boolean interruptedByHandler(DispatchReport report) {
        return report.getOutcomes().stream().anyMatch(o -> o.getError() instanceof InterruptedException);
    }

    private DispatchReport dispatchOne(DomainEvent event) {
        boolean observe = metrics != null && props.isMetricsEnabled();
        if (props.isMdcEnabled()) {
            EsfMdc.put(event);
        }
        Timer.Sample sample = observe ? metrics.startTimer() : null;

        try {
            DispatchReport report = delegate.dispatch(List.of(event));
            if (observe) {
                int failed = report.failures().size();
                metrics.incHandlerFail(failed);
                metrics.incHandlerSuccess(report.getOutcomes().size() - failed);
                metrics.stopTimer(sample, event.getEventKind(), failed == 0 ? "success" : "fail");
            }
            return report;
        } catch (RuntimeException e) {
            if (observe) {
                metrics.stopTimer(sample, event.getEventKind(), "fail");
            }
            throw e;
        } finally {
            if (props.isMdcEnabled()) {
                EsfMdc.clear();
            }
        }
    }
}
