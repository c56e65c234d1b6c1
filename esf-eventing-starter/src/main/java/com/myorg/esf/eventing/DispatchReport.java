package com.myorg.esf.eventing;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * What happened to each handler invocation of one dispatch call.
 */
@Value
public class DispatchReport {
    List<HandlerOutcome> outcomes;
    int eventsProcessed;
    boolean interrupted;

    public static DispatchReport empty() {
        return new DispatchReport(List.of(), 0, false);
    }

    public List<HandlerOutcome> failures() {
        return outcomes.stream().filter(o -> !o.isSuccess()).toList();
    }

    public boolean allSucceeded() {
        return !interrupted && failures().isEmpty();
    }

    public DispatchReport merge(DispatchReport other) {
        List<HandlerOutcome> all = new ArrayList<>(outcomes);
        all.addAll(other.outcomes);
        return new DispatchReport(List.copyOf(all), eventsProcessed + other.eventsProcessed,
                interrupted || other.interrupted);
    }
}
