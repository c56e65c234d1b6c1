package com.myorg.esf.eventing;

import com.myorg.esf.contracts.core.event.DomainEvent;
import com.myorg.esf.eventing.support.Lamp;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultEsfDispatcherTest {

    private final EventHandlerRegistry registry = new EventHandlerRegistry();
    private final DefaultEsfDispatcher dispatcher = new DefaultEsfDispatcher(registry);

    @Test
    void failingHandler_doesNotStopTheOthers() {
        List<Long> seenByB = new ArrayList<>();
        registry.register(Lamp.SWITCHED, "A", e -> {
            throw new IllegalStateException("boom");
        });
        registry.register(Lamp.SWITCHED, "B", e -> seenByB.add(e.getVersion()));

        DispatchReport report = dispatcher.dispatch(events(2));

        assertThat(seenByB).containsExactly(1L, 2L);
        assertEquals(2, report.getEventsProcessed());
        assertThat(report.getOutcomes()).hasSize(4);
        assertThat(report.failures()).extracting(HandlerOutcome::getHandlerName).containsExactly("A", "A");
        assertThat(report.failures().get(0).getError()).hasMessage("boom");
        assertFalse(report.allSucceeded());
    }

    @Test
    void handlersRunInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        registry.register(Lamp.SWITCHED, "first", e -> calls.add("first"));
        registry.register(Lamp.SWITCHED, "second", e -> calls.add("second"));
        registry.register(Lamp.SWITCHED, "third", e -> calls.add("third"));

        DispatchReport report = dispatcher.dispatch(events(1));

        assertThat(calls).containsExactly("first", "second", "third");
        assertTrue(report.allSucceeded());
    }

    @Test
    void eventWithoutHandlers_isCountedButHasNoOutcome() {
        DispatchReport report = dispatcher.dispatch(events(3));

        assertEquals(3, report.getEventsProcessed());
        assertThat(report.getOutcomes()).isEmpty();
        assertTrue(report.allSucceeded());
    }

    @Test
    void interruptedHandler_failsButBatchGoesOn() {
        List<Long> seen = new ArrayList<>();
        registry.register(Lamp.SWITCHED, "interrupting", e -> {
            seen.add(e.getVersion());
            throw new InterruptedException("send aborted");
        });

        try {
            DispatchReport report = dispatcher.dispatch(events(3));

            assertThat(seen).containsExactly(1L, 2L, 3L);
            assertFalse(report.isInterrupted());
            assertEquals(3, report.getEventsProcessed());
            assertThat(report.failures()).hasSize(3);
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void callerInterrupt_stopsRemainingEvents() {
        List<Long> seen = new ArrayList<>();
        registry.register(Lamp.SWITCHED, "recording", e -> seen.add(e.getVersion()));

        Thread.currentThread().interrupt();
        try {
            DispatchReport report = dispatcher.dispatch(events(3));

            assertThat(seen).isEmpty();
            assertTrue(report.isInterrupted());
            assertEquals(0, report.getEventsProcessed());
        } finally {
            Thread.interrupted();
        }
    }

    private static List<DomainEvent> events(int n) {
        Lamp lamp = new Lamp(UUID.randomUUID(), Clock.systemUTC());
        for (int i = 0; i < n; i++) lamp.toggle();
        return lamp.uncommittedEvents();
    }
}
