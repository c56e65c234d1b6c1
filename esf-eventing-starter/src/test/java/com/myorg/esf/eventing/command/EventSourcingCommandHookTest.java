package com.myorg.esf.eventing.command;

import com.myorg.esf.contracts.core.event.DomainEvent;
import com.myorg.esf.contracts.core.exception.ConcurrencyConflictException;
import com.myorg.esf.eventing.DefaultEsfDispatcher;
import com.myorg.esf.eventing.EventHandlerRegistry;
import com.myorg.esf.eventing.support.Lamp;
import com.myorg.esf.eventstore.memory.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class EventSourcingCommandHookTest {

    private InMemoryEventStore store;
    private final List<DomainEvent> dispatched = new ArrayList<>();
    private final List<UUID> committed = new ArrayList<>();
    private EventSourcingCommandHook hook;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore(Lamp.codec());
        EventHandlerRegistry registry = new EventHandlerRegistry()
                .register(Lamp.SWITCHED, "recorder", dispatched::add)
                .register(Lamp.SWITCHED, "broken", e -> {
                    throw new IllegalStateException("handler failure");
                });
        hook = new EventSourcingCommandHook(store, new DefaultEsfDispatcher(registry),
                List.of(a -> committed.add(a.id())));
    }

    @Test
    void appendsDispatchesAndClears() {
        Lamp lamp = new Lamp(UUID.randomUUID(), Clock.systemUTC());
        lamp.toggle();
        lamp.toggle();
        List<DomainEvent> raised = lamp.uncommittedEvents();

        CommandOutcome<String> outcome = hook.afterCommand(CommandResult.of("done", lamp).actor("bob"));

        assertEquals("done", outcome.value());
        assertEquals(2, outcome.headVersion());
        assertEquals(2, outcome.committedEvents());
        assertThat(store.read(lamp.id()).events()).extracting(DomainEvent::getEventId)
                .containsExactlyElementsOf(raised.stream().map(DomainEvent::getEventId).toList());
        assertThat(store.read(lamp.id()).events().get(0).getActorId()).isEqualTo("bob");
        assertThat(dispatched).containsExactlyElementsOf(raised);
        assertThat(outcome.dispatch().failures()).hasSize(2);
        assertThat(lamp.uncommittedEvents()).isEmpty();
        assertThat(committed).containsExactly(lamp.id());
    }

    @Test
    void secondCommand_continuesFromCommittedVersion() {
        Lamp lamp = new Lamp(UUID.randomUUID(), Clock.systemUTC());
        lamp.toggle();
        hook.afterCommand(CommandResult.of(null, lamp));
        lamp.toggle();

        CommandOutcome<Void> outcome = hook.afterCommand(CommandResult.of(null, lamp));

        assertEquals(2, outcome.headVersion());
        assertEquals(2, store.headVersion(lamp.id()));
    }

    @Test
    void appendFailure_propagatesAndKeepsBuffer() {
        UUID id = UUID.randomUUID();
        Lamp winner = new Lamp(id, Clock.systemUTC());
        winner.toggle();
        hook.afterCommand(CommandResult.of(null, winner));
        dispatched.clear();
        committed.clear();

        Lamp stale = new Lamp(id, Clock.systemUTC());
        stale.toggle();

        assertThatThrownBy(() -> hook.afterCommand(CommandResult.of(null, stale)))
                .isInstanceOf(ConcurrencyConflictException.class);
        assertThat(stale.uncommittedEvents()).hasSize(1);
        assertThat(dispatched).isEmpty();
        assertThat(committed).isEmpty();
    }

    @Test
    void resultWithoutAggregate_touchesNothing() {
        CommandOutcome<Integer> outcome = hook.afterCommand(CommandResult.valueOnly(42));

        assertEquals(42, outcome.value());
        assertEquals(0, outcome.committedEvents());
        assertThat(dispatched).isEmpty();
        assertThat(committed).isEmpty();
    }

    @Test
    void aggregateWithoutNewEvents_isNotAppended() {
        Lamp lamp = new Lamp(UUID.randomUUID(), Clock.systemUTC());

        CommandOutcome<String> outcome = hook.afterCommand(CommandResult.of("noop", lamp));

        assertEquals(0, outcome.committedEvents());
        assertEquals(0, store.headVersion(lamp.id()));
        assertThat(committed).isEmpty();
    }
}
