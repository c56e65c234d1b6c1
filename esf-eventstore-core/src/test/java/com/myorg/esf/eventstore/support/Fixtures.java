package com.myorg.esf.eventstore.support;

import com.myorg.esf.contracts.core.codec.EventKindRegistry;
import com.myorg.esf.contracts.core.codec.EventPayloadCodec;
import com.myorg.esf.contracts.core.codec.JacksonEventPayloadCodec;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

public final class Fixtures {

    public static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private Fixtures() {
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static EventPayloadCodec codec() {
        EventKindRegistry kinds = new EventKindRegistry();
        Counter.DEFINITION.registerKinds(kinds);
        return new JacksonEventPayloadCodec(JacksonEventPayloadCodec.defaultMapper(), kinds);
    }

    /** A counter with {@code n} uncommitted increments of 1. */
    public static Counter counterWith(int n) {
        Counter c = new Counter(UUID.randomUUID(), fixedClock());
        for (int i = 0; i < n; i++) {
            c.increment(1);
        }
        return c;
    }
}
