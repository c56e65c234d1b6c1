package com.myorg.esf.contracts.core.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.*;

/**
 * Wire shape of a committed domain event when it leaves the process (integration events).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventEnvelope {
    private String eventId;        // UUID
    private String eventKind;      // e.g. "rpg.character.created.v1"
    private long version;          // aggregate version produced by the event

    private String aggregateId;
    private String aggregateKind;  // e.g. "rpg.character"
    private String correlationId;  // defaults to aggregateId

    private long occurredAtMs;     // epoch millis
    private String producer;       // service name (optional)
    private String actorId;        // optional

    private JsonNode payload;
}
