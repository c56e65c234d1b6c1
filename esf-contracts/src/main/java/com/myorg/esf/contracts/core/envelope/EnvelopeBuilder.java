package com.myorg.esf.contracts.core.envelope;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.esf.contracts.core.event.DomainEvent;
import lombok.experimental.UtilityClass;

@UtilityClass
public class EnvelopeBuilder {

    public static EventEnvelope wrap(ObjectMapper mapper,
                                     DomainEvent event,
                                     String aggregateKind,
                                     String producer) {
        String aggregateId = event.getAggregateId().toString();
        return EventEnvelope.builder()
                .eventId(event.getEventId().toString())
                .eventKind(event.getEventKind())
                .version(event.getVersion())
                .aggregateId(aggregateId)
                .aggregateKind(aggregateKind)
                .correlationId(aggregateId)
                .occurredAtMs(event.getOccurredAt().toEpochMilli())
                .producer(producer)
                .actorId(event.getActorId())
                .payload(mapper.valueToTree(event.getPayload()))
                .build();
    }
}
