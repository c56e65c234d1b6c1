package com.myorg.esf.eventing.forward;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.esf.contracts.core.conventions.CoreHeaders;
import com.myorg.esf.contracts.core.conventions.EventKindFormat;
import com.myorg.esf.contracts.core.envelope.EnvelopeBuilder;
import com.myorg.esf.contracts.core.envelope.EventEnvelope;
import com.myorg.esf.contracts.core.event.DomainEvent;
import com.myorg.esf.eventing.EventHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;

import org.springframework.kafka.core.KafkaTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Publishes committed events as integration events. Registered as an ordinary handler, so a
 * broker failure shows up in the dispatch report like any other handler failure.
 */
@Slf4j
@RequiredArgsConstructor
public class DomainEventForwarder implements EventHandler {

    public static final String HANDLER_NAME = "esf.kafka-forwarder";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final ObjectMapper mapper;
    private final String topic;
    private final String producerName;
    private final Duration sendTimeout;

    @Override
    public void handle(DomainEvent event) throws Exception {
        EventEnvelope env = EnvelopeBuilder.wrap(mapper, event,
                EventKindFormat.aggregateKindOf(event.getEventKind()), producerName);

        ProducerRecord<String, Object> record = new ProducerRecord<>(topic, env.getAggregateId(), env);
        record.headers().add(header(CoreHeaders.EVENT_ID, env.getEventId()));
        record.headers().add(header(CoreHeaders.EVENT_KIND, env.getEventKind()));
        record.headers().add(header(CoreHeaders.AGGREGATE_ID, env.getAggregateId()));
        record.headers().add(header(CoreHeaders.AGGREGATE_VERSION, String.valueOf(env.getVersion())));
        record.headers().add(header(CoreHeaders.CORRELATION_ID, env.getCorrelationId()));

        kafkaTemplate.send(record).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Forwarded eventKind={} eventId={} to topic={}", env.getEventKind(), env.getEventId(), topic);
    }

    private static RecordHeader header(String name, String value) {
        return new RecordHeader(name, value.getBytes(StandardCharsets.UTF_8));
    }
}
