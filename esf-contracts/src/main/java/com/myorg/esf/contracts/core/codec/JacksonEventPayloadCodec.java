package com.myorg.esf.contracts.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.myorg.esf.contracts.core.exception.EventSerializationException;

public class JacksonEventPayloadCodec implements EventPayloadCodec {

    private final ObjectMapper mapper;
    private final EventKindRegistry kinds;

    public JacksonEventPayloadCodec(ObjectMapper mapper, EventKindRegistry kinds) {
        this.mapper = mapper;
        this.kinds = kinds;
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public String encodePayload(String eventKind, Object payload) {
        Class<?> expected = kinds.payloadType(eventKind);
        if (payload != null && !expected.isInstance(payload)) {
            throw new EventSerializationException("Payload " + payload.getClass().getName()
                    + " does not match eventKind=" + eventKind + " (" + expected.getName() + ")");
        }
        return write(payload, "payload of eventKind=" + eventKind);
    }

    @Override
    public Object decodePayload(String eventKind, String serialized) {
        Class<?> type = kinds.payloadType(eventKind);
        try {
            return mapper.readValue(serialized, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException(
                    "Cannot decode payload of eventKind=" + eventKind + " into " + type.getSimpleName(), e);
        }
    }

    @Override
    public String encodeState(Object state) {
        return write(state, "snapshot state " + (state == null ? "null" : state.getClass().getSimpleName()));
    }

    @Override
    public <T> T decodeState(String serialized, Class<T> stateType) {
        try {
            return mapper.readValue(serialized, stateType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException("Cannot decode snapshot state into " + stateType.getSimpleName(), e);
        }
    }

    private String write(Object value, String what) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize " + what, e);
        }
    }
}
