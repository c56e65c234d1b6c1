package com.myorg.esf.contracts.core.codec;

/**
 * Encodes event payloads and aggregate snapshot state to their stored text form and back.
 */
public interface EventPayloadCodec {

    String encodePayload(String eventKind, Object payload);

    /**
     * @throws com.myorg.esf.contracts.core.exception.EventSerializationException if the text does not fit the kind
     * @throws com.myorg.esf.contracts.core.exception.UnknownEventKindException if the kind is not registered
     */
    Object decodePayload(String eventKind, String serialized);

    String encodeState(Object state);

    <T> T decodeState(String serialized, Class<T> stateType);
}
