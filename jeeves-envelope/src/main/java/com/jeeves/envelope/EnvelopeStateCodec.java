package com.jeeves.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * JSON form of the envelope state dict. Null-valued keys are written explicitly so that every
 * field of the state shape is present in the document.
 */
public final class EnvelopeStateCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> STATE_TYPE = new TypeReference<>() {};

    private EnvelopeStateCodec() {
    }

    /**
     * Serializes {@link Envelope#toStateDict()} to JSON.
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(Envelope envelope) {
        return stateToJson(envelope.toStateDict());
    }

    /** Serializes an already built state dict. */
    public static String stateToJson(Map<String, ?> state) {
        try {
            return MAPPER.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Parses a JSON document into a generic state dict. */
    public static Map<String, Object> stateFromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new EnvelopeStateException("state JSON is empty");
        }
        try {
            return MAPPER.readValue(json, STATE_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parses JSON produced by {@link #toJson} back into an envelope.
     *
     * @throws UncheckedIOException when the text is not JSON
     * @throws EnvelopeStateException when the JSON does not have the state shape
     */
    public static Envelope fromJson(String json) {
        return Envelope.fromStateDict(stateFromJson(json));
    }
}
