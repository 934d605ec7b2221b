package com.splitttr.formcollab.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.splitttr.formcollab.error.InvalidMessageException;

/**
 * JSON text-frame encoding shared by the socket endpoint and the dispatcher.
 */
public final class MessageCodec {

    private static final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private MessageCodec() {
    }

    public static ClientMessage decode(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidMessageException("Empty message");
        }
        try {
            return mapper.readValue(json, ClientMessage.class);
        } catch (JsonProcessingException e) {
            throw new InvalidMessageException("Malformed message: " + e.getOriginalMessage(), e);
        }
    }

    public static String encode(ServerMessage message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + message.type() + " message", e);
        }
    }
}
