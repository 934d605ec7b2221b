package com.splitttr.formcollab.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.splitttr.formcollab.websocket.BroadcastDispatcher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Captures every delivery instead of writing to a socket.
 */
public class RecordingDispatcher extends BroadcastDispatcher {

    public record Delivery(String connectionId, JsonNode message) {
        public String type() {
            return message.path("type").asText();
        }
    }

    private static final ObjectMapper mapper = new ObjectMapper();

    private final List<Delivery> deliveries = new CopyOnWriteArrayList<>();

    @Override
    protected void deliver(String connectionId, String json) {
        try {
            deliveries.add(new Delivery(connectionId, mapper.readTree(json)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    public List<Delivery> deliveries() {
        return List.copyOf(deliveries);
    }

    public List<Delivery> to(String connectionId) {
        return deliveries.stream().filter(d -> d.connectionId().equals(connectionId)).toList();
    }

    public List<String> typesTo(String connectionId) {
        return to(connectionId).stream().map(Delivery::type).toList();
    }

    public void clear() {
        deliveries.clear();
    }
}
