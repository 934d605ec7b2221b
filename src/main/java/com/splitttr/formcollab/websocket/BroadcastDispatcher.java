package com.splitttr.formcollab.websocket;

import com.splitttr.formcollab.message.MessageCodec;
import com.splitttr.formcollab.message.ServerMessage;
import io.quarkus.websockets.next.WebSocketConnection;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes server messages to open connections. Sends are asynchronous and
 * independent per recipient: a failed send is logged and never retried,
 * and never holds up the other recipients or the calling room.
 */
@ApplicationScoped
public class BroadcastDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BroadcastDispatcher.class);

    private final ConcurrentHashMap<String, WebSocketConnection> connections = new ConcurrentHashMap<>();

    public void register(WebSocketConnection connection) {
        connections.put(connection.id(), connection);
    }

    public void unregister(String connectionId) {
        connections.remove(connectionId);
    }

    /**
     * Sends {@code message} to every recipient except {@code excludeConnectionId} (may be null).
     */
    public void broadcast(Collection<String> recipients, ServerMessage message, String excludeConnectionId) {
        String json = MessageCodec.encode(message);
        for (String recipient : recipients) {
            if (!Objects.equals(recipient, excludeConnectionId)) {
                deliver(recipient, json);
            }
        }
    }

    public void send(String connectionId, ServerMessage message) {
        deliver(connectionId, MessageCodec.encode(message));
    }

    protected void deliver(String connectionId, String json) {
        WebSocketConnection connection = connections.get(connectionId);
        if (connection == null || !connection.isOpen()) {
            log.debug("Skipping send to closed connection {}", connectionId);
            return;
        }
        try {
            connection.sendText(json).subscribe().with(
                ignored -> { },
                failure -> log.warn("Send to connection {} failed: {}", connectionId, failure.getMessage())
            );
        } catch (RuntimeException e) {
            log.warn("Send to connection {} failed: {}", connectionId, e.getMessage());
        }
    }
}
