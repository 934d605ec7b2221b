package com.splitttr.formcollab.websocket;

import com.splitttr.formcollab.error.CollaborationException;
import com.splitttr.formcollab.error.UnauthenticatedException;
import com.splitttr.formcollab.message.ServerMessage;
import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.OnClose;
import io.quarkus.websockets.next.OnError;
import io.quarkus.websockets.next.OnOpen;
import io.quarkus.websockets.next.OnTextMessage;
import io.quarkus.websockets.next.WebSocket;
import io.quarkus.websockets.next.WebSocketConnection;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * WebSocket endpoint for collaborative form editing. The access token comes
 * from the {@code Authorization} header or, for browsers, the
 * {@code access_token} query parameter.
 */
@WebSocket(path = "/ws/forms")
public class CollaborationSocket {

    private static final Logger log = LoggerFactory.getLogger(CollaborationSocket.class);
    private static final int POLICY_VIOLATION = 1008;

    @Inject
    ConnectionGateway gateway;

    @Inject
    BroadcastDispatcher dispatcher;

    @OnOpen
    public void onOpen(WebSocketConnection connection) {
        var handshake = connection.handshakeRequest();
        String token = extractToken(handshake.header("Authorization"), handshake.query());
        try {
            gateway.authenticate(connection.id(), token);
            dispatcher.register(connection);
        } catch (UnauthenticatedException e) {
            log.warn("Refused connection {}: {}", connection.id(), e.getMessage());
            connection.closeAndAwait(new CloseReason(POLICY_VIOLATION, e.getMessage()));
        }
    }

    @OnTextMessage
    public void onMessage(String messageJson, WebSocketConnection connection) {
        try {
            gateway.dispatch(connection.id(), messageJson);
        } catch (UnauthenticatedException e) {
            log.warn("Closing connection {}: {}", connection.id(), e.getMessage());
            gateway.disconnect(connection.id());
            dispatcher.unregister(connection.id());
            connection.closeAndAwait(new CloseReason(POLICY_VIOLATION, e.getMessage()));
        } catch (CollaborationException e) {
            dispatcher.send(connection.id(), ServerMessage.error(e.code(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Failed to handle message on connection {}", connection.id(), e);
            dispatcher.send(connection.id(), ServerMessage.error("internal_error", "Message could not be processed"));
        }
    }

    @OnClose
    public void onClose(WebSocketConnection connection) {
        gateway.disconnect(connection.id());
        dispatcher.unregister(connection.id());
    }

    @OnError
    public void onError(WebSocketConnection connection, Throwable t) {
        log.warn("WebSocket error on {}: {}", connection.id(), t.getMessage());
        gateway.disconnect(connection.id());
        dispatcher.unregister(connection.id());
    }

    static String extractToken(String authorizationHeader, String query) {
        if (authorizationHeader != null && !authorizationHeader.isBlank()) {
            return authorizationHeader;
        }
        if (query == null || query.isBlank()) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0 && pair.substring(0, eq).equals("access_token")) {
                return URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
