package com.splitttr.formcollab.websocket;

import com.splitttr.formcollab.error.InvalidMessageException;
import com.splitttr.formcollab.error.NotInRoomException;
import com.splitttr.formcollab.error.UnauthenticatedException;
import com.splitttr.formcollab.message.ClientMessage;
import com.splitttr.formcollab.message.MessageCodec;
import com.splitttr.formcollab.security.AuthService;
import com.splitttr.formcollab.security.Identity;
import com.splitttr.formcollab.session.LeaveReason;
import com.splitttr.formcollab.session.RoomRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Binds verified identities to connections and routes their messages to the
 * room registry. Identity always comes from the token, never from the message.
 */
@ApplicationScoped
public class ConnectionGateway {

    private static final Logger log = LoggerFactory.getLogger(ConnectionGateway.class);

    record ConnectionState(Identity identity, Set<String> documents) {}

    private final ConcurrentHashMap<String, ConnectionState> connections = new ConcurrentHashMap<>();

    @Inject
    AuthService authService;

    @Inject
    RoomRegistry roomRegistry;

    @Inject
    Clock clock;

    /**
     * Verifies the token and binds the identity to the connection. Nothing is
     * recorded when verification fails.
     */
    public Identity authenticate(String connectionId, String rawToken) {
        Identity identity = authService.authenticate(rawToken);
        connections.put(connectionId, new ConnectionState(identity, ConcurrentHashMap.newKeySet()));
        log.info("Connection {} authenticated as {}", connectionId, identity.userId());
        return identity;
    }

    public Optional<Identity> identityOf(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId)).map(ConnectionState::identity);
    }

    public Set<String> joinedDocuments(String connectionId) {
        ConnectionState state = connections.get(connectionId);
        return state == null ? Set.of() : Set.copyOf(state.documents());
    }

    public void dispatch(String connectionId, String json) {
        ConnectionState state = connections.get(connectionId);
        if (state == null) {
            throw new UnauthenticatedException("Authentication required");
        }
        if (state.identity().isExpiredAt(clock.instant())) {
            throw new UnauthenticatedException("Authentication expired");
        }

        ClientMessage message = MessageCodec.decode(json);
        if (message instanceof ClientMessage.Ping ping) {
            heartbeat(connectionId, state, ping.documentId());
            return;
        }

        String documentId = message.documentId();
        if (documentId == null || documentId.isBlank()) {
            throw new InvalidMessageException("documentId required");
        }

        if (message instanceof ClientMessage.Join) {
            roomRegistry.join(documentId, state.identity(), connectionId);
            state.documents().add(documentId);
        } else if (message instanceof ClientMessage.Leave) {
            state.documents().remove(documentId);
            roomRegistry.leave(documentId, connectionId, LeaveReason.LEFT);
        } else if (message instanceof ClientMessage.SubmitOperation submit) {
            if (submit.operation() == null) {
                throw new InvalidMessageException("operation required");
            }
            roomRegistry.submit(documentId, connectionId, submit.operation());
        } else if (message instanceof ClientMessage.CursorUpdate cursor) {
            roomRegistry.updateCursor(documentId, connectionId, cursor.x(), cursor.y());
        } else if (message instanceof ClientMessage.SelectionUpdate selection) {
            roomRegistry.updateSelection(documentId, connectionId, selection.fieldId());
        } else if (message instanceof ClientMessage.RequestLock) {
            roomRegistry.requestLock(documentId, connectionId);
        } else if (message instanceof ClientMessage.ReleaseLock) {
            roomRegistry.releaseLock(documentId, connectionId);
        } else {
            throw new InvalidMessageException("Unsupported message " + message.getClass().getSimpleName());
        }
    }

    /**
     * Leaves every room the connection joined. Safe to call more than once and
     * after the idle reaper already evicted the connection.
     */
    public void disconnect(String connectionId) {
        ConnectionState state = connections.remove(connectionId);
        if (state == null) {
            return;
        }
        for (String documentId : List.copyOf(state.documents())) {
            roomRegistry.leave(documentId, connectionId, LeaveReason.DISCONNECTED);
        }
        log.info("Connection {} of user {} closed", connectionId, state.identity().userId());
    }

    private void heartbeat(String connectionId, ConnectionState state, String documentId) {
        if (documentId != null && !documentId.isBlank()) {
            roomRegistry.touch(documentId, connectionId);
            return;
        }
        for (String joined : List.copyOf(state.documents())) {
            try {
                roomRegistry.touch(joined, connectionId);
            } catch (NotInRoomException e) {
                // evicted meanwhile; forget the room
                state.documents().remove(joined);
            }
        }
    }
}
