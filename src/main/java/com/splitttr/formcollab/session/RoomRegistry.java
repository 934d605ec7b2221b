package com.splitttr.formcollab.session;

import com.splitttr.formcollab.client.DocumentStore;
import com.splitttr.formcollab.config.CollabConfig;
import com.splitttr.formcollab.conflict.ConflictResolver;
import com.splitttr.formcollab.conflict.OperationHistory;
import com.splitttr.formcollab.conflict.Resolution;
import com.splitttr.formcollab.error.AccessDeniedException;
import com.splitttr.formcollab.error.NotInRoomException;
import com.splitttr.formcollab.error.StoreUnavailableException;
import com.splitttr.formcollab.message.FieldOperation;
import com.splitttr.formcollab.message.ServerMessage;
import com.splitttr.formcollab.security.FormAccess;
import com.splitttr.formcollab.security.Identity;
import com.splitttr.formcollab.websocket.BroadcastDispatcher;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;

/**
 * Owns one {@link Room} per active form. Every call for a document runs inside
 * {@link ConcurrentHashMap#compute} on that document's key, which is the room's
 * serialization point: rooms are created and destroyed atomically with the
 * join or leave that causes it, and no two calls for one document interleave.
 * The store read that seeds a new room happens before that point, once per document.
 * Messages produced by a call are handed to the dispatcher before the call
 * returns, so recipients see them in acceptance order.
 */
@ApplicationScoped
public class RoomRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final ConcurrentHashMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<DocumentStore.LoadedDocument>> pendingLoads =
        new ConcurrentHashMap<>();

    @Inject
    DocumentStore documentStore;

    @Inject
    BroadcastDispatcher dispatcher;

    @Inject
    CollabConfig config;

    @Inject
    Clock clock;

    ConflictResolver resolver;

    @PostConstruct
    void init() {
        resolver = new ConflictResolver(config.conflictWindow());
    }

    /**
     * Adds the connection to the document's room, creating the room on first join.
     * The joining connection receives a snapshot; everyone else is told about the
     * new collaborator. Joining again from the same connection only re-sends the snapshot.
     *
     * @throws AccessDeniedException when the form does not exist or is not shared with the user
     * @throws StoreUnavailableException when a new room cannot be seeded from the store
     */
    public RoomView join(String documentId, Identity identity, String connectionId) {
        while (true) {
            RoomView view = joinExisting(documentId, identity, connectionId);
            if (view == null) {
                view = joinLoading(documentId, identity, connectionId);
            }
            if (view != null) {
                return view;
            }
        }
    }

    private RoomView joinExisting(String documentId, Identity identity, String connectionId) {
        return joinRoom(documentId, identity, connectionId, null);
    }

    /**
     * Loads the form outside the map so a slow store only holds up joins of this
     * document. One caller loads, concurrent joiners wait on its result. A null
     * result tells waiters to look for the room again.
     */
    private RoomView joinLoading(String documentId, Identity identity, String connectionId) {
        var created = new CompletableFuture<DocumentStore.LoadedDocument>();
        CompletableFuture<DocumentStore.LoadedDocument> pending = pendingLoads.putIfAbsent(documentId, created);
        if (pending != null) {
            return joinRoom(documentId, identity, connectionId, await(pending));
        }
        try {
            RoomView view = joinExisting(documentId, identity, connectionId);
            if (view != null) {
                return view;
            }
            DocumentStore.LoadedDocument loaded;
            try {
                loaded = documentStore.loadFields(documentId).orElseThrow(() -> {
                    log.warn("User {} tried to join unknown form {}", identity.userId(), documentId);
                    return new AccessDeniedException();
                });
            } catch (RuntimeException e) {
                created.completeExceptionally(e);
                throw e;
            }
            created.complete(loaded);
            return joinRoom(documentId, identity, connectionId, loaded);
        } finally {
            created.complete(null);
            pendingLoads.remove(documentId, created);
        }
    }

    private RoomView joinRoom(String documentId, Identity identity, String connectionId,
                              DocumentStore.LoadedDocument loaded) {
        var view = new AtomicReference<RoomView>();
        rooms.compute(documentId, (id, room) -> {
            if (room == null && loaded == null) {
                return null;
            }
            FormAccess access = room != null ? room.access() : loaded.access();
            if (!access.permits(identity.userId())) {
                log.warn("User {} denied access to form {}", identity.userId(), id);
                throw new AccessDeniedException();
            }
            if (room == null) {
                room = openRoom(id, loaded);
            }
            Instant now = clock.instant();
            if (room.presence().contains(connectionId)) {
                room.presence().touch(connectionId, now);
            } else {
                var collaborator = new Collaborator(identity.userId(), connectionId, identity.displayName(),
                    room.colors().allocate(), null, null, now);
                room.presence().add(collaborator);
                dispatcher.broadcast(room.presence().connectionIds(),
                    ServerMessage.collaboratorJoined(id, collaborator.toInfo()), connectionId);
                log.info("User {} joined form {} on connection {} ({} collaborators)",
                    identity.userId(), id, connectionId, room.presence().size());
            }
            view.set(room.view());
            dispatcher.send(connectionId, view.get().toSnapshot());
            return room;
        });
        return view.get();
    }

    private static DocumentStore.LoadedDocument await(CompletableFuture<DocumentStore.LoadedDocument> pending) {
        try {
            return pending.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Removes the connection from the room, releasing its lock. Destroys the room
     * when it becomes empty. Calling it for a connection that is not a member is a no-op.
     *
     * @return whether a collaborator was removed
     */
    public boolean leave(String documentId, String connectionId, LeaveReason reason) {
        var removed = new AtomicBoolean();
        rooms.computeIfPresent(documentId, (id, room) -> {
            removed.set(removeCollaborator(room, connectionId, reason));
            return retainIfOccupied(room);
        });
        return removed.get();
    }

    public Resolution submit(String documentId, String connectionId, FieldOperation operation) {
        return withMember(documentId, connectionId, (room, member) -> {
            Instant now = clock.instant();
            room.presence().touch(connectionId, now);
            FieldOperation authored = operation.authoredBy(connectionId, member.userId(), now,
                config.historyMaxAge());

            Resolution resolution = resolver.resolve(authored, room.fields(), room.history());
            if (resolution instanceof Resolution.Rejected rejected) {
                log.warn("Rejected {} on form {} from {}: {}", authored.type(), documentId, connectionId,
                    rejected.detail());
                dispatcher.send(connectionId, ServerMessage.operationRejected(documentId, authored,
                    rejected.reason().code(), rejected.detail()));
                return resolution;
            }

            // history first, then fan-out, then write-through
            OperationHistory.Entry entry = room.accept(resolution.operation(), now);
            log.debug("Accepted {} #{} on form {}", entry.operation().type(), entry.sequence(), documentId);
            dispatcher.broadcast(room.presence().connectionIds(),
                ServerMessage.operationAccepted(documentId, entry.operation(), entry.sequence()), connectionId);
            dispatcher.send(connectionId, ServerMessage.operationAcknowledged(documentId, entry.operation(),
                entry.sequence(), resolution instanceof Resolution.Merged));
            documentStore.applyOperation(documentId, entry.operation());
            return resolution;
        });
    }

    public void updateCursor(String documentId, String connectionId, double x, double y) {
        withMember(documentId, connectionId, (room, member) -> {
            Collaborator updated = room.presence().updateCursor(connectionId, x, y, clock.instant());
            dispatcher.broadcast(room.presence().connectionIds(),
                ServerMessage.cursorMoved(documentId, updated.userId(), connectionId, updated.cursor()), connectionId);
            return updated;
        });
    }

    public void updateSelection(String documentId, String connectionId, String fieldId) {
        withMember(documentId, connectionId, (room, member) -> {
            Collaborator updated = room.presence().updateSelection(connectionId, fieldId, clock.instant());
            dispatcher.broadcast(room.presence().connectionIds(),
                ServerMessage.selectionChanged(documentId, updated.userId(), connectionId, fieldId), connectionId);
            return updated;
        });
    }

    /**
     * On success every member, the requester included, is told the new holder.
     * Otherwise only the requester hears who holds the lock.
     */
    public LockManager.Outcome requestLock(String documentId, String connectionId) {
        return withMember(documentId, connectionId, (room, member) -> {
            LockManager.Outcome outcome = room.lock().request(connectionId);
            if (outcome == LockManager.Outcome.ACQUIRED) {
                log.info("Lock on form {} acquired by {}", documentId, connectionId);
                dispatcher.broadcast(room.presence().connectionIds(),
                    ServerMessage.lockAcquired(documentId, room.lockInfo()), null);
            } else {
                dispatcher.send(connectionId, ServerMessage.lockDenied(documentId, room.lockInfo()));
            }
            return outcome;
        });
    }

    /**
     * Releases the lock if the connection holds it. Anything else, including an
     * unknown room or a connection that already left, is a no-op.
     */
    public boolean releaseLock(String documentId, String connectionId) {
        var released = new AtomicBoolean();
        rooms.computeIfPresent(documentId, (id, room) -> {
            if (room.lock().release(connectionId)) {
                released.set(true);
                log.info("Lock on form {} released by {}", id, connectionId);
                dispatcher.broadcast(room.presence().connectionIds(), ServerMessage.lockReleased(id, connectionId), null);
            }
            return room;
        });
        return released.get();
    }

    /** Heartbeat: refreshes the collaborator's activity without telling anyone. */
    public void touch(String documentId, String connectionId) {
        withMember(documentId, connectionId, (room, member) -> room.presence().touch(connectionId, clock.instant()));
    }

    /**
     * Evicts collaborators idle for longer than the configured threshold, ages out
     * old history entries and destroys rooms left empty.
     *
     * @return number of collaborators evicted
     */
    public int evictIdle() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(config.idleThreshold());
        var evicted = new AtomicInteger();
        for (String documentId : new ArrayList<>(rooms.keySet())) {
            rooms.computeIfPresent(documentId, (id, room) -> {
                for (Collaborator idle : room.presence().inactiveSince(cutoff)) {
                    if (removeCollaborator(room, idle.connectionId(), LeaveReason.IDLE)) {
                        evicted.incrementAndGet();
                    }
                }
                room.history().pruneExpired(now);
                return retainIfOccupied(room);
            });
        }
        return evicted.get();
    }

    public Optional<RoomView> find(String documentId) {
        var view = new AtomicReference<RoomView>();
        rooms.computeIfPresent(documentId, (id, room) -> {
            view.set(room.view());
            return room;
        });
        return Optional.ofNullable(view.get());
    }

    public boolean isMember(String documentId, String connectionId) {
        return find(documentId)
            .map(v -> v.collaborators().stream().anyMatch(c -> c.connectionId().equals(connectionId)))
            .orElse(false);
    }

    public int activeRoomCount() {
        return rooms.size();
    }

    private Room openRoom(String documentId, DocumentStore.LoadedDocument loaded) {
        var history = new OperationHistory(config.historyMaxEntries(), config.historyMaxAge(), loaded.version());
        log.info("Room created for form {} ({} fields, version {})", documentId, loaded.fields().size(),
            loaded.version());
        return new Room(documentId, loaded.fields(), history, new ColorAllocator(config.colors()),
            loaded.access());
    }

    private boolean removeCollaborator(Room room, String connectionId, LeaveReason reason) {
        Optional<Collaborator> member = room.presence().get(connectionId);
        if (member.isEmpty()) {
            return false;
        }
        String documentId = room.documentId();
        boolean heldLock = room.lock().release(connectionId);
        Collaborator removed = room.presence().remove(connectionId).orElseThrow();
        room.colors().release(removed.color());

        List<String> remaining = room.presence().connectionIds();
        if (heldLock) {
            dispatcher.broadcast(remaining, ServerMessage.lockReleased(documentId, connectionId), null);
        }
        var left = ServerMessage.collaboratorLeft(documentId, removed.toInfo(), reason.code());
        dispatcher.broadcast(remaining, left, null);
        if (reason == LeaveReason.IDLE) {
            // the evicted client is still connected and should know to re-join
            dispatcher.send(connectionId, left);
        }
        log.info("User {} left form {} ({}) on connection {}", removed.userId(), documentId, reason.code(),
            connectionId);
        return true;
    }

    private Room retainIfOccupied(Room room) {
        if (room.isEmpty()) {
            log.info("Room for form {} destroyed", room.documentId());
            return null;
        }
        return room;
    }

    private <T> T withMember(String documentId, String connectionId, BiFunction<Room, Collaborator, T> action) {
        var result = new AtomicReference<T>();
        var found = new AtomicBoolean();
        rooms.computeIfPresent(documentId, (id, room) -> {
            Collaborator member = room.presence().get(connectionId).orElse(null);
            if (member != null) {
                found.set(true);
                result.set(action.apply(room, member));
            }
            return room;
        });
        if (!found.get()) {
            throw new NotInRoomException(documentId, connectionId);
        }
        return result.get();
    }
}
