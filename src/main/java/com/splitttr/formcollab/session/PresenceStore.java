package com.splitttr.formcollab.session;

import com.splitttr.formcollab.message.ServerMessage.Cursor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Collaborators of one room keyed by connection id, in join order.
 * Not thread-safe: only touched from the owning room's serialization point.
 */
public class PresenceStore {

    private final Map<String, Collaborator> collaborators = new LinkedHashMap<>();

    public void add(Collaborator collaborator) {
        collaborators.put(collaborator.connectionId(), collaborator);
    }

    public Optional<Collaborator> get(String connectionId) {
        return Optional.ofNullable(collaborators.get(connectionId));
    }

    public boolean contains(String connectionId) {
        return collaborators.containsKey(connectionId);
    }

    public Collaborator updateCursor(String connectionId, double x, double y, Instant now) {
        return update(connectionId, c -> c.withCursor(new Cursor(x, y), now));
    }

    public Collaborator updateSelection(String connectionId, String fieldId, Instant now) {
        return update(connectionId, c -> c.withSelection(fieldId, now));
    }

    public Collaborator touch(String connectionId, Instant now) {
        return update(connectionId, c -> c.touchedAt(now));
    }

    public Optional<Collaborator> remove(String connectionId) {
        return Optional.ofNullable(collaborators.remove(connectionId));
    }

    /** Collaborators whose last activity is strictly before {@code cutoff}. */
    public List<Collaborator> inactiveSince(Instant cutoff) {
        return collaborators.values().stream()
            .filter(c -> c.lastActivityAt().isBefore(cutoff))
            .toList();
    }

    public List<Collaborator> all() {
        return new ArrayList<>(collaborators.values());
    }

    public List<String> connectionIds() {
        return new ArrayList<>(collaborators.keySet());
    }

    public int size() {
        return collaborators.size();
    }

    public boolean isEmpty() {
        return collaborators.isEmpty();
    }

    private Collaborator update(String connectionId, UnaryOperator<Collaborator> change) {
        Collaborator updated = collaborators.computeIfPresent(connectionId, (id, existing) -> change.apply(existing));
        if (updated == null) {
            throw new IllegalStateException("No collaborator for connection " + connectionId);
        }
        return updated;
    }
}
