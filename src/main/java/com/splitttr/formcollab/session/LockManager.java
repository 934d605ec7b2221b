package com.splitttr.formcollab.session;

import java.util.Optional;

/**
 * Advisory single-writer lock of one room: {@code Unlocked} or {@code Locked(holder)}.
 * The holder is always a current member of the room's presence store.
 */
public class LockManager {

    public enum Outcome { ACQUIRED, DENIED }

    private final PresenceStore presence;
    private String holder;

    public LockManager(PresenceStore presence) {
        this.presence = presence;
    }

    /**
     * Grants the lock when it is free or already held by the requester.
     */
    public Outcome request(String connectionId) {
        if (!presence.contains(connectionId)) {
            throw new IllegalStateException("Lock requested by non-member " + connectionId);
        }
        Optional<String> current = holder();
        if (current.isPresent() && !current.get().equals(connectionId)) {
            return Outcome.DENIED;
        }
        holder = connectionId;
        return Outcome.ACQUIRED;
    }

    /**
     * Releases the lock if {@code connectionId} holds it; otherwise does nothing.
     *
     * @return whether the lock was released
     */
    public boolean release(String connectionId) {
        if (holder == null || !holder.equals(connectionId)) {
            return false;
        }
        holder = null;
        return true;
    }

    public Optional<String> holder() {
        if (holder != null && !presence.contains(holder)) {
            holder = null;
        }
        return Optional.ofNullable(holder);
    }

    public Optional<Collaborator> holderCollaborator() {
        return holder().flatMap(presence::get);
    }

    public boolean isLocked() {
        return holder().isPresent();
    }
}
