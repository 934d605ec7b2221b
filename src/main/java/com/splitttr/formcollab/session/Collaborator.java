package com.splitttr.formcollab.session;

import com.splitttr.formcollab.message.ServerMessage.CollaboratorInfo;
import com.splitttr.formcollab.message.ServerMessage.Cursor;

import java.time.Instant;

/**
 * Presence of one connection in a room. Replaced, never mutated; the
 * activity timestamp only moves forward.
 */
public record Collaborator(
    String userId,
    String connectionId,
    String displayName,
    String color,
    Cursor cursor,
    String selectedFieldId,
    Instant lastActivityAt
) {
    public Collaborator withCursor(Cursor newCursor, Instant now) {
        return new Collaborator(userId, connectionId, displayName, color, newCursor, selectedFieldId, latest(now));
    }

    public Collaborator withSelection(String fieldId, Instant now) {
        return new Collaborator(userId, connectionId, displayName, color, cursor, fieldId, latest(now));
    }

    public Collaborator touchedAt(Instant now) {
        Instant latest = latest(now);
        return latest.equals(lastActivityAt) ? this
            : new Collaborator(userId, connectionId, displayName, color, cursor, selectedFieldId, latest);
    }

    public CollaboratorInfo toInfo() {
        return new CollaboratorInfo(userId, connectionId, displayName, color, cursor, selectedFieldId, lastActivityAt);
    }

    private Instant latest(Instant now) {
        return now.isAfter(lastActivityAt) ? now : lastActivityAt;
    }
}
