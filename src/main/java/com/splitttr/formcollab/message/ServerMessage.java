package com.splitttr.formcollab.message;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerMessage(
    String type,
    String documentId,
    String userId,
    String connectionId,
    List<CollaboratorInfo> collaborators,
    CollaboratorInfo collaborator,
    LockInfo lock,
    List<FormField> fields,
    Long version,
    Cursor cursor,
    String selectedFieldId,
    FieldOperation operation,
    Long sequence,
    String reason,
    String error
) {
    public record Cursor(double x, double y) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CollaboratorInfo(
        String userId,
        String connectionId,
        String displayName,
        String color,
        Cursor cursor,
        String selectedFieldId,
        Instant lastActivityAt
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record LockInfo(
        boolean locked,
        String holderConnectionId,
        String holderUserId,
        String holderDisplayName
    ) {
        public static LockInfo unlocked() {
            return new LockInfo(false, null, null, null);
        }
    }

    public static ServerMessage snapshot(String docId, List<CollaboratorInfo> collaborators, LockInfo lock,
                                         List<FormField> fields, long version) {
        return new ServerMessage("snapshot", docId, null, null, collaborators, null, lock, fields, version,
            null, null, null, null, null, null);
    }

    public static ServerMessage collaboratorJoined(String docId, CollaboratorInfo collaborator) {
        return new ServerMessage("collaboratorJoined", docId, collaborator.userId(), collaborator.connectionId(),
            null, collaborator, null, null, null, null, null, null, null, null, null);
    }

    public static ServerMessage collaboratorLeft(String docId, CollaboratorInfo collaborator, String reason) {
        return new ServerMessage("collaboratorLeft", docId, collaborator.userId(), collaborator.connectionId(),
            null, collaborator, null, null, null, null, null, null, null, reason, null);
    }

    public static ServerMessage cursorMoved(String docId, String userId, String connectionId, Cursor cursor) {
        return new ServerMessage("cursorMoved", docId, userId, connectionId, null, null, null, null, null,
            cursor, null, null, null, null, null);
    }

    public static ServerMessage selectionChanged(String docId, String userId, String connectionId, String fieldId) {
        return new ServerMessage("selectionChanged", docId, userId, connectionId, null, null, null, null, null,
            null, fieldId, null, null, null, null);
    }

    public static ServerMessage operationAccepted(String docId, FieldOperation op, long sequence) {
        return new ServerMessage("operationAccepted", docId, op.authorUserId(), op.authorConnectionId(),
            null, null, null, null, null, null, null, op, sequence, null, null);
    }

    public static ServerMessage operationAcknowledged(String docId, FieldOperation op, long sequence, boolean merged) {
        return new ServerMessage("operationAcknowledged", docId, op.authorUserId(), op.authorConnectionId(),
            null, null, null, null, null, null, null, op, sequence, merged ? "merged" : "accepted", null);
    }

    public static ServerMessage operationRejected(String docId, FieldOperation op, String reason, String detail) {
        return new ServerMessage("operationRejected", docId, op.authorUserId(), op.authorConnectionId(),
            null, null, null, null, null, null, null, op, null, reason, detail);
    }

    public static ServerMessage lockAcquired(String docId, LockInfo lock) {
        return new ServerMessage("lockAcquired", docId, lock.holderUserId(), lock.holderConnectionId(),
            null, null, lock, null, null, null, null, null, null, null, null);
    }

    public static ServerMessage lockDenied(String docId, LockInfo lock) {
        return new ServerMessage("lockDenied", docId, null, null, null, null, lock, null, null,
            null, null, null, null, "locked_by_other", "Form is locked by " + lock.holderDisplayName());
    }

    public static ServerMessage lockReleased(String docId, String connectionId) {
        return new ServerMessage("lockReleased", docId, null, connectionId, null, null, LockInfo.unlocked(),
            null, null, null, null, null, null, null, null);
    }

    public static ServerMessage error(String code, String message) {
        return new ServerMessage("error", null, null, null, null, null, null, null, null,
            null, null, null, null, code, message);
    }
}
