package com.splitttr.formcollab.session;

import com.splitttr.formcollab.message.FormField;
import com.splitttr.formcollab.message.ServerMessage;
import com.splitttr.formcollab.message.ServerMessage.CollaboratorInfo;
import com.splitttr.formcollab.message.ServerMessage.LockInfo;

import java.util.List;

/**
 * Immutable copy of a room's state, taken at the room's serialization point.
 */
public record RoomView(
    String documentId,
    List<CollaboratorInfo> collaborators,
    LockInfo lock,
    List<FormField> fields,
    long version,
    int historySize
) {
    public ServerMessage toSnapshot() {
        return ServerMessage.snapshot(documentId, collaborators, lock, fields, version);
    }
}
