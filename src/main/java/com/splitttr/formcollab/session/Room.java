package com.splitttr.formcollab.session;

import com.splitttr.formcollab.conflict.FieldListApplier;
import com.splitttr.formcollab.conflict.OperationHistory;
import com.splitttr.formcollab.message.FieldOperation;
import com.splitttr.formcollab.message.FormField;
import com.splitttr.formcollab.message.ServerMessage.LockInfo;
import com.splitttr.formcollab.security.FormAccess;

import java.time.Instant;
import java.util.List;

/**
 * Live collaborative session of one form. All access goes through
 * {@link RoomRegistry}, which serializes it per document.
 */
public class Room {

    private final String documentId;
    private final PresenceStore presence = new PresenceStore();
    private final LockManager lock = new LockManager(presence);
    private final OperationHistory history;
    private final ColorAllocator colors;
    private final FormAccess access;

    // In-memory field list, the live source of truth while the room exists
    private List<FormField> fields;

    public Room(String documentId, List<FormField> fields, OperationHistory history, ColorAllocator colors,
                FormAccess access) {
        this.documentId = documentId;
        this.access = access;
        this.fields = List.copyOf(fields);
        this.history = history;
        this.colors = colors;
    }

    public String documentId() {
        return documentId;
    }

    public PresenceStore presence() {
        return presence;
    }

    public LockManager lock() {
        return lock;
    }

    public OperationHistory history() {
        return history;
    }

    public ColorAllocator colors() {
        return colors;
    }

    public FormAccess access() {
        return access;
    }

    public List<FormField> fields() {
        return fields;
    }

    public long version() {
        return history.lastSequence();
    }

    /**
     * Records an accepted operation in the history, then applies it to the field list.
     */
    public OperationHistory.Entry accept(FieldOperation operation, Instant now) {
        OperationHistory.Entry entry = history.append(operation, now);
        fields = FieldListApplier.apply(fields, operation);
        return entry;
    }

    public LockInfo lockInfo() {
        return lock.holderCollaborator()
            .map(c -> new LockInfo(true, c.connectionId(), c.userId(), c.displayName()))
            .orElseGet(LockInfo::unlocked);
    }

    public boolean isEmpty() {
        return presence.isEmpty();
    }

    public RoomView view() {
        return new RoomView(
            documentId,
            presence.all().stream().map(Collaborator::toInfo).toList(),
            lockInfo(),
            fields,
            version(),
            history.size()
        );
    }
}
