package com.splitttr.formcollab.error;

public class NotInRoomException extends CollaborationException {

    private final String documentId;

    public NotInRoomException(String documentId, String connectionId) {
        super("Connection " + connectionId + " has not joined form " + documentId);
        this.documentId = documentId;
    }

    public String documentId() {
        return documentId;
    }

    @Override
    public String code() {
        return "not_in_room";
    }
}
