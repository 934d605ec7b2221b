package com.splitttr.formcollab.message;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Messages a client may send. The {@code type} property selects the record.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ClientMessage.Join.class, name = "join"),
    @JsonSubTypes.Type(value = ClientMessage.Leave.class, name = "leave"),
    @JsonSubTypes.Type(value = ClientMessage.SubmitOperation.class, name = "submitOperation"),
    @JsonSubTypes.Type(value = ClientMessage.CursorUpdate.class, name = "cursorUpdate"),
    @JsonSubTypes.Type(value = ClientMessage.SelectionUpdate.class, name = "selectionUpdate"),
    @JsonSubTypes.Type(value = ClientMessage.RequestLock.class, name = "requestLock"),
    @JsonSubTypes.Type(value = ClientMessage.ReleaseLock.class, name = "releaseLock"),
    @JsonSubTypes.Type(value = ClientMessage.Ping.class, name = "ping")
})
public sealed interface ClientMessage {

    String documentId();

    record Join(String documentId) implements ClientMessage {}

    record Leave(String documentId) implements ClientMessage {}

    record SubmitOperation(String documentId, FieldOperation operation) implements ClientMessage {}

    record CursorUpdate(String documentId, double x, double y) implements ClientMessage {}

    // fieldId == null clears the selection
    record SelectionUpdate(String documentId, String fieldId) implements ClientMessage {}

    record RequestLock(String documentId) implements ClientMessage {}

    record ReleaseLock(String documentId) implements ClientMessage {}

    // documentId is optional here; without it every joined room is refreshed
    record Ping(String documentId) implements ClientMessage {}
}
