package com.splitttr.formcollab.message;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A structural edit of a form: add, update, delete or reorder a field.
 * Immutable; the server stamps the author and fills in the id, the timestamp
 * and (for adds) the new field's id before the operation reaches the resolver.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldOperation(
    String id,
    OperationType type,
    String targetFieldId,
    Map<String, Object> payload,
    Integer position,
    Integer fromIndex,
    Integer toIndex,
    String authorConnectionId,
    String authorUserId,
    Instant submittedAt
) {
    public FieldOperation {
        payload = payload == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Binds the operation to the connection that sent it. Client supplied
     * author fields are discarded. A client timestamp is kept only when it lies
     * within {@code maxAge} before {@code receivedAt}; a missing, future or
     * older timestamp is replaced by the receive time.
     */
    public FieldOperation authoredBy(String connectionId, String userId, Instant receivedAt, Duration maxAge) {
        String fieldId = targetFieldId;
        if (type == OperationType.ADD && (fieldId == null || fieldId.isBlank())) {
            Object fromPayload = payload == null ? null : payload.get("id");
            fieldId = fromPayload != null ? fromPayload.toString() : UUID.randomUUID().toString();
        }
        return new FieldOperation(
            id == null || id.isBlank() ? connectionId + "-" + UUID.randomUUID() : id,
            type,
            fieldId,
            payload,
            position,
            fromIndex,
            toIndex,
            connectionId,
            userId,
            stampedAt(receivedAt, maxAge)
        );
    }

    private Instant stampedAt(Instant receivedAt, Duration maxAge) {
        if (submittedAt == null || submittedAt.isAfter(receivedAt) || submittedAt.isBefore(receivedAt.minus(maxAge))) {
            return receivedAt;
        }
        return submittedAt;
    }

    public FieldOperation withPosition(int newPosition) {
        return new FieldOperation(id, type, targetFieldId, payload, newPosition, fromIndex, toIndex,
            authorConnectionId, authorUserId, submittedAt);
    }
}
