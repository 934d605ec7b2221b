package com.splitttr.formcollab.conflict;

import com.splitttr.formcollab.message.FieldOperation;
import com.splitttr.formcollab.message.FormField;
import com.splitttr.formcollab.message.OperationType;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether an incoming operation is accepted, accepted after adjustment
 * or rejected, given the current field list and the recent history of the form.
 *
 * <p>Policy per pairing, only against concurrent history entries from other connections:
 * <ul>
 *   <li>update vs update on one field: last writer by {@code submittedAt} wins, an
 *       incoming update older than (or as old as) a recorded one is rejected;</li>
 *   <li>delete vs anything on one field: the delete wins;</li>
 *   <li>add vs add at one position: the incoming add is moved to the next free position
 *       (capped at the end of the list) and reported as merged;</li>
 *   <li>reorder vs reorder with overlapping index ranges: the recorded one wins.</li>
 * </ul>
 * The resolver holds no state; the same inputs always give the same result.
 */
public class ConflictResolver {

    private final Duration concurrencyWindow;

    public ConflictResolver(Duration concurrencyWindow) {
        this.concurrencyWindow = Objects.requireNonNull(concurrencyWindow);
    }

    public Resolution resolve(FieldOperation incoming, List<FormField> fields, OperationHistory history) {
        if (incoming.type() == null || incoming.submittedAt() == null) {
            return reject(incoming, RejectReason.INVALID_OPERATION, "Operation type and timestamp are required");
        }
        List<FieldOperation> concurrent = history.operations().stream()
            .filter(recorded -> isConcurrent(recorded, incoming))
            .toList();

        return switch (incoming.type()) {
            case ADD -> resolveAdd(incoming, fields, concurrent);
            case UPDATE -> resolveUpdate(incoming, fields, concurrent);
            case DELETE -> resolveDelete(incoming, fields, concurrent);
            case REORDER -> resolveReorder(incoming, fields, concurrent);
        };
    }

    /**
     * A recorded operation is concurrent with the incoming one unless it came from
     * the same connection or was submitted more than the window before it.
     */
    boolean isConcurrent(FieldOperation recorded, FieldOperation incoming) {
        if (Objects.equals(recorded.authorConnectionId(), incoming.authorConnectionId())) {
            return false;
        }
        return recorded.submittedAt().isAfter(incoming.submittedAt().minus(concurrencyWindow));
    }

    private Resolution resolveAdd(FieldOperation incoming, List<FormField> fields, List<FieldOperation> concurrent) {
        if (containsField(fields, incoming.targetFieldId())) {
            return reject(incoming, RejectReason.DUPLICATE_FIELD, "Field " + incoming.targetFieldId() + " already exists");
        }
        int requested = incoming.position() == null ? fields.size() : incoming.position();
        if (requested < 0 || requested > fields.size()) {
            return reject(incoming, RejectReason.INDEX_OUT_OF_RANGE,
                "Position " + requested + " outside 0.." + fields.size());
        }

        Set<Integer> taken = concurrent.stream()
            .filter(op -> op.type() == OperationType.ADD && op.position() != null)
            .map(FieldOperation::position)
            .collect(Collectors.toSet());
        int position = requested;
        while (taken.contains(position)) {
            position++;
        }
        boolean nudged = position != requested;
        // a shrunken list can pull the nudged position back to the end
        position = Math.min(position, fields.size());

        if (nudged) {
            return new Resolution.Merged(incoming.withPosition(position), incoming);
        }
        if (incoming.position() == null) {
            return new Resolution.Accepted(incoming.withPosition(position));
        }
        return new Resolution.Accepted(incoming);
    }

    private Resolution resolveUpdate(FieldOperation incoming, List<FormField> fields, List<FieldOperation> concurrent) {
        String fieldId = incoming.targetFieldId();
        if (fieldId == null) {
            return reject(incoming, RejectReason.INVALID_OPERATION, "Update requires targetFieldId");
        }
        if (touches(concurrent, OperationType.DELETE, fieldId)) {
            return reject(incoming, RejectReason.FIELD_DELETED, "Field " + fieldId + " was deleted concurrently");
        }
        if (!containsField(fields, fieldId)) {
            return reject(incoming, RejectReason.FIELD_NOT_FOUND, "Field " + fieldId + " does not exist");
        }
        boolean superseded = concurrent.stream()
            .filter(op -> op.type() == OperationType.UPDATE && fieldId.equals(op.targetFieldId()))
            .anyMatch(op -> !op.submittedAt().isBefore(incoming.submittedAt()));
        if (superseded) {
            return reject(incoming, RejectReason.STALE_UPDATE, "Field " + fieldId + " has a newer update");
        }
        return new Resolution.Accepted(incoming);
    }

    private Resolution resolveDelete(FieldOperation incoming, List<FormField> fields, List<FieldOperation> concurrent) {
        String fieldId = incoming.targetFieldId();
        if (fieldId == null) {
            return reject(incoming, RejectReason.INVALID_OPERATION, "Delete requires targetFieldId");
        }
        if (touches(concurrent, OperationType.DELETE, fieldId)) {
            return reject(incoming, RejectReason.FIELD_DELETED, "Field " + fieldId + " was already deleted");
        }
        if (!containsField(fields, fieldId)) {
            return reject(incoming, RejectReason.FIELD_NOT_FOUND, "Field " + fieldId + " does not exist");
        }
        // concurrent updates of the field lose to the delete
        return new Resolution.Accepted(incoming);
    }

    private Resolution resolveReorder(FieldOperation incoming, List<FormField> fields, List<FieldOperation> concurrent) {
        Integer from = incoming.fromIndex();
        Integer to = incoming.toIndex();
        if (from == null || to == null) {
            return reject(incoming, RejectReason.INVALID_OPERATION, "Reorder requires fromIndex and toIndex");
        }
        if (from < 0 || from >= fields.size() || to < 0 || to >= fields.size()) {
            return reject(incoming, RejectReason.INDEX_OUT_OF_RANGE,
                "Indexes " + from + "->" + to + " outside 0.." + (fields.size() - 1));
        }
        boolean overlapping = concurrent.stream()
            .filter(op -> op.type() == OperationType.REORDER && op.fromIndex() != null && op.toIndex() != null)
            .anyMatch(op -> rangesOverlap(from, to, op.fromIndex(), op.toIndex()));
        if (overlapping) {
            return reject(incoming, RejectReason.REORDER_CONFLICT, "Fields were reordered concurrently");
        }
        return new Resolution.Accepted(incoming);
    }

    static boolean rangesOverlap(int fromA, int toA, int fromB, int toB) {
        int lowA = Math.min(fromA, toA);
        int highA = Math.max(fromA, toA);
        int lowB = Math.min(fromB, toB);
        int highB = Math.max(fromB, toB);
        return lowA <= highB && lowB <= highA;
    }

    private static boolean touches(List<FieldOperation> ops, OperationType type, String fieldId) {
        return ops.stream().anyMatch(op -> op.type() == type && fieldId.equals(op.targetFieldId()));
    }

    private static boolean containsField(List<FormField> fields, String fieldId) {
        return fieldId != null && fields.stream().anyMatch(f -> fieldId.equals(f.id()));
    }

    private static Resolution reject(FieldOperation op, RejectReason reason, String detail) {
        return new Resolution.Rejected(op, reason, detail);
    }
}
