package com.splitttr.formcollab.conflict;

import com.splitttr.formcollab.message.FieldOperation;
import com.splitttr.formcollab.message.FormField;
import com.splitttr.formcollab.message.OperationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConflictResolverTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private ConflictResolver resolver;
    private OperationHistory history;
    private List<FormField> fields;

    @BeforeEach
    void setUp() {
        resolver = new ConflictResolver(Duration.ofMillis(100));
        history = new OperationHistory(1000, Duration.ofMinutes(10));
        fields = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            fields.add(new FormField("f" + i, i, Map.of("label", "Field " + i)));
        }
    }

    @Test
    void noHistory_acceptsUnchanged() {
        var op = update("x", "f1", "a", 10);

        var result = resolver.resolve(op, fields, history);

        assertEquals(new Resolution.Accepted(op), result);
    }

    @Test
    void concurrentUpdates_laterArrivingOlderUpdateIsRejected() {
        // Y (t=12) reaches the room before X (t=10)
        var y = update("y", "f1", "b", 12);
        assertInstanceOf(Resolution.Accepted.class, resolver.resolve(y, fields, history));
        history.append(y, T0.plusMillis(13));

        var x = update("x", "f1", "a", 10);
        var result = resolver.resolve(x, fields, history);

        var rejected = assertInstanceOf(Resolution.Rejected.class, result);
        assertEquals(RejectReason.STALE_UPDATE, rejected.reason());
        assertSame(x, rejected.operation());
    }

    @Test
    void concurrentUpdates_newerUpdateWins() {
        history.append(update("x", "f1", "a", 10), T0.plusMillis(11));

        var y = update("y", "f1", "b", 12);

        assertEquals(new Resolution.Accepted(y), resolver.resolve(y, fields, history));
    }

    @Test
    void updatesOnDifferentFields_doNotConflict() {
        history.append(update("x", "f1", "a", 10), T0.plusMillis(11));

        var y = update("y", "f2", "b", 5);

        assertInstanceOf(Resolution.Accepted.class, resolver.resolve(y, fields, history));
    }

    @Test
    void updateOutsideWindow_isNotConcurrent() {
        history.append(update("x", "f1", "a", 0), T0);

        // recorded update precedes this one by more than the window
        var later = update("y", "f1", "b", 500);

        assertInstanceOf(Resolution.Accepted.class, resolver.resolve(later, fields, history));
    }

    @Test
    void ownOperations_neverConflict() {
        history.append(update("x", "f1", "b", 12), T0.plusMillis(12));

        var op = update("x", "f1", "a", 10);

        assertInstanceOf(Resolution.Accepted.class, resolver.resolve(op, fields, history));
    }

    @Test
    void concurrentAddsAtSamePosition_secondIsMovedDown() {
        var first = add("x", "new-a", 3, 10);
        var firstResult = resolver.resolve(first, fields, history);
        assertEquals(new Resolution.Accepted(first), firstResult);
        history.append(first, T0.plusMillis(10));
        fields = FieldListApplier.apply(fields, first);

        var second = add("y", "new-b", 3, 11);
        var merged = assertInstanceOf(Resolution.Merged.class, resolver.resolve(second, fields, history));

        assertEquals(4, merged.operation().position());
        assertSame(second, merged.original());
    }

    @Test
    void thirdConcurrentAdd_skipsEveryTakenPosition() {
        var first = add("x", "new-a", 3, 10);
        history.append(first, T0.plusMillis(10));
        fields = FieldListApplier.apply(fields, first);
        var second = add("y", "new-b", 4, 11);
        history.append(second, T0.plusMillis(11));
        fields = FieldListApplier.apply(fields, second);

        var third = add("z", "new-c", 3, 12);
        var merged = assertInstanceOf(Resolution.Merged.class, resolver.resolve(third, fields, history));

        assertEquals(5, merged.operation().position());
    }

    @Test
    void concurrentAdd_afterListShrank_isStillMerged() {
        fields = new ArrayList<>(fields.subList(0, 4));
        var first = add("x", "new-a", 4, 10);
        assertInstanceOf(Resolution.Accepted.class, resolver.resolve(first, fields, history));
        history.append(first, T0.plusMillis(10));
        fields = FieldListApplier.apply(fields, first);
        var removal = delete("y", "f0", 11);
        assertInstanceOf(Resolution.Accepted.class, resolver.resolve(removal, fields, history));
        history.append(removal, T0.plusMillis(11));
        fields = FieldListApplier.apply(fields, removal);

        var third = add("z", "new-b", 4, 12);
        var merged = assertInstanceOf(Resolution.Merged.class, resolver.resolve(third, fields, history));

        assertEquals(4, merged.operation().position());
        assertSame(third, merged.original());
    }

    @Test
    void addWithoutPosition_appends() {
        var op = add("x", "new-a", null, 10);

        var result = resolver.resolve(op, fields, history);

        assertEquals(5, result.operation().position());
        assertTrue(result.applied());
    }

    @Test
    void addBeyondEnd_isRejected() {
        var result = resolver.resolve(add("x", "new-a", 9, 10), fields, history);

        assertEquals(RejectReason.INDEX_OUT_OF_RANGE, ((Resolution.Rejected) result).reason());
    }

    @Test
    void addOfExistingField_isRejected() {
        var result = resolver.resolve(add("x", "f2", 1, 10), fields, history);

        assertEquals(RejectReason.DUPLICATE_FIELD, ((Resolution.Rejected) result).reason());
    }

    @Test
    void deleteWinsOverConcurrentUpdate() {
        history.append(update("x", "f1", "a", 10), T0.plusMillis(10));

        var delete = delete("y", "f1", 9);

        assertEquals(new Resolution.Accepted(delete), resolver.resolve(delete, fields, history));
    }

    @Test
    void updateAfterConcurrentDelete_isRejected() {
        var delete = delete("x", "f1", 10);
        history.append(delete, T0.plusMillis(10));
        fields = FieldListApplier.apply(fields, delete);

        var result = resolver.resolve(update("y", "f1", "a", 11), fields, history);

        assertEquals(RejectReason.FIELD_DELETED, ((Resolution.Rejected) result).reason());
    }

    @Test
    void secondConcurrentDelete_isRejected() {
        history.append(delete("x", "f1", 10), T0.plusMillis(10));

        var result = resolver.resolve(delete("y", "f1", 11), fields, history);

        assertEquals(RejectReason.FIELD_DELETED, ((Resolution.Rejected) result).reason());
    }

    @Test
    void updateOfUnknownField_isRejected() {
        var result = resolver.resolve(update("x", "nope", "a", 10), fields, history);

        assertEquals(RejectReason.FIELD_NOT_FOUND, ((Resolution.Rejected) result).reason());
    }

    @Test
    void updateWithoutTarget_isInvalid() {
        var result = resolver.resolve(update("x", null, "a", 10), fields, history);

        assertEquals(RejectReason.INVALID_OPERATION, ((Resolution.Rejected) result).reason());
    }

    @Test
    void overlappingReorders_firstRecordedWins() {
        history.append(reorder("x", 0, 2, 10), T0.plusMillis(10));

        var result = resolver.resolve(reorder("y", 3, 1, 11), fields, history);

        assertEquals(RejectReason.REORDER_CONFLICT, ((Resolution.Rejected) result).reason());
    }

    @Test
    void disjointReorders_bothAccepted() {
        history.append(reorder("x", 0, 1, 10), T0.plusMillis(10));

        var op = reorder("y", 3, 4, 11);

        assertEquals(new Resolution.Accepted(op), resolver.resolve(op, fields, history));
    }

    @Test
    void reorderOutOfRange_isRejected() {
        var result = resolver.resolve(reorder("x", 0, 5, 10), fields, history);

        assertEquals(RejectReason.INDEX_OUT_OF_RANGE, ((Resolution.Rejected) result).reason());
    }

    @Test
    void sameInputs_giveSameDecision() {
        history.append(update("y", "f1", "b", 12), T0.plusMillis(12));
        history.append(add("y", "new-a", 2, 13), T0.plusMillis(13));
        var incoming = List.of(
            update("x", "f1", "a", 10),
            add("x", "new-b", 2, 14),
            delete("x", "f3", 14),
            reorder("x", 1, 3, 15));

        for (FieldOperation op : incoming) {
            var first = resolver.resolve(op, List.copyOf(fields), history);
            var second = resolver.resolve(op, List.copyOf(fields), history);
            assertEquals(first, second, "decision for " + op.type());
        }
    }

    @Test
    void rangesOverlap_coversBothDirections() {
        assertTrue(ConflictResolver.rangesOverlap(0, 2, 2, 4));
        assertTrue(ConflictResolver.rangesOverlap(4, 1, 2, 3));
        assertFalse(ConflictResolver.rangesOverlap(0, 1, 2, 3));
        assertFalse(ConflictResolver.rangesOverlap(3, 2, 1, 0));
    }

    static FieldOperation update(String connection, String fieldId, String label, long atMillis) {
        return op(OperationType.UPDATE, connection, fieldId, Map.of("label", label), null, null, null, atMillis);
    }

    static FieldOperation add(String connection, String fieldId, Integer position, long atMillis) {
        return op(OperationType.ADD, connection, fieldId, Map.of("label", fieldId), position, null, null, atMillis);
    }

    static FieldOperation delete(String connection, String fieldId, long atMillis) {
        return op(OperationType.DELETE, connection, fieldId, null, null, null, null, atMillis);
    }

    static FieldOperation reorder(String connection, int from, int to, long atMillis) {
        return op(OperationType.REORDER, connection, null, null, null, from, to, atMillis);
    }

    private static FieldOperation op(OperationType type, String connection, String fieldId, Map<String, Object> payload,
                                     Integer position, Integer from, Integer to, long atMillis) {
        return new FieldOperation(connection + "-" + type + "-" + atMillis, type, fieldId, payload, position, from, to,
            connection, "user-" + connection, T0.plusMillis(atMillis));
    }
}
