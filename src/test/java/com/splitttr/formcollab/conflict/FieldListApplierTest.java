package com.splitttr.formcollab.conflict;

import com.splitttr.formcollab.message.FieldOperation;
import com.splitttr.formcollab.message.FormField;
import com.splitttr.formcollab.message.OperationType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldListApplierTest {

    private final List<FormField> fields = List.of(
        new FormField("name", 0, Map.of("label", "Name", "required", true)),
        new FormField("email", 1, Map.of("label", "Email")),
        new FormField("phone", 2, Map.of("label", "Phone")));

    @Test
    void add_insertsAtPositionAndRenumbers() {
        var result = FieldListApplier.apply(fields, op(OperationType.ADD, "age", Map.of("label", "Age"), 1, null, null));

        assertEquals(List.of("name", "age", "email", "phone"), ids(result));
        assertEquals(List.of(0, 1, 2, 3), result.stream().map(FormField::position).toList());
        assertEquals("Age", result.get(1).properties().get("label"));
    }

    @Test
    void add_keepsIdOutOfProperties() {
        var result = FieldListApplier.apply(fields,
            op(OperationType.ADD, "age", Map.of("id", "age", "label", "Age"), 3, null, null));

        assertEquals(Map.of("label", "Age"), result.get(3).properties());
    }

    @Test
    void update_mergesIntoExistingProperties() {
        var result = FieldListApplier.apply(fields,
            op(OperationType.UPDATE, "name", Map.of("label", "Full name"), null, null, null));

        assertEquals("Full name", result.get(0).properties().get("label"));
        assertEquals(true, result.get(0).properties().get("required"));
    }

    @Test
    void delete_removesField() {
        var result = FieldListApplier.apply(fields, op(OperationType.DELETE, "email", null, null, null, null));

        assertEquals(List.of("name", "phone"), ids(result));
        assertEquals(1, result.get(1).position());
    }

    @Test
    void reorder_movesField() {
        var result = FieldListApplier.apply(fields, op(OperationType.REORDER, null, null, null, 2, 0));

        assertEquals(List.of("phone", "name", "email"), ids(result));
    }

    @Test
    void operationsThatNoLongerFit_areSkipped() {
        var unknown = FieldListApplier.apply(fields, op(OperationType.UPDATE, "gone", Map.of("a", 1), null, null, null));
        var badReorder = FieldListApplier.apply(fields, op(OperationType.REORDER, null, null, null, 0, 7));
        var duplicate = FieldListApplier.apply(fields, op(OperationType.ADD, "name", null, 0, null, null));

        assertEquals(ids(fields), ids(unknown));
        assertEquals(ids(fields), ids(badReorder));
        assertEquals(ids(fields), ids(duplicate));
    }

    private static List<String> ids(List<FormField> fields) {
        return fields.stream().map(FormField::id).toList();
    }

    private static FieldOperation op(OperationType type, String fieldId, Map<String, Object> payload,
                                     Integer position, Integer from, Integer to) {
        return new FieldOperation("op", type, fieldId, payload, position, from, to, "c", "u",
            Instant.parse("2026-03-01T10:00:00Z"));
    }
}
