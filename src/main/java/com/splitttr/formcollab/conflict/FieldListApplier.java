package com.splitttr.formcollab.conflict;

import com.splitttr.formcollab.message.FieldOperation;
import com.splitttr.formcollab.message.FormField;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies operations to an ordered field list. Operations that no longer fit
 * the list (unknown field, index out of range) are skipped rather than failing,
 * so any history can be replayed onto any list.
 */
public final class FieldListApplier {

    private FieldListApplier() {
    }

    public static List<FormField> apply(List<FormField> fields, FieldOperation op) {
        List<FormField> result = new ArrayList<>(fields);
        if (op.type() == null) {
            return List.copyOf(result);
        }
        switch (op.type()) {
            case ADD -> {
                String id = op.targetFieldId();
                if (id != null && indexOf(result, id) < 0) {
                    int position = op.position() == null ? result.size() : clamp(op.position(), result.size());
                    result.add(position, new FormField(id, position, op.payload()));
                }
            }
            case UPDATE -> {
                int index = indexOf(result, op.targetFieldId());
                if (index >= 0) {
                    result.set(index, result.get(index).mergedWith(op.payload()));
                }
            }
            case DELETE -> {
                int index = indexOf(result, op.targetFieldId());
                if (index >= 0) {
                    result.remove(index);
                }
            }
            case REORDER -> {
                Integer from = op.fromIndex();
                Integer to = op.toIndex();
                if (from != null && to != null && from >= 0 && from < result.size() && to >= 0 && to < result.size()) {
                    FormField moved = result.remove((int) from);
                    result.add(to, moved);
                }
            }
        }
        return renumber(result);
    }

    public static List<FormField> replay(List<FormField> fields, List<FieldOperation> ops) {
        List<FormField> result = fields;
        for (FieldOperation op : ops) {
            result = apply(result, op);
        }
        return result;
    }

    private static List<FormField> renumber(List<FormField> fields) {
        List<FormField> numbered = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            numbered.add(fields.get(i).atPosition(i));
        }
        return List.copyOf(numbered);
    }

    private static int indexOf(List<FormField> fields, String fieldId) {
        if (fieldId == null) {
            return -1;
        }
        for (int i = 0; i < fields.size(); i++) {
            if (fieldId.equals(fields.get(i).id())) {
                return i;
            }
        }
        return -1;
    }

    private static int clamp(int position, int size) {
        return Math.max(0, Math.min(position, size));
    }
}
