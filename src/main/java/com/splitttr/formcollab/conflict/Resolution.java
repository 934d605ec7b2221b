package com.splitttr.formcollab.conflict;

import com.splitttr.formcollab.message.FieldOperation;

/**
 * Outcome of resolving one incoming operation against the recent history.
 */
public sealed interface Resolution {

    /** The operation to apply, or the rejected operation as submitted. */
    FieldOperation operation();

    default boolean applied() {
        return !(this instanceof Rejected);
    }

    record Accepted(FieldOperation operation) implements Resolution {}

    /** Accepted after adjustment; {@code original} is the operation as submitted. */
    record Merged(FieldOperation operation, FieldOperation original) implements Resolution {}

    record Rejected(FieldOperation operation, RejectReason reason, String detail) implements Resolution {}
}
