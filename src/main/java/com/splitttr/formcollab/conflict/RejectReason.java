package com.splitttr.formcollab.conflict;

public enum RejectReason {
    FIELD_DELETED("field_deleted"),
    FIELD_NOT_FOUND("field_not_found"),
    DUPLICATE_FIELD("duplicate_field"),
    STALE_UPDATE("stale_update"),
    REORDER_CONFLICT("reorder_conflict"),
    INDEX_OUT_OF_RANGE("index_out_of_range"),
    INVALID_OPERATION("invalid_operation");

    private final String code;

    RejectReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
