package com.splitttr.formcollab.session;

public enum LeaveReason {
    LEFT("left"),
    DISCONNECTED("disconnected"),
    IDLE("idle");

    private final String code;

    LeaveReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
