package com.splitttr.formcollab.error;

public class AccessDeniedException extends CollaborationException {

    public AccessDeniedException() {
        super("Access denied");
    }

    @Override
    public String code() {
        return "access_denied";
    }
}
