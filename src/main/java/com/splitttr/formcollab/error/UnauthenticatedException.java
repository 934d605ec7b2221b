package com.splitttr.formcollab.error;

public class UnauthenticatedException extends CollaborationException {

    public UnauthenticatedException(String message) {
        super(message);
    }

    public UnauthenticatedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "unauthenticated";
    }
}
