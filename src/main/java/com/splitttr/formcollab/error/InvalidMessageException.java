package com.splitttr.formcollab.error;

public class InvalidMessageException extends CollaborationException {

    public InvalidMessageException(String message) {
        super(message);
    }

    public InvalidMessageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "invalid_message";
    }
}
