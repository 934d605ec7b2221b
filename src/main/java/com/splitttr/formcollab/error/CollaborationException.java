package com.splitttr.formcollab.error;

/**
 * Base for failures that are reported back to the offending connection.
 * {@link #code()} is the stable value sent in the {@code reason} of an
 * {@code error} message.
 */
public abstract class CollaborationException extends RuntimeException {

    protected CollaborationException(String message) {
        super(message);
    }

    protected CollaborationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String code();
}
