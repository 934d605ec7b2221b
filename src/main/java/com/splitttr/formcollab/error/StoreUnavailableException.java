package com.splitttr.formcollab.error;

/**
 * The form store could not be reached while opening a room. The join can be retried.
 */
public class StoreUnavailableException extends CollaborationException {

    public StoreUnavailableException(String documentId, Throwable cause) {
        super("Form " + documentId + " is temporarily unavailable", cause);
    }

    @Override
    public String code() {
        return "store_unavailable";
    }
}
