package com.splitttr.formcollab.security;

import java.util.Set;

/**
 * Who may join a form: its owner and the users it is shared with.
 */
public record FormAccess(String ownerId, Set<String> editorIds) {

    public FormAccess {
        editorIds = editorIds == null ? Set.of() : Set.copyOf(editorIds);
    }

    public boolean permits(String userId) {
        return userId != null && (userId.equals(ownerId) || editorIds.contains(userId));
    }
}
