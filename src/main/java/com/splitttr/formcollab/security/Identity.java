package com.splitttr.formcollab.security;

import java.time.Instant;

/**
 * A verified user, bound to one connection for the connection's lifetime.
 */
public record Identity(String userId, String displayName, String email, Instant expiresAt) {

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
