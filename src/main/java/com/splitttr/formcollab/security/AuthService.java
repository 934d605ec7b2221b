package com.splitttr.formcollab.security;

import com.splitttr.formcollab.error.UnauthenticatedException;
import io.smallrye.jwt.auth.principal.JWTParser;
import io.smallrye.jwt.auth.principal.ParseException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.JsonString;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Verifies access tokens issued by the identity provider. Signature, issuer and
 * expiry checks are done by SmallRye JWT using the {@code mp.jwt.verify.*} settings.
 */
@ApplicationScoped
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    private static final String BEARER_PREFIX = "Bearer ";

    @Inject
    JWTParser parser;

    public Identity authenticate(String rawToken) {
        String token = stripBearer(rawToken);
        if (token == null) {
            throw new UnauthenticatedException("Authentication required");
        }

        JsonWebToken jwt;
        try {
            jwt = parser.parse(token);
        } catch (ParseException e) {
            log.debug("Token rejected: {}", e.getMessage());
            throw new UnauthenticatedException("Invalid or expired token", e);
        }

        String userId = jwt.getSubject();
        if (userId == null || userId.isBlank()) {
            throw new UnauthenticatedException("Token missing sub claim");
        }
        long exp = jwt.getExpirationTime();
        return new Identity(
            userId,
            displayName(jwt),
            stringClaim(jwt, "email"),
            exp > 0 ? Instant.ofEpochSecond(exp) : null
        );
    }

    /**
     * Display name: the {@code name} claim, else the local part of the email,
     * else the principal name, else the subject.
     */
    static String displayName(JsonWebToken jwt) {
        String name = stringClaim(jwt, "name");
        if (name != null && !name.isBlank()) {
            return name;
        }
        String email = stringClaim(jwt, "email");
        if (email != null && email.contains("@")) {
            return email.substring(0, email.indexOf('@'));
        }
        String principal = jwt.getName();
        return principal != null && !principal.isBlank() ? principal : jwt.getSubject();
    }

    static String stripBearer(String rawToken) {
        if (rawToken == null) {
            return null;
        }
        String token = rawToken.strip();
        if (token.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            token = token.substring(BEARER_PREFIX.length()).strip();
        }
        return token.isEmpty() ? null : token;
    }

    private static String stringClaim(JsonWebToken jwt, String claim) {
        Object value = jwt.getClaim(claim);
        if (value == null) {
            return null;
        }
        return value instanceof JsonString json ? json.getString() : value.toString();
    }
}
