package com.splitttr.formcollab.websocket;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CollaborationSocketTest {

    @Test
    void token_prefersAuthorizationHeader() {
        assertEquals("Bearer h", CollaborationSocket.extractToken("Bearer h", "access_token=q"));
    }

    @Test
    void token_fallsBackToQueryParameter() {
        assertEquals("a.b+c", CollaborationSocket.extractToken(null, "lang=en&access_token=a.b%2Bc"));
    }

    @Test
    void token_missingEverywhere() {
        assertNull(CollaborationSocket.extractToken("", "lang=en"));
        assertNull(CollaborationSocket.extractToken(null, null));
    }
}
