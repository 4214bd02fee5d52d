package com.example.tokenauth.service;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScopeAuthorizerTest {

    @Test
    void testSubsetIsAuthorized() {
        assertTrue(ScopeAuthorizer.authorize(Set.of("storage.read", "storage.write"), Set.of("storage.read")));
        assertTrue(ScopeAuthorizer.authorize(Set.of("storage.read", "storage.write"),
            Set.of("storage.read", "storage.write")));
    }

    @Test
    void testMissingScopeIsDenied() {
        assertFalse(ScopeAuthorizer.authorize(Set.of("storage.read"), Set.of("storage.write")));
        assertFalse(ScopeAuthorizer.authorize(Set.of(), Set.of("storage.read")));
        assertFalse(ScopeAuthorizer.authorize(null, Set.of("storage.read")));
    }

    @Test
    void testEmptyRequirementAlwaysAuthorizes() {
        assertTrue(ScopeAuthorizer.authorize(Set.of("storage.read"), Set.of()));
        assertTrue(ScopeAuthorizer.authorize(Set.of(), Set.of()));
        assertTrue(ScopeAuthorizer.authorize(null, null));
    }

    @Test
    void testNoWildcardExpansion() {
        assertFalse(ScopeAuthorizer.authorize(Set.of("storage.*"), Set.of("storage.read")));
        assertTrue(ScopeAuthorizer.authorize(Set.of("storage.*"), Set.of("storage.*")));
    }

    @Test
    void testMissingScopes() {
        assertEquals(Set.of("admin"),
            ScopeAuthorizer.missingScopes(Set.of("storage.read"), Set.of("storage.read", "admin")));
    }
}
