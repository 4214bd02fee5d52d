package com.example.tokenauth.support;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BearerTokenResolverTest {

    @Test
    void testResolvesBearerToken() {
        assertEquals(Optional.of("abc_DEF-123"), BearerTokenResolver.resolve("Bearer abc_DEF-123"));
    }

    @Test
    void testSchemeIsCaseInsensitiveAndWhitespaceTrimmed() {
        assertEquals(Optional.of("abc"), BearerTokenResolver.resolve("  bearer   abc  "));
    }

    @Test
    void testRejectsMissingOrForeignSchemes() {
        assertTrue(BearerTokenResolver.resolve(null).isEmpty());
        assertTrue(BearerTokenResolver.resolve("").isEmpty());
        assertTrue(BearerTokenResolver.resolve("Bearer").isEmpty());
        assertTrue(BearerTokenResolver.resolve("Bearer    ").isEmpty());
        assertTrue(BearerTokenResolver.resolve("Basic dXNlcjpwYXNz").isEmpty());
        assertTrue(BearerTokenResolver.resolve("abc").isEmpty());
    }
}
