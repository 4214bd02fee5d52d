package com.example.tokenauth.support;

import java.util.Optional;

/**
 * Pulls the raw token out of an {@code Authorization} header value. Web
 * adapters call this and hand the result to the token manager.
 */
public final class BearerTokenResolver {

    public static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";

    private BearerTokenResolver() {
    }

    public static Optional<String> resolve(String authorizationHeader) {
        if (authorizationHeader == null) {
            return Optional.empty();
        }
        String header = authorizationHeader.trim();
        if (!header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Optional.empty();
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
