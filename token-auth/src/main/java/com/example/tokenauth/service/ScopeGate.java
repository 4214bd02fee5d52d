package com.example.tokenauth.service;

import com.example.tokenauth.dto.TokenInfo;
import com.example.tokenauth.exception.InsufficientScopeException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Route-level guard for a fixed set of required scopes, applied to the
 * result of {@link TokenManager#validateToken(String)}.
 */
public final class ScopeGate {

    private final Set<String> requiredScopes;

    private ScopeGate(Set<String> requiredScopes) {
        this.requiredScopes = requiredScopes;
    }

    public static ScopeGate requiring(String... scopes) {
        return requiring(Arrays.asList(scopes));
    }

    public static ScopeGate requiring(Collection<String> scopes) {
        Objects.requireNonNull(scopes, "scopes");
        for (String scope : scopes) {
            if (scope == null || scope.isBlank()) {
                throw new IllegalArgumentException("required scopes must not contain blank values");
            }
        }
        return new ScopeGate(Set.copyOf(scopes));
    }

    public boolean allows(TokenInfo tokenInfo) {
        return tokenInfo != null && ScopeAuthorizer.authorize(tokenInfo.getScopes(), requiredScopes);
    }

    /**
     * @return the same token info, for chaining
     * @throws InsufficientScopeException if a required scope is missing
     */
    public TokenInfo check(TokenInfo tokenInfo) {
        Objects.requireNonNull(tokenInfo, "tokenInfo");
        Set<String> missing = ScopeAuthorizer.missingScopes(tokenInfo.getScopes(), requiredScopes);
        if (!missing.isEmpty()) {
            throw new InsufficientScopeException(missing);
        }
        return tokenInfo;
    }

    public Set<String> getRequiredScopes() {
        return requiredScopes;
    }
}
