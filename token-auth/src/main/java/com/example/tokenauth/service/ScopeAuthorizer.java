package com.example.tokenauth.service;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Exact-match scope checks. No wildcards or hierarchy: {@code storage.*}
 * grants nothing but the literal string {@code storage.*}.
 */
public final class ScopeAuthorizer {

    private ScopeAuthorizer() {
    }

    /**
     * @return true if every required scope is granted; an empty requirement
     *         always passes
     */
    public static boolean authorize(Collection<String> grantedScopes, Collection<String> requiredScopes) {
        return missingScopes(grantedScopes, requiredScopes).isEmpty();
    }

    public static Set<String> missingScopes(Collection<String> grantedScopes, Collection<String> requiredScopes) {
        if (requiredScopes == null || requiredScopes.isEmpty()) {
            return Set.of();
        }
        Collection<String> granted = grantedScopes == null ? Set.of() : grantedScopes;
        return requiredScopes.stream()
            .filter(scope -> !granted.contains(scope))
            .collect(Collectors.toUnmodifiableSet());
    }
}
