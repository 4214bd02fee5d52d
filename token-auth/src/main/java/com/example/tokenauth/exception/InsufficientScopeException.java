package com.example.tokenauth.exception;

import lombok.Getter;

import java.util.Set;

@Getter
public class InsufficientScopeException extends RuntimeException {

    private final Set<String> missingScopes;

    public InsufficientScopeException(Set<String> missingScopes) {
        super("Missing required scopes: " + missingScopes);
        this.missingScopes = Set.copyOf(missingScopes);
    }
}
