package com.example.tokenauth.dto;

import com.example.tokenauth.entity.TokenKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Result of a successful validation. {@code kind} is exposed so callers can
 * refuse a refresh token presented where an access token is expected.
 */
@Value
@Builder
public class TokenInfo {

    String userId;
    Set<String> scopes;
    TokenKind kind;
    Instant expiresAt;
}
