package com.example.tokenauth.entity;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Instant;
import java.util.Set;

/**
 * Server-side state of one issued token, stored under its digest.
 * <p>
 * Records are written once and never updated in place: rotation replaces the
 * whole pair and revocation removes the record.
 */
@Value
@Builder
@Jacksonized
public class TokenRecord implements Serializable {

    String digest;
    String userId;
    Set<String> scopes;
    TokenKind kind;
    Instant issuedAt;
    Instant expiresAt;

    // digest of the opposite-kind token minted in the same generation
    String linkedDigest;

    long generation;

    public boolean isLiveAt(Instant now) {
        return now.isBefore(expiresAt);
    }
}
