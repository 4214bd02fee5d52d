package com.example.tokenauth.service;

import com.example.tokenauth.dto.TokenInfo;
import com.example.tokenauth.dto.TokenResponse;
import com.example.tokenauth.entity.TokenKind;
import com.example.tokenauth.entity.TokenRecord;
import com.example.tokenauth.exception.InvalidTokenException;
import com.example.tokenauth.storage.InMemoryTokenStorage;
import com.example.tokenauth.storage.TokenStorage;
import com.example.tokenauth.util.TokenCodec;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Issues, validates, rotates and revokes opaque access/refresh token pairs.
 * <p>
 * The manager keeps no state besides its configuration: every answer comes
 * from a fresh storage lookup, so managers sharing one storage see each
 * other's revocations and rotations immediately. Storage failures are never
 * retried here and reach the caller as
 * {@link com.example.tokenauth.exception.TokenStorageException}.
 * <p>
 * Revocation does not cascade. Revoking an access token leaves its refresh
 * token usable and the other way round; callers ending a whole session use
 * {@link #revokeTokenPair(String, String)}.
 */
@Slf4j
public class TokenManager {

    public static final long DEFAULT_ACCESS_TTL_SECONDS = 3600;
    public static final long DEFAULT_REFRESH_TTL_SECONDS = 86400;
    public static final String TOKEN_TYPE = "Bearer";

    private static final long INITIAL_GENERATION = 1;

    private final long accessTtlSeconds;
    private final long refreshTtlSeconds;
    private final TokenStorage storage;
    private final TokenCodec codec;
    private final Clock clock;

    public TokenManager(long accessTtlSeconds, long refreshTtlSeconds, TokenStorage storage) {
        this(accessTtlSeconds, refreshTtlSeconds, storage, new TokenCodec(), Clock.systemUTC());
    }

    public TokenManager(long accessTtlSeconds,
                        long refreshTtlSeconds,
                        TokenStorage storage,
                        TokenCodec codec,
                        Clock clock) {
        if (accessTtlSeconds <= 0) {
            throw new IllegalArgumentException("accessTtlSeconds must be positive: " + accessTtlSeconds);
        }
        if (refreshTtlSeconds <= 0) {
            throw new IllegalArgumentException("refreshTtlSeconds must be positive: " + refreshTtlSeconds);
        }
        if (storage == null) {
            throw new IllegalArgumentException("storage must not be null");
        }
        if (codec == null || clock == null) {
            throw new IllegalArgumentException("codec and clock must not be null");
        }
        this.accessTtlSeconds = accessTtlSeconds;
        this.refreshTtlSeconds = refreshTtlSeconds;
        this.storage = storage;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * Manager with default TTLs over a private in-memory storage.
     */
    public static TokenManager inMemory() {
        return new TokenManager(DEFAULT_ACCESS_TTL_SECONDS, DEFAULT_REFRESH_TTL_SECONDS, new InMemoryTokenStorage());
    }

    public TokenResponse generateToken(String userId) {
        return generateToken(userId, Collections.emptySet());
    }

    /**
     * Mints a new access/refresh pair for the user.
     *
     * @param userId non-blank user identifier
     * @param scopes granted scopes; {@code null} means none, duplicates collapse
     * @return the raw tokens; their digests are what gets stored
     * @throws IllegalArgumentException if {@code userId} or a scope is blank
     */
    public TokenResponse generateToken(String userId, Collection<String> scopes) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        TokenResponse response = issuePair(userId, normalizeScopes(scopes), INITIAL_GENERATION);
        log.info("Generated new token pair for user: {}", userId);
        return response;
    }

    /**
     * Looks the token up and checks that it has not expired. Accepts both
     * kinds; the returned {@link TokenInfo#getKind()} tells them apart.
     *
     * @throws InvalidTokenException if the token is malformed, unknown or expired
     */
    public TokenInfo validateToken(String rawToken) {
        return toInfo(requireLive(rawToken));
    }

    /**
     * Same as {@link #validateToken(String)} but also rejects refresh tokens.
     */
    public TokenInfo validateAccessToken(String rawToken) {
        TokenRecord record = requireLive(rawToken);
        if (record.getKind() != TokenKind.ACCESS) {
            throw reject("refresh token presented as access token");
        }
        return toInfo(record);
    }

    /**
     * Consumes a refresh token and issues the next generation of the pair.
     * <p>
     * The presented refresh record and its linked access record are removed,
     * so the old access token stops working before its own TTL. A refresh
     * token can be consumed once: when two callers race with the same token
     * only one of them gets a new pair.
     *
     * @throws InvalidTokenException if the token is not a live refresh token;
     *                               nothing is modified in that case
     */
    public TokenResponse refreshToken(String rawRefreshToken) {
        TokenRecord presented = requireLive(rawRefreshToken);
        if (presented.getKind() != TokenKind.REFRESH) {
            throw reject("access token presented for refresh");
        }

        TokenRecord consumed = storage.take(presented.getDigest())
            .filter(record -> record.getKind() == TokenKind.REFRESH)
            .orElseThrow(() -> reject("refresh token already consumed"));

        if (consumed.getLinkedDigest() != null) {
            storage.delete(consumed.getLinkedDigest());
        }

        long generation = consumed.getGeneration() + 1;
        TokenResponse response = issuePair(consumed.getUserId(), consumed.getScopes(), generation);
        log.info("Refreshed token pair for user: {} (generation {})", consumed.getUserId(), generation);
        return response;
    }

    /**
     * Deletes the record of this single token. Unknown, expired and malformed
     * tokens are ignored, so the call is idempotent.
     */
    public void revokeToken(String rawToken) {
        if (!codec.isWellFormed(rawToken)) {
            log.debug("Ignored revocation of malformed token");
            return;
        }
        String digest = codec.digest(rawToken);
        storage.delete(digest);
        log.info("Revoked token {}", TokenCodec.fingerprint(digest));
    }

    public void revokeTokenPair(String rawAccessToken, String rawRefreshToken) {
        revokeToken(rawAccessToken);
        revokeToken(rawRefreshToken);
    }

    public long getAccessTtlSeconds() {
        return accessTtlSeconds;
    }

    public long getRefreshTtlSeconds() {
        return refreshTtlSeconds;
    }

    private TokenRecord requireLive(String rawToken) {
        if (!codec.isWellFormed(rawToken)) {
            throw reject("malformed token");
        }
        String digest = codec.digest(rawToken);
        TokenRecord record = storage.get(digest)
            .orElseThrow(() -> reject("unknown token " + TokenCodec.fingerprint(digest)));
        if (!record.isLiveAt(clock.instant())) {
            throw reject("expired token " + TokenCodec.fingerprint(digest));
        }
        return record;
    }

    private TokenResponse issuePair(String userId, Set<String> scopes, long generation) {
        String accessToken = codec.newSecret();
        String refreshToken = codec.newSecret();
        String accessDigest = codec.digest(accessToken);
        String refreshDigest = codec.digest(refreshToken);
        Instant issuedAt = clock.instant();

        TokenRecord access = TokenRecord.builder()
            .digest(accessDigest)
            .userId(userId)
            .scopes(scopes)
            .kind(TokenKind.ACCESS)
            .issuedAt(issuedAt)
            .expiresAt(issuedAt.plusSeconds(accessTtlSeconds))
            .linkedDigest(refreshDigest)
            .generation(generation)
            .build();

        TokenRecord refresh = TokenRecord.builder()
            .digest(refreshDigest)
            .userId(userId)
            .scopes(scopes)
            .kind(TokenKind.REFRESH)
            .issuedAt(issuedAt)
            .expiresAt(issuedAt.plusSeconds(refreshTtlSeconds))
            .linkedDigest(accessDigest)
            .generation(generation)
            .build();

        storage.put(accessDigest, access, accessTtlSeconds);
        storage.put(refreshDigest, refresh, refreshTtlSeconds);

        return TokenResponse.builder()
            .accessToken(accessToken)
            .refreshToken(refreshToken)
            .expiresIn(accessTtlSeconds)
            .tokenType(TOKEN_TYPE)
            .build();
    }

    private static Set<String> normalizeScopes(Collection<String> scopes) {
        if (scopes == null || scopes.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String scope : scopes) {
            if (scope == null || scope.isBlank()) {
                throw new IllegalArgumentException("scopes must not contain blank values");
            }
            normalized.add(scope);
        }
        return Collections.unmodifiableSet(normalized);
    }

    private static TokenInfo toInfo(TokenRecord record) {
        Set<String> scopes = record.getScopes() == null ? Set.of() : Set.copyOf(record.getScopes());
        return TokenInfo.builder()
            .userId(record.getUserId())
            .scopes(scopes)
            .kind(record.getKind())
            .expiresAt(record.getExpiresAt())
            .build();
    }

    private static InvalidTokenException reject(String reason) {
        log.debug("Token rejected: {}", reason);
        return new InvalidTokenException();
    }
}
