package com.example.tokenauth.storage;

import com.example.tokenauth.entity.TokenRecord;
import com.example.tokenauth.exception.TokenStorageException;
import com.example.tokenauth.util.TokenCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Token storage on Redis, using native key expiry.
 * <p>
 * Keys are {@code keyPrefix + digest}. Connection, timeout and serialization
 * problems are rethrown as {@link TokenStorageException}.
 */
@Slf4j
public class RedisTokenStorage implements TokenStorage {

    public static final String DEFAULT_KEY_PREFIX = "token:";

    private final RedisTemplate<String, TokenRecord> redisTemplate;
    private final String keyPrefix;

    public RedisTokenStorage(RedisTemplate<String, TokenRecord> redisTemplate) {
        this(redisTemplate, DEFAULT_KEY_PREFIX);
    }

    public RedisTokenStorage(RedisTemplate<String, TokenRecord> redisTemplate, String keyPrefix) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate");
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public void put(String key, TokenRecord record, long ttlSeconds) {
        Objects.requireNonNull(record, "record");
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive: " + ttlSeconds);
        }
        try {
            redisTemplate.opsForValue().set(redisKey(key), record, Duration.ofSeconds(ttlSeconds));
        } catch (DataAccessException | SerializationException e) {
            throw new TokenStorageException("Failed to store token record", e);
        }
        log.debug("Saved token record {} with TTL: {} s", TokenCodec.fingerprint(key), ttlSeconds);
    }

    @Override
    public Optional<TokenRecord> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(redisKey(key)));
        } catch (DataAccessException | SerializationException e) {
            throw new TokenStorageException("Failed to read token record", e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(redisKey(key));
        } catch (DataAccessException e) {
            throw new TokenStorageException("Failed to delete token record", e);
        }
        log.debug("Deleted token record {}", TokenCodec.fingerprint(key));
    }

    /**
     * Uses GETDEL, so the read and the removal are one atomic Redis command.
     */
    @Override
    public Optional<TokenRecord> take(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().getAndDelete(redisKey(key)));
        } catch (DataAccessException | SerializationException e) {
            throw new TokenStorageException("Failed to take token record", e);
        }
    }

    private String redisKey(String key) {
        return keyPrefix + Objects.requireNonNull(key, "key");
    }
}
