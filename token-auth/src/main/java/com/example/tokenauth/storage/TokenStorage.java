package com.example.tokenauth.storage;

import com.example.tokenauth.entity.TokenRecord;

import java.util.Optional;

/**
 * Key-value store for token records with per-key expiry.
 * <p>
 * Keys are token digests. Implementations must not interpret record contents
 * and must report infrastructure failures as
 * {@link com.example.tokenauth.exception.TokenStorageException}, never as a
 * missing key.
 */
public interface TokenStorage {

    /**
     * Stores the record under {@code key}, replacing any previous value. The key
     * becomes inaccessible after {@code ttlSeconds}.
     */
    void put(String key, TokenRecord record, long ttlSeconds);

    /**
     * Returns the record if present and not expired by the backend's own clock.
     */
    Optional<TokenRecord> get(String key);

    /**
     * Removes the key. Deleting an absent key is not an error.
     */
    void delete(String key);

    /**
     * Reads and removes the key in one step, so that of several concurrent
     * callers at most one receives the record.
     * <p>
     * The default implementation is not atomic; backends that can do better
     * override it.
     */
    default Optional<TokenRecord> take(String key) {
        Optional<TokenRecord> record = get(key);
        if (record.isPresent()) {
            delete(key);
        }
        return record;
    }
}
