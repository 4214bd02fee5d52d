package com.example.tokenauth.storage;

import com.example.tokenauth.entity.TokenRecord;
import com.example.tokenauth.util.TokenCodec;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-process token storage.
 * <p>
 * All operations on the map run under one lock, so put/get/delete/take are
 * linearizable within this JVM. Expiry is checked against the stored deadline
 * on every read; {@link #purgeExpired()} only reclaims memory.
 * <p>
 * State is not shared between instances or processes. Two token managers
 * with separate in-memory storages never see each other's tokens; deployments
 * with more than one node need {@link RedisTokenStorage}.
 */
@Slf4j
public class InMemoryTokenStorage implements TokenStorage {

    private final Map<String, Entry> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    public InMemoryTokenStorage() {
        this(Clock.systemUTC());
    }

    public InMemoryTokenStorage(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void put(String key, TokenRecord record, long ttlSeconds) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(record, "record");
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive: " + ttlSeconds);
        }

        Instant deadline = clock.instant().plusSeconds(ttlSeconds);
        lock.lock();
        try {
            entries.put(key, new Entry(record, deadline));
        } finally {
            lock.unlock();
        }
        log.debug("Stored token record {} for {} seconds", TokenCodec.fingerprint(key), ttlSeconds);
    }

    @Override
    public Optional<TokenRecord> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(liveEntry(key)).map(Entry::record);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String key) {
        if (key == null) {
            return;
        }
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<TokenRecord> take(String key) {
        if (key == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            Entry entry = liveEntry(key);
            if (entry == null) {
                return Optional.empty();
            }
            entries.remove(key);
            return Optional.of(entry.record());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every expired entry.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        lock.lock();
        try {
            Iterator<Entry> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpiredAt(now)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        return removed;
    }

    /**
     * Number of physically held entries, expired ones included.
     */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private Entry liveEntry(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpiredAt(clock.instant())) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    private record Entry(TokenRecord record, Instant deadline) {

        boolean isExpiredAt(Instant now) {
            return !now.isBefore(deadline);
        }
    }
}
