package com.example.tokenauth.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodically reclaims expired entries of the in-memory storage.
 * Reads already ignore expired entries; this only bounds memory use.
 */
@Slf4j
@RequiredArgsConstructor
public class InMemoryStorageSweeper {

    private final InMemoryTokenStorage storage;

    @Scheduled(fixedDelayString = "${token.storage.memory.sweep-interval-ms:60000}")
    public void sweep() {
        int removed = storage.purgeExpired();
        if (removed > 0) {
            log.debug("Purged {} expired token records, {} remaining", removed, storage.size());
        }
    }
}
