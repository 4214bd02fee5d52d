package com.example.tokenauth.service;

import com.example.tokenauth.dto.TokenResponse;
import com.example.tokenauth.exception.InvalidTokenException;
import com.example.tokenauth.storage.InMemoryTokenStorage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TokenManagerConcurrencyTest {

    @Test
    void testConcurrentRefreshOfSameTokenHasSingleWinner() throws Exception {
        InMemoryTokenStorage storage = new InMemoryTokenStorage();
        TokenManager tokenManager = new TokenManager(3600, 86400, storage);
        TokenResponse original = tokenManager.generateToken("user123", Set.of("read"));

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<TokenResponse>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return tokenManager.refreshToken(original.getRefreshToken());
                }));
            }
            start.countDown();

            List<TokenResponse> winners = new ArrayList<>();
            int rejected = 0;
            for (Future<TokenResponse> result : results) {
                try {
                    winners.add(result.get(5, TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    assertInstanceOf(InvalidTokenException.class, e.getCause());
                    rejected++;
                }
            }

            assertEquals(1, winners.size());
            assertEquals(threads - 1, rejected);
            assertEquals("user123", tokenManager.validateToken(winners.get(0).getAccessToken()).getUserId());
            // only the winning pair is left
            assertEquals(2, storage.size());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testConcurrentGenerateProducesDistinctTokens() throws Exception {
        TokenManager tokenManager = TokenManager.inMemory();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<TokenResponse>> results = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                String userId = "user" + i;
                results.add(executor.submit(() -> tokenManager.generateToken(userId)));
            }

            for (int i = 0; i < results.size(); i++) {
                TokenResponse tokens = results.get(i).get(5, TimeUnit.SECONDS);
                assertEquals("user" + i, tokenManager.validateToken(tokens.getAccessToken()).getUserId());
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
