package com.example.tokenauth.config;

import com.example.tokenauth.storage.InMemoryStorageSweeper;
import com.example.tokenauth.storage.InMemoryTokenStorage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@ConditionalOnProperty(prefix = "token.storage", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryStorageConfig {

    @Bean
    public InMemoryTokenStorage inMemoryTokenStorage(Clock clock) {
        return new InMemoryTokenStorage(clock);
    }

    @Bean
    public InMemoryStorageSweeper inMemoryStorageSweeper(InMemoryTokenStorage storage) {
        return new InMemoryStorageSweeper(storage);
    }
}
