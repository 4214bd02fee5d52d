package com.example.tokenauth.config;

import com.example.tokenauth.service.TokenManager;
import com.example.tokenauth.storage.TokenStorage;
import com.example.tokenauth.util.TokenCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(TokenProperties.class)
public class TokenAuthConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenManager tokenManager(TokenProperties properties,
                                     TokenStorage tokenStorage,
                                     TokenCodec tokenCodec,
                                     Clock clock) {
        long accessTtl = properties.getAccessTtl().getSeconds();
        long refreshTtl = properties.getRefreshTtl().getSeconds();
        log.info("Token manager using {} storage (access TTL: {} s, refresh TTL: {} s)",
            properties.getStorage().getType(), accessTtl, refreshTtl);
        return new TokenManager(accessTtl, refreshTtl, tokenStorage, tokenCodec, clock);
    }
}
