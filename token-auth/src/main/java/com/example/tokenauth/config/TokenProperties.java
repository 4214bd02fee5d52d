package com.example.tokenauth.config;

import com.example.tokenauth.service.TokenManager;
import com.example.tokenauth.storage.RedisTokenStorage;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * {@code token.*} settings. TTLs without a unit are read as seconds.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "token")
public class TokenProperties {

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration accessTtl = Duration.ofSeconds(TokenManager.DEFAULT_ACCESS_TTL_SECONDS);

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration refreshTtl = Duration.ofSeconds(TokenManager.DEFAULT_REFRESH_TTL_SECONDS);

    private final Storage storage = new Storage();

    public enum StorageType {
        MEMORY,
        REDIS
    }

    @Getter
    @Setter
    public static class Storage {

        private StorageType type = StorageType.MEMORY;

        private final Redis redis = new Redis();
    }

    @Getter
    @Setter
    public static class Redis {

        private String host = "localhost";

        private int port = 6379;

        private String password;

        private String keyPrefix = RedisTokenStorage.DEFAULT_KEY_PREFIX;

        private Duration timeout = Duration.ofSeconds(2);
    }
}
