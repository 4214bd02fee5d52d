package com.example.tokenauth.config;

import com.example.tokenauth.entity.TokenRecord;
import com.example.tokenauth.storage.RedisTokenStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

@Configuration
@ConditionalOnProperty(prefix = "token.storage", name = "type", havingValue = "redis")
public class RedisConfig {

    @Bean
    public RedisConnectionFactory tokenRedisConnectionFactory(TokenProperties properties) {
        TokenProperties.Redis redis = properties.getStorage().getRedis();

        RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration();
        redisConfig.setHostName(redis.getHost());
        redisConfig.setPort(redis.getPort());
        if (redis.getPassword() != null && !redis.getPassword().isEmpty()) {
            redisConfig.setPassword(RedisPassword.of(redis.getPassword()));
        }

        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
            .commandTimeout(redis.getTimeout())
            .build();
        return new LettuceConnectionFactory(redisConfig, clientConfig);
    }

    @Bean
    public RedisTemplate<String, TokenRecord> tokenRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, TokenRecord> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(tokenRecordSerializer());

        template.afterPropertiesSet();
        return template;
    }

    @Bean
    public RedisTokenStorage redisTokenStorage(RedisTemplate<String, TokenRecord> tokenRedisTemplate,
                                               TokenProperties properties) {
        return new RedisTokenStorage(tokenRedisTemplate, properties.getStorage().getRedis().getKeyPrefix());
    }

    static Jackson2JsonRedisSerializer<TokenRecord> tokenRecordSerializer() {
        // Instants as ISO-8601 strings
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return new Jackson2JsonRedisSerializer<>(objectMapper, TokenRecord.class);
    }
}
