package com.propertyprice.map.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Response state store selection.
 *
 * app.state-store.type:
 * - redis (default): shared across instances, survives restarts
 * - memory: per-instance map swept of expired entries, for local runs and tests
 */
@Configuration
public class StateStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "app.state-store.type", havingValue = "redis", matchIfMissing = true)
    public RedisResponseStateStore redisResponseStateStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        return new RedisResponseStateStore(redisTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "app.state-store.type", havingValue = "memory")
    public InMemoryResponseStateStore inMemoryResponseStateStore(
            Clock clock,
            @Value("${app.state-store.sweep-interval-seconds:60}") long sweepIntervalSeconds) {
        return new InMemoryResponseStateStore(clock, Duration.ofSeconds(sweepIntervalSeconds));
    }
}
