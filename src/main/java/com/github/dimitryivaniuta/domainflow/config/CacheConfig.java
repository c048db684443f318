package com.github.dimitryivaniuta.domainflow.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.domainflow.service.progress.ProgressSnapshot;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis cache for progress snapshots.
 *
 * <p>Postgres holds the authoritative counters; the cache only serves reads. The manager is
 * transaction-aware, so evictions issued while counters change take effect after commit. With
 * {@code app.cache.enabled=false} Boot falls back to whatever {@code spring.cache.type} says.</p>
 */
@Configuration
@ConditionalOnProperty(prefix = "app.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CacheConfig {

    /**
     * Cache of {@link ProgressSnapshot} keyed by campaign id.
     */
    public static final String PROGRESS_CACHE = "campaignProgress";

    /**
     * Cache manager using Redis with JSON values.
     *
     * @param factory      redis connection factory
     * @param objectMapper mapper for value serialization
     * @param props        app properties (snapshot TTL)
     * @return cache manager
     */
    @Bean
    public RedisCacheManager cacheManager(
            RedisConnectionFactory factory,
            @Qualifier("canonicalObjectMapper") ObjectMapper objectMapper,
            AppProperties props
    ) {
        var snapshotSerializer = new Jackson2JsonRedisSerializer<>(objectMapper, ProgressSnapshot.class);

        var defaultCfg = RedisCacheConfiguration.defaultCacheConfig()
                .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()));

        var progressCfg = defaultCfg
                .entryTtl(props.getCache().getSnapshotTtl())
                .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(snapshotSerializer));

        return RedisCacheManager.builder(factory)
                .cacheDefaults(defaultCfg)
                .withCacheConfiguration(PROGRESS_CACHE, progressCfg)
                .transactionAware()
                .build();
    }
}
