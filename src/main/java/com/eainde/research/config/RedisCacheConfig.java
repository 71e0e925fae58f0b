package com.eainde.research.config;

import com.eainde.research.cache.CacheStore;
import com.eainde.research.cache.RedisCacheStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Host and port come from {@code spring.data.redis.*}.
 */
@Configuration
@ConditionalOnProperty(name = "research.cache.backend", havingValue = "redis")
public class RedisCacheConfig {

    @Bean
    public CacheStore cacheStore(StringRedisTemplate template, ResearchProperties properties) {
        return new RedisCacheStore(template, properties.getCache().getKeyPrefix());
    }
}
