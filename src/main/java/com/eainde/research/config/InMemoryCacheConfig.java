package com.eainde.research.config;

import com.eainde.research.cache.CacheStore;
import com.eainde.research.cache.InMemoryCacheStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@ConditionalOnProperty(name = "research.cache.backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryCacheConfig {

    @Bean
    public CacheStore cacheStore(ResearchProperties properties, Clock clock) {
        return new InMemoryCacheStore(properties.getCache().getKeyPrefix(), clock);
    }
}
