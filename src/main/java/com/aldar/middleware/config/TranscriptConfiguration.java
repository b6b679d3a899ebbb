package com.aldar.middleware.config;

import com.aldar.middleware.cache.CachingAgentDirectory;
import com.aldar.middleware.cache.ExpiringCache;
import com.aldar.middleware.store.AgentDirectoryStore;
import com.aldar.middleware.stream.InMemoryStreamMarkerStore;
import com.aldar.middleware.stream.RedisStreamMarkerStore;
import com.aldar.middleware.transcript.source.AgentDirectory;
import com.aldar.middleware.transcript.source.StreamMarkerStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties({
        TranscriptProperties.class,
        OrchestrationProperties.class,
        LedgerProperties.class,
        StreamMarkerProperties.class,
        AppAuthProperties.class
})
public class TranscriptConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Primary
    public AgentDirectory agentDirectory(AgentDirectoryStore store, TranscriptProperties properties, Clock clock) {
        TranscriptProperties.AgentCacheProperties cache = properties.getAgentCache();
        return new CachingAgentDirectory(
                store,
                new ExpiringCache<>(clock, cache.getTtl(), cache.getMaxEntries()),
                new ExpiringCache<>(clock, cache.getTtl(), cache.getMaxEntries())
        );
    }

    @Bean
    @ConditionalOnProperty(prefix = "stream-marker", name = "store", havingValue = "redis", matchIfMissing = true)
    public StreamMarkerStore redisStreamMarkerStore(StringRedisTemplate redisTemplate, StreamMarkerProperties properties) {
        return new RedisStreamMarkerStore(redisTemplate, properties);
    }

    @Bean
    @ConditionalOnProperty(prefix = "stream-marker", name = "store", havingValue = "memory")
    public InMemoryStreamMarkerStore inMemoryStreamMarkerStore(StreamMarkerProperties properties, Clock clock) {
        return new InMemoryStreamMarkerStore(clock, properties.getMemoryTtl());
    }
}
