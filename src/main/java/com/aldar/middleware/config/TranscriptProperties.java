package com.aldar.middleware.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "transcript")
public class TranscriptProperties {

    private int defaultLimit = 10;
    private int maxLimit = 20;
    private Duration exactMatchWindow = Duration.ofSeconds(30);
    private Duration prefixMatchWindow = Duration.ofSeconds(5);
    private Duration dedupTolerance = Duration.ofSeconds(3);
    private Duration sourceTimeout = Duration.ofSeconds(15);
    private AgentCacheProperties agentCache = new AgentCacheProperties();

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public Duration getExactMatchWindow() {
        return exactMatchWindow;
    }

    public void setExactMatchWindow(Duration exactMatchWindow) {
        this.exactMatchWindow = exactMatchWindow == null ? Duration.ofSeconds(30) : exactMatchWindow;
    }

    public Duration getPrefixMatchWindow() {
        return prefixMatchWindow;
    }

    public void setPrefixMatchWindow(Duration prefixMatchWindow) {
        this.prefixMatchWindow = prefixMatchWindow == null ? Duration.ofSeconds(5) : prefixMatchWindow;
    }

    public Duration getDedupTolerance() {
        return dedupTolerance;
    }

    public void setDedupTolerance(Duration dedupTolerance) {
        this.dedupTolerance = dedupTolerance == null ? Duration.ofSeconds(3) : dedupTolerance;
    }

    public Duration getSourceTimeout() {
        return sourceTimeout;
    }

    public void setSourceTimeout(Duration sourceTimeout) {
        this.sourceTimeout = sourceTimeout == null ? Duration.ofSeconds(15) : sourceTimeout;
    }

    public AgentCacheProperties getAgentCache() {
        return agentCache;
    }

    public void setAgentCache(AgentCacheProperties agentCache) {
        this.agentCache = agentCache == null ? new AgentCacheProperties() : agentCache;
    }

    public static class AgentCacheProperties {
        private Duration ttl = Duration.ofMinutes(5);
        private int maxEntries = 2_000;

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }
    }
}
