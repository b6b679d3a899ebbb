package com.aldar.middleware.cache;

import com.aldar.middleware.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpiringCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));

    @Test
    void entriesShouldExpireAfterTtl() {
        ExpiringCache<String, String> cache = new ExpiringCache<>(clock, Duration.ofMinutes(5), 10);
        cache.put("agent-1", "Analyst");

        clock.advance(Duration.ofMinutes(4));
        assertThat(cache.get("agent-1")).contains("Analyst");

        clock.advance(Duration.ofMinutes(1));
        assertThat(cache.get("agent-1")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void fullCacheShouldEvictExpiredEntriesFirst() {
        ExpiringCache<String, String> cache = new ExpiringCache<>(clock, Duration.ofMinutes(5), 2);
        cache.put("a", "1");
        clock.advance(Duration.ofMinutes(3));
        cache.put("b", "2");
        clock.advance(Duration.ofMinutes(3));

        cache.put("c", "3");

        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("b")).contains("2");
        assertThat(cache.get("c")).contains("3");
    }

    @Test
    void fullCacheShouldEvictOldestWhenNothingExpired() {
        ExpiringCache<String, String> cache = new ExpiringCache<>(clock, Duration.ofMinutes(5), 2);
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("a", "1b");

        cache.put("c", "3");

        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("a")).contains("1b");
        assertThat(cache.get("c")).contains("3");
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void invalidateAndClearShouldDropEntries() {
        ExpiringCache<String, String> cache = new ExpiringCache<>(clock, Duration.ofMinutes(5), 10);
        cache.put("a", "1");
        cache.put("b", "2");

        cache.invalidate("a");
        assertThat(cache.get("a")).isEmpty();

        cache.clear();
        assertThat(cache.size()).isZero();
    }

    @Test
    void constructorShouldRejectNonPositiveLimits() {
        assertThatThrownBy(() -> new ExpiringCache<String, String>(clock, Duration.ZERO, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExpiringCache<String, String>(clock, Duration.ofMinutes(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
