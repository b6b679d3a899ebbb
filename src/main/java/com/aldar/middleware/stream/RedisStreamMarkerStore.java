package com.aldar.middleware.stream;

import com.aldar.middleware.config.StreamMarkerProperties;
import com.aldar.middleware.model.ActiveStream;
import com.aldar.middleware.transcript.source.StreamMarkerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Looks up in-flight markers in Redis. Markers are keyed by stream id, so a session lookup
 * scans the marker keyspace and matches the session field of each value.
 */
public class RedisStreamMarkerStore implements StreamMarkerStore {

    private static final Logger log = LoggerFactory.getLogger(RedisStreamMarkerStore.class);

    private final StringRedisTemplate redisTemplate;
    private final StreamMarkerProperties properties;

    public RedisStreamMarkerStore(StringRedisTemplate redisTemplate, StreamMarkerProperties properties) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
    }

    @Override
    public Optional<ActiveStream> getActiveStream(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return Optional.empty();
        }
        String prefix = properties.getKeyPrefix();
        ScanOptions options = ScanOptions.scanOptions()
                .match(prefix + "*")
                .count(Math.max(1, properties.getScanCount()))
                .build();

        List<String> keys = new ArrayList<>();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            while (cursor.hasNext()) {
                keys.add(cursor.next());
            }
        }
        keys.sort(null);

        for (String key : keys) {
            String value = redisTemplate.opsForValue().get(key);
            if (value == null) {
                continue;
            }
            Optional<ActiveStream> marker = StreamMarkerParser.parse(key.substring(prefix.length()), value);
            if (marker.isPresent() && sessionId.trim().equals(marker.get().sessionId()) && marker.get().isActive()) {
                log.debug("Active stream marker found sessionId={}, streamId={}", sessionId, marker.get().streamId());
                return marker;
            }
        }
        return Optional.empty();
    }
}
