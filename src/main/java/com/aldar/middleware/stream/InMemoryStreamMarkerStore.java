package com.aldar.middleware.stream;

import com.aldar.middleware.model.ActiveStream;
import com.aldar.middleware.transcript.source.StreamMarkerStore;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Process-local marker store for single-node runs without Redis. Holds the same marker
 * text Redis would and applies the TTL on read.
 */
public class InMemoryStreamMarkerStore implements StreamMarkerStore {

    private record StoredMarker(String value, Instant expiresAt) {
    }

    private final Map<String, StoredMarker> markers = new TreeMap<>();
    private final Clock clock;
    private final Duration ttl;

    public InMemoryStreamMarkerStore(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl == null ? Duration.ofHours(1) : ttl;
    }

    public synchronized void putMarker(ActiveStream stream) {
        if (stream == null || !StringUtils.hasText(stream.streamId())) {
            throw new IllegalArgumentException("stream id must not be blank");
        }
        markers.put(stream.streamId(), new StoredMarker(StreamMarkerParser.format(stream), clock.instant().plus(ttl)));
    }

    public synchronized void removeMarker(String streamId) {
        markers.remove(streamId);
    }

    @Override
    public synchronized Optional<ActiveStream> getActiveStream(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        markers.entrySet().removeIf(entry -> !entry.getValue().expiresAt().isAfter(now));
        for (Map.Entry<String, StoredMarker> entry : markers.entrySet()) {
            Optional<ActiveStream> marker = StreamMarkerParser.parse(entry.getKey(), entry.getValue().value());
            if (marker.isPresent() && sessionId.trim().equals(marker.get().sessionId()) && marker.get().isActive()) {
                return marker;
            }
        }
        return Optional.empty();
    }
}
