package com.aldar.middleware.stream;

import com.aldar.middleware.MutableClock;
import com.aldar.middleware.model.ActiveStream;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryStreamMarkerStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
    private final InMemoryStreamMarkerStore store = new InMemoryStreamMarkerStore(clock, Duration.ofMinutes(30));

    @Test
    void activeMarkerShouldBeFoundBySession() {
        store.putMarker(new ActiveStream("stream-1", "streaming", "session-1", "run-1", "jane", null));
        store.putMarker(new ActiveStream("stream-2", "streaming", "session-2", "run-2", "jane", null));

        assertThat(store.getActiveStream("session-2"))
                .get()
                .extracting(ActiveStream::streamId)
                .isEqualTo("stream-2");
        assertThat(store.getActiveStream("session-3")).isEmpty();
    }

    @Test
    void terminalOrExpiredMarkersShouldBeIgnored() {
        store.putMarker(new ActiveStream("stream-1", "completed", "session-1", "run-1", "jane", null));
        assertThat(store.getActiveStream("session-1")).isEmpty();

        store.putMarker(new ActiveStream("stream-2", "streaming", "session-1", "run-2", "jane", null));
        clock.advance(Duration.ofMinutes(31));
        assertThat(store.getActiveStream("session-1")).isEmpty();
    }

    @Test
    void removedMarkerShouldNoLongerMatch() {
        store.putMarker(new ActiveStream("stream-1", null, "session-1", "run-1", "jane", null));
        store.removeMarker("stream-1");

        assertThat(store.getActiveStream("session-1")).isEmpty();
    }

    @Test
    void putShouldRejectBlankStreamId() {
        assertThatThrownBy(() -> store.putMarker(new ActiveStream(" ", null, "session-1", null, null, null)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
