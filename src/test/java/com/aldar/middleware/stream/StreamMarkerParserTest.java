package com.aldar.middleware.stream;

import com.aldar.middleware.model.ActiveStream;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class StreamMarkerParserTest {

    @Test
    void parseShouldReadMarkerFields() {
        Optional<ActiveStream> marker = StreamMarkerParser.parse(
                "stream-1",
                "user:jane@aldar.com, team:team-1, session:session-1, run_id:run-9, status:streaming"
        );

        assertThat(marker).isPresent();
        assertThat(marker.get().streamId()).isEqualTo("stream-1");
        assertThat(marker.get().sessionId()).isEqualTo("session-1");
        assertThat(marker.get().runId()).isEqualTo("run-9");
        assertThat(marker.get().user()).isEqualTo("jane@aldar.com");
        assertThat(marker.get().isActive()).isTrue();
    }

    @Test
    void fieldsShouldKeepFirstOccurrenceAndValueColons() {
        assertThat(StreamMarkerParser.fields("Session:s-1, session:s-2, note:a:b, broken, :x"))
                .containsEntry("session", "s-1")
                .containsEntry("note", "a:b")
                .hasSize(2);
    }

    @Test
    void parseShouldRequireSessionAndStreamId() {
        assertThat(StreamMarkerParser.parse("stream-1", "user:jane, status:streaming")).isEmpty();
        assertThat(StreamMarkerParser.parse(" ", "session:s-1")).isEmpty();
        assertThat(StreamMarkerParser.parse("stream-1", null)).isEmpty();
    }

    @Test
    void formatShouldProduceParseableValue() {
        ActiveStream stream = new ActiveStream("stream-1", null, "session-1", "run-1", "jane", "msg-1");

        String value = StreamMarkerParser.format(stream);

        assertThat(value).isEqualTo("user:jane, session:session-1, run_id:run-1, message_id:msg-1, status:streaming");
        assertThat(StreamMarkerParser.parse("stream-1", value)).contains(
                new ActiveStream("stream-1", "streaming", "session-1", "run-1", "jane", "msg-1"));
    }
}
