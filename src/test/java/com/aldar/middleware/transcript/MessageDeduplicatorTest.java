package com.aldar.middleware.transcript;

import com.aldar.middleware.model.CanonicalMessage;
import com.aldar.middleware.model.MessageRole;
import com.aldar.middleware.model.MessageSource;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.aldar.middleware.transcript.TranscriptFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;

class MessageDeduplicatorTest {

    private final MessageDeduplicator deduplicator = new MessageDeduplicator(Duration.ofSeconds(3));

    @Test
    void sameIdShouldKeepLatestEntry() {
        CanonicalMessage early = message("m-1", MessageRole.USER, "hi", T0, "run-1");
        CanonicalMessage late = message("m-1", MessageRole.USER, "hi!", T0.plusSeconds(10), "run-1");

        List<CanonicalMessage> result = deduplicator.deduplicate(List.of(late, early));

        assertThat(result).containsExactly(late);
    }

    @Test
    void sameIdAndTimestampShouldKeepLaterEntry() {
        CanonicalMessage first = message("m-1", MessageRole.USER, "hi", T0, "run-1");
        CanonicalMessage second = message("m-1", MessageRole.USER, "hi (edited)", T0, "run-1");

        assertThat(deduplicator.deduplicate(List.of(first, second))).containsExactly(second);
    }

    @Test
    void sameSignatureWithinToleranceShouldCollapseToLatest() {
        CanonicalMessage first = message("m-1", MessageRole.USER, "hello   world", T0, "run-1");
        CanonicalMessage second = message("m-2", MessageRole.USER, "hello world", T0.plusSeconds(2), "run-1");

        assertThat(deduplicator.deduplicate(List.of(first, second))).containsExactly(second);
    }

    @Test
    void sameSignatureFartherApartShouldBothSurvive() {
        CanonicalMessage first = message("m-1", MessageRole.USER, "hello world", T0, null);
        CanonicalMessage second = message("m-2", MessageRole.USER, "hello world", T0.plusSeconds(60), null);

        assertThat(deduplicator.deduplicate(List.of(first, second))).containsExactly(first, second);
    }

    @Test
    void differentRunsShouldNotCollapseOnSignature() {
        CanonicalMessage first = message("m-1", MessageRole.ASSISTANT, "Done.", T0, "run-1");
        CanonicalMessage second = message("m-2", MessageRole.ASSISTANT, "Done.", T0.plusSeconds(1), "run-2");

        assertThat(deduplicator.deduplicate(List.of(first, second))).hasSize(2);
    }

    @Test
    void containedAssistantReplyShouldBeDropped() {
        CanonicalMessage partial = message("m-1", MessageRole.ASSISTANT, "The answer is 42.", T0, "run-1");
        CanonicalMessage full = message("m-2", MessageRole.ASSISTANT,
                "The answer is 42. Let me know if you need the derivation.", T0.plusSeconds(20), "run-1");

        assertThat(deduplicator.deduplicate(List.of(partial, full))).containsExactly(full);
    }

    @Test
    void containedReplyFromAnotherRunShouldBeDropped() {
        CanonicalMessage shortReply = message("m-1", MessageRole.ASSISTANT, "A", T0, "run-1");
        CanonicalMessage longReply = message("m-2", MessageRole.ASSISTANT, "A plus more text", T0.plusSeconds(60), "run-2");

        assertThat(deduplicator.deduplicate(List.of(shortReply, longReply))).containsExactly(longReply);
    }

    @Test
    void userMessagesShouldNotBeCollapsedByContainment() {
        CanonicalMessage shortQuestion = message("m-1", MessageRole.USER, "weather", T0, "run-1");
        CanonicalMessage longQuestion = message("m-2", MessageRole.USER, "weather in Abu Dhabi", T0.plusSeconds(60), "run-2");

        assertThat(deduplicator.deduplicate(List.of(shortQuestion, longQuestion))).hasSize(2);
    }

    @Test
    void survivorsShouldKeepInputOrder() {
        CanonicalMessage a = message("m-a", MessageRole.USER, "one", T0, "run-1");
        CanonicalMessage b = message("m-b", MessageRole.ASSISTANT, "two", T0, "run-1");
        CanonicalMessage c = message("m-c", MessageRole.USER, "three", T0.plusSeconds(30), "run-2");

        assertThat(deduplicator.deduplicate(List.of(a, b, c))).containsExactly(a, b, c);
    }

    private static CanonicalMessage message(String id, MessageRole role, String content, Instant at, String runId) {
        return new CanonicalMessage(id, role, content, at, runId, null, null, null, null,
                List.of(), List.of(), null, null, null, null, Map.of(), MessageSource.RUN_LOG);
    }
}
