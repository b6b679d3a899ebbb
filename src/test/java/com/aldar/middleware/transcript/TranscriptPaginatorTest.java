package com.aldar.middleware.transcript;

import com.aldar.middleware.model.CanonicalMessage;
import com.aldar.middleware.model.MessageRole;
import com.aldar.middleware.model.MessageSource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.aldar.middleware.transcript.TranscriptFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptPaginatorTest {

    private final TranscriptPaginator paginator = new TranscriptPaginator();

    @Test
    void shouldReturnNewestEntriesOldestFirst() {
        TranscriptPaginator.Page page = paginator.page(transcript(5), 2, null, true);

        assertThat(page.messages()).extracting(CanonicalMessage::messageId).containsExactly("m-3", "m-4");
        assertThat(page.hasMore()).isTrue();
    }

    @Test
    void cursorShouldReturnEntriesStrictlyBeforeIt() {
        TranscriptPaginator.Page page = paginator.page(transcript(5), 10, "m-2", true);

        assertThat(page.messages()).extracting(CanonicalMessage::messageId).containsExactly("m-0", "m-1");
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void cursorShouldAlsoMatchLedgerIdIgnoringCase() {
        TranscriptPaginator.Page page = paginator.page(transcript(5), 10, "LOCAL-3", true);

        assertThat(page.messages()).extracting(CanonicalMessage::messageId).containsExactly("m-0", "m-1", "m-2");
    }

    @Test
    void unknownCursorShouldYieldEmptyPage() {
        TranscriptPaginator.Page page = paginator.page(transcript(5), 10, "missing", true);

        assertThat(page.messages()).isEmpty();
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void systemMessagesShouldBeFilteredOnRequest() {
        List<CanonicalMessage> messages = new ArrayList<>(transcript(2));
        messages.add(entry("sys", MessageRole.SYSTEM, 10));

        assertThat(paginator.page(messages, 10, null, false).messages())
                .extracting(CanonicalMessage::messageId).containsExactly("m-0", "m-1");
        assertThat(paginator.page(messages, 10, null, true).messages()).hasSize(3);
    }

    @Test
    void inputOrderShouldNotMatterAndTiesShouldBeStable() {
        List<CanonicalMessage> messages = new ArrayList<>(transcript(4));
        Collections.reverse(messages);
        CanonicalMessage user = entry("tie-user", MessageRole.USER, 20);
        CanonicalMessage assistant = entry("tie-assistant", MessageRole.ASSISTANT, 20);
        messages.add(user);
        messages.add(assistant);

        assertThat(paginator.page(messages, 10, null, true).messages())
                .extracting(CanonicalMessage::messageId)
                .containsExactly("m-0", "m-1", "m-2", "m-3", "tie-user", "tie-assistant");
    }

    @Test
    void walkingBackShouldCoverEveryEntryOnce() {
        List<CanonicalMessage> all = transcript(7);
        List<String> seen = new ArrayList<>();
        String cursor = null;
        boolean more = true;
        while (more) {
            TranscriptPaginator.Page page = paginator.page(all, 3, cursor, true);
            List<String> ids = page.messages().stream().map(CanonicalMessage::messageId).toList();
            seen.addAll(0, ids);
            more = page.hasMore();
            cursor = ids.isEmpty() ? null : ids.get(0);
        }

        assertThat(seen).containsExactly("m-0", "m-1", "m-2", "m-3", "m-4", "m-5", "m-6");
    }

    @Test
    void nonPositiveLimitShouldBeRejected() {
        assertThatThrownBy(() -> paginator.page(transcript(1), 0, null, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<CanonicalMessage> transcript(int size) {
        List<CanonicalMessage> messages = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            messages.add(entry("m-" + i, i % 2 == 0 ? MessageRole.USER : MessageRole.ASSISTANT, i));
        }
        return messages;
    }

    private static CanonicalMessage entry(String id, MessageRole role, int offsetSeconds) {
        String localId = id.startsWith("m-") ? "local-" + id.substring(2) : null;
        return new CanonicalMessage(id, role, "text " + id, T0.plusSeconds(offsetSeconds), null, null, null, null, null,
                List.of(), List.of(), null, null, null, localId, Map.of(), MessageSource.RUN_LOG);
    }
}
