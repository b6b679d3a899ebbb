package com.aldar.middleware.transcript;

import com.aldar.middleware.model.CanonicalMessage;
import com.aldar.middleware.model.MessageRole;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Component
public class TranscriptPaginator {

    public record Page(List<CanonicalMessage> messages, boolean hasMore) {

        public Page {
            messages = messages == null ? List.of() : List.copyOf(messages);
        }

        static Page empty() {
            return new Page(List.of(), false);
        }
    }

    /**
     * Newest {@code limit} entries strictly before the cursor, oldest first. A cursor that
     * names no entry yields an empty page.
     */
    public Page page(List<CanonicalMessage> messages, int limit, String beforeMessageId, boolean includeSystem) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        List<CanonicalMessage> visible = new ArrayList<>();
        for (CanonicalMessage message : messages) {
            if (includeSystem || message.role() != MessageRole.SYSTEM) {
                visible.add(message);
            }
        }
        visible.sort(Comparator.comparing(CanonicalMessage::timestamp, Comparator.nullsFirst(Comparator.naturalOrder())));

        int end = visible.size();
        if (beforeMessageId != null && !beforeMessageId.isBlank()) {
            end = cursorIndex(visible, beforeMessageId.trim());
            if (end < 0) {
                return Page.empty();
            }
        }
        int start = Math.max(0, end - limit);
        return new Page(visible.subList(start, end), start > 0);
    }

    private static int cursorIndex(List<CanonicalMessage> messages, String cursor) {
        for (int i = 0; i < messages.size(); i++) {
            if (cursor.equalsIgnoreCase(messages.get(i).messageId())) {
                return i;
            }
        }
        for (int i = 0; i < messages.size(); i++) {
            if (cursor.equalsIgnoreCase(messages.get(i).localMessageId())) {
                return i;
            }
        }
        return -1;
    }
}
