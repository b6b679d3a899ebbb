package com.aldar.middleware.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A row of the local message ledger, written when the user sends a message.
 */
public record LocalMessage(
        String id,
        String sessionId,
        MessageRole role,
        String content,
        Instant createdAt,
        String agentId,
        Map<String, Object> metadata
) {

    public static final String META_STREAM_ID = "stream_id";
    public static final String META_RUN_ID = "run_id";
    public static final String META_MESSAGE_ID = "message_id";
    public static final String META_ATTACHMENTS = "attachments";

    private static final Set<String> RESERVED_KEYS = Set.of(META_STREAM_ID, META_RUN_ID, META_MESSAGE_ID, META_ATTACHMENTS);

    public LocalMessage {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean hasContent() {
        return content != null && !content.isBlank();
    }

    public String streamId() {
        return metadataText(META_STREAM_ID);
    }

    public String linkedRunId() {
        return metadataText(META_RUN_ID);
    }

    public String linkedMessageId() {
        return metadataText(META_MESSAGE_ID);
    }

    public String metadataText(String key) {
        Object value = metadata.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Metadata entries that are not engine bookkeeping, carried to the transcript as-is.
     */
    public Map<String, Object> customFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        metadata.forEach((key, value) -> {
            if (!RESERVED_KEYS.contains(key) && value != null) {
                fields.put(key, value);
            }
        });
        return fields;
    }

    public List<Attachment> attachments() {
        Object raw = metadata.get(META_ATTACHMENTS);
        if (!(raw instanceof List<?> items)) {
            return List.of();
        }
        List<Attachment> attachments = new ArrayList<>();
        for (Object item : items) {
            if (!(item instanceof Map<?, ?> map)) {
                continue;
            }
            String attachmentId = text(map.get("attachment_id"), text(map.get("id"), null));
            String url = text(map.get("url"), text(map.get("blob_url"), null));
            if (attachmentId == null && url == null) {
                continue;
            }
            attachments.add(new Attachment(
                    attachmentId,
                    text(map.get("file_name"), null),
                    size(map.get("file_size")),
                    text(map.get("content_type"), null),
                    url
            ));
        }
        return List.copyOf(attachments);
    }

    private static String text(Object value, String fallback) {
        if (value == null) {
            return fallback;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? fallback : text;
    }

    private static Long size(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }
}
