package com.aldar.middleware.stream;

import com.aldar.middleware.model.ActiveStream;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads marker values of the form {@code user:a@b.c, team:<id>, session:<id>, run_id:<id>, status:streaming}.
 */
public final class StreamMarkerParser {

    static final String FIELD_USER = "user";
    static final String FIELD_SESSION = "session";
    static final String FIELD_RUN_ID = "run_id";
    static final String FIELD_STATUS = "status";
    static final String FIELD_MESSAGE_ID = "message_id";

    private StreamMarkerParser() {
    }

    public static Map<String, String> fields(String value) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (!StringUtils.hasText(value)) {
            return fields;
        }
        for (String part : value.split(",")) {
            int separator = part.indexOf(':');
            if (separator <= 0) {
                continue;
            }
            String key = part.substring(0, separator).trim().toLowerCase(Locale.ROOT);
            String fieldValue = part.substring(separator + 1).trim();
            if (!key.isEmpty() && !fieldValue.isEmpty()) {
                fields.putIfAbsent(key, fieldValue);
            }
        }
        return fields;
    }

    public static Optional<ActiveStream> parse(String streamId, String value) {
        if (!StringUtils.hasText(streamId)) {
            return Optional.empty();
        }
        Map<String, String> fields = fields(value);
        String sessionId = fields.get(FIELD_SESSION);
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.of(new ActiveStream(
                streamId.trim(),
                fields.get(FIELD_STATUS),
                sessionId,
                fields.get(FIELD_RUN_ID),
                fields.get(FIELD_USER),
                fields.get(FIELD_MESSAGE_ID)
        ));
    }

    public static String format(ActiveStream stream) {
        StringBuilder value = new StringBuilder();
        append(value, FIELD_USER, stream.user());
        append(value, FIELD_SESSION, stream.sessionId());
        append(value, FIELD_RUN_ID, stream.runId());
        append(value, FIELD_MESSAGE_ID, stream.messageId());
        append(value, FIELD_STATUS, stream.effectiveStatus());
        return value.toString();
    }

    private static void append(StringBuilder value, String key, String fieldValue) {
        if (!StringUtils.hasText(fieldValue)) {
            return;
        }
        if (value.length() > 0) {
            value.append(", ");
        }
        value.append(key).append(':').append(fieldValue.trim());
    }
}
