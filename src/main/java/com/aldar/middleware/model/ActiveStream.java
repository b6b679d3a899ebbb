package com.aldar.middleware.model;

import java.util.Locale;
import java.util.Set;

/**
 * In-flight response marker written by the orchestration side while a reply streams.
 */
public record ActiveStream(
        String streamId,
        String status,
        String sessionId,
        String runId,
        String user,
        String messageId
) {

    public static final String STATUS_STREAMING = "streaming";

    private static final Set<String> TERMINAL_STATUSES = Set.of("completed", "failed", "cancelled", "canceled", "error");

    public boolean isActive() {
        if (streamId == null || streamId.isBlank()) {
            return false;
        }
        if (status == null || status.isBlank()) {
            return true;
        }
        return !TERMINAL_STATUSES.contains(status.trim().toLowerCase(Locale.ROOT));
    }

    public String effectiveStatus() {
        return status == null || status.isBlank() ? STATUS_STREAMING : status.trim().toLowerCase(Locale.ROOT);
    }
}
