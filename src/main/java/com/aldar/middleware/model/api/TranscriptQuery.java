package com.aldar.middleware.model.api;

/**
 * Read request for one session's transcript.
 *
 * @param beforeMessageId optional cursor; only entries strictly before it are returned
 */
public record TranscriptQuery(
        String sessionId,
        String userId,
        int limit,
        String beforeMessageId,
        boolean includeSystem
) {

    public TranscriptQuery {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        sessionId = sessionId.trim();
        userId = userId == null ? null : userId.trim();
        beforeMessageId = beforeMessageId == null || beforeMessageId.isBlank() ? null : beforeMessageId.trim();
    }
}
