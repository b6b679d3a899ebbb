package com.aldar.middleware.transcript.source;

import com.aldar.middleware.model.ActiveStream;

import java.util.Optional;

/**
 * Ephemeral, TTL-bound markers for responses still being streamed. Written by the
 * orchestration side; read-only here.
 */
public interface StreamMarkerStore {

    Optional<ActiveStream> getActiveStream(String sessionId);
}
