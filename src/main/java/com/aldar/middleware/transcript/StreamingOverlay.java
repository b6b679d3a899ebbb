package com.aldar.middleware.transcript;

import com.aldar.middleware.model.ActiveStream;
import com.aldar.middleware.model.CanonicalMessage;
import com.aldar.middleware.model.MessageRole;
import com.aldar.middleware.model.MessageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shows a reply that is still streaming: the user turn that started it carries the
 * stream id, and an assistant entry (real or placeholder) is marked with the stream status.
 */
@Component
public class StreamingOverlay {

    private static final Logger log = LoggerFactory.getLogger(StreamingOverlay.class);

    private static final Comparator<CanonicalMessage> BY_TIMESTAMP =
            Comparator.comparing(CanonicalMessage::timestamp, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final Clock clock;

    public StreamingOverlay(Clock clock) {
        this.clock = clock;
    }

    public List<CanonicalMessage> apply(String sessionId, List<CanonicalMessage> messages, Optional<ActiveStream> marker) {
        List<CanonicalMessage> result = new ArrayList<>(messages == null ? List.of() : messages);
        if (marker == null || marker.isEmpty()) {
            return result;
        }
        ActiveStream stream = marker.get();
        if (!stream.isActive()) {
            log.debug("Ignoring finished stream marker sessionId={}, streamId={}, status={}",
                    sessionId, stream.streamId(), stream.status());
            return result;
        }
        String streamId = stream.streamId();
        String status = stream.effectiveStatus();

        String runId = stream.runId() == null || stream.runId().isBlank() ? null : stream.runId();
        if (runId != null) {
            // the marker can outlive its run; that run's reply is the streamed entry
            for (int i = 0; i < result.size(); i++) {
                CanonicalMessage message = result.get(i);
                if (message.isAssistant() && runId.equals(message.runId()) && message.streamId() == null) {
                    result.set(i, message.withStream(streamId, status));
                }
            }
        }

        if (result.stream().noneMatch(message -> !message.isAssistant() && streamId.equals(message.streamId()))) {
            int target = referencedIndex(result, stream.messageId());
            if (target < 0) {
                target = userOfRunIndex(result, runId);
            }
            if (target < 0) {
                target = mostRecentUserIndex(result);
            }
            if (target >= 0) {
                result.set(target, result.get(target).withStream(streamId, status));
            }
        }

        boolean annotated = false;
        for (int i = 0; i < result.size(); i++) {
            CanonicalMessage message = result.get(i);
            if (message.isAssistant() && streamId.equals(message.streamId())) {
                result.set(i, message.withStream(streamId, status));
                annotated = true;
            }
        }
        if (!annotated) {
            result.add(placeholder(sessionId, stream, status, newestTimestamp(result)));
            log.debug("Added streaming placeholder sessionId={}, streamId={}", sessionId, streamId);
        }
        return result;
    }

    private CanonicalMessage placeholder(String sessionId, ActiveStream stream, String status, Instant newest) {
        return new CanonicalMessage(
                MessageIdentity.forStream(sessionId, stream.streamId()),
                MessageRole.ASSISTANT,
                "",
                newest != null ? newest : clock.instant(),
                stream.runId(),
                null,
                null,
                null,
                null,
                List.of(),
                List.of(),
                null,
                stream.streamId(),
                status,
                null,
                Map.of(),
                MessageSource.STREAM_PLACEHOLDER
        );
    }

    private static int referencedIndex(List<CanonicalMessage> messages, String messageId) {
        if (messageId == null || messageId.isBlank()) {
            return -1;
        }
        for (int i = messages.size() - 1; i >= 0; i--) {
            CanonicalMessage message = messages.get(i);
            if (messageId.equalsIgnoreCase(message.messageId()) || messageId.equalsIgnoreCase(message.localMessageId())) {
                return i;
            }
        }
        return -1;
    }

    private static int userOfRunIndex(List<CanonicalMessage> messages, String runId) {
        if (runId == null) {
            return -1;
        }
        for (int i = 0; i < messages.size(); i++) {
            if (messages.get(i).isUser() && runId.equals(messages.get(i).runId())) {
                return i;
            }
        }
        return -1;
    }

    private static int mostRecentUserIndex(List<CanonicalMessage> messages) {
        int found = -1;
        for (int i = 0; i < messages.size(); i++) {
            CanonicalMessage message = messages.get(i);
            if (message.isUser() && (found < 0 || BY_TIMESTAMP.compare(message, messages.get(found)) >= 0)) {
                found = i;
            }
        }
        return found;
    }

    private static Instant newestTimestamp(List<CanonicalMessage> messages) {
        Instant newest = null;
        for (CanonicalMessage message : messages) {
            if (message.timestamp() != null && (newest == null || message.timestamp().isAfter(newest))) {
                newest = message.timestamp();
            }
        }
        return newest;
    }
}
