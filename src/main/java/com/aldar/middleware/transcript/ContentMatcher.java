package com.aldar.middleware.transcript;

import com.aldar.middleware.model.CanonicalMessage;
import com.aldar.middleware.model.LocalMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Scores one ledger row against one synthesized message. Pure; holds only the windows.
 */
public class ContentMatcher {

    static final int MIN_PREFIX_LENGTH = 20;

    private final Duration exactWindow;
    private final Duration prefixWindow;

    public ContentMatcher(Duration exactWindow, Duration prefixWindow) {
        this.exactWindow = exactWindow == null ? Duration.ofSeconds(30) : exactWindow;
        this.prefixWindow = prefixWindow == null ? Duration.ofSeconds(5) : prefixWindow;
    }

    /**
     * @param streamByRun run id to stream id pairs known for the session
     */
    public Optional<MatchScore> score(LocalMessage local, CanonicalMessage candidate, Map<String, String> streamByRun) {
        if (local == null || candidate == null) {
            return Optional.empty();
        }
        Duration distance = distance(local.createdAt(), candidate.timestamp());

        if (sameId(local.id(), candidate.messageId()) || sameId(local.linkedMessageId(), candidate.messageId())) {
            return Optional.of(new MatchScore(MatchScore.Kind.IDENTITY, distance));
        }
        if (local.role() != candidate.role()) {
            return Optional.empty();
        }

        String localText = ContentText.normalize(local.content());
        String candidateText = ContentText.normalize(candidate.content());
        if (!localText.isEmpty() && !candidateText.isEmpty() && distance != null) {
            if (localText.equals(candidateText) && distance.compareTo(exactWindow) <= 0) {
                return Optional.of(new MatchScore(MatchScore.Kind.EXACT_CONTENT, distance));
            }
            if (isPrefixPair(localText, candidateText) && distance.compareTo(prefixWindow) <= 0) {
                return Optional.of(new MatchScore(MatchScore.Kind.PREFIX_CONTENT, distance));
            }
        }

        if (isLinked(local, candidate, streamByRun)) {
            return Optional.of(new MatchScore(MatchScore.Kind.RUN_LINK, distance));
        }
        return Optional.empty();
    }

    static boolean isPrefixPair(String left, String right) {
        String shorter = left.length() <= right.length() ? left : right;
        String longer = shorter == left ? right : left;
        return shorter.length() >= MIN_PREFIX_LENGTH && longer.startsWith(shorter);
    }

    private static boolean isLinked(LocalMessage local, CanonicalMessage candidate, Map<String, String> streamByRun) {
        String runId = candidate.runId();
        if (runId == null) {
            return false;
        }
        if (runId.equals(local.linkedRunId())) {
            return true;
        }
        String streamId = local.streamId();
        return streamId != null && streamByRun != null && streamId.equals(streamByRun.get(runId));
    }

    private static boolean sameId(String left, String right) {
        return left != null && right != null && left.equalsIgnoreCase(right);
    }

    private static Duration distance(Instant left, Instant right) {
        if (left == null || right == null) {
            return null;
        }
        return Duration.between(left, right).abs();
    }
}
