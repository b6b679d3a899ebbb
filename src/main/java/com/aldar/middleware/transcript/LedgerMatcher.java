package com.aldar.middleware.transcript;

import com.aldar.middleware.config.TranscriptProperties;
import com.aldar.middleware.model.ActiveStream;
import com.aldar.middleware.model.CanonicalMessage;
import com.aldar.middleware.model.LocalMessage;
import com.aldar.middleware.model.MessageRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pairs ledger rows with synthesized run-log messages. Every ledger row with content either
 * enriches exactly one synthesized message or survives on its own.
 */
@Component
public class LedgerMatcher {

    private static final Logger log = LoggerFactory.getLogger(LedgerMatcher.class);

    private final ContentMatcher contentMatcher;

    @Autowired
    public LedgerMatcher(TranscriptProperties properties) {
        this(new ContentMatcher(properties.getExactMatchWindow(), properties.getPrefixMatchWindow()));
    }

    LedgerMatcher(ContentMatcher contentMatcher) {
        this.contentMatcher = contentMatcher;
    }

    public List<CanonicalMessage> match(
            String sessionId,
            NormalizedRunLog runLog,
            List<LocalMessage> ledger,
            Optional<ActiveStream> marker
    ) {
        List<CanonicalMessage> synthesized = new ArrayList<>(runLog.messages());
        if (ledger == null || ledger.isEmpty()) {
            return synthesized;
        }

        ActiveStream activeMarker = marker == null ? null : marker.filter(ActiveStream::isActive).orElse(null);
        Map<String, String> streamByRun = streamByRun(ledger, activeMarker);

        boolean[] claimed = new boolean[synthesized.size()];
        List<CanonicalMessage> unmatched = new ArrayList<>();
        List<LocalMessage> olderLeftovers = new ArrayList<>();
        int matchedCount = 0;

        for (LocalMessage local : inCreationOrder(ledger)) {
            boolean referenced = isReferencedByMarker(local, activeMarker);
            if (!local.hasContent() && !referenced) {
                continue;
            }

            int bestIndex = -1;
            MatchScore best = null;
            for (int i = 0; i < synthesized.size(); i++) {
                if (claimed[i]) {
                    continue;
                }
                Optional<MatchScore> score = contentMatcher.score(local, synthesized.get(i), streamByRun);
                if (score.isPresent() && score.get().isBetterThan(best)) {
                    best = score.get();
                    bestIndex = i;
                }
            }

            if (bestIndex >= 0) {
                claimed[bestIndex] = true;
                synthesized.set(bestIndex, synthesized.get(bestIndex).inheritFrom(local));
                matchedCount++;
                log.debug("Ledger row matched sessionId={}, localId={}, messageId={}, kind={}",
                        sessionId, local.id(), synthesized.get(bestIndex).messageId(), best.kind());
                continue;
            }

            if (referenced || isNewerThanRunLog(local, runLog.latestRunTimestamp())) {
                unmatched.add(CanonicalMessage.fromLedger(local));
            } else {
                olderLeftovers.add(local);
            }
        }

        // an older leftover folds into an unclaimed run-log message with the same role and text
        for (LocalMessage local : olderLeftovers) {
            int counterpart = unclaimedWithSameText(synthesized, claimed, local);
            if (counterpart >= 0) {
                claimed[counterpart] = true;
                synthesized.set(counterpart, synthesized.get(counterpart).inheritFrom(local));
                matchedCount++;
                log.debug("Ledger row folded into run log sessionId={}, localId={}, messageId={}",
                        sessionId, local.id(), synthesized.get(counterpart).messageId());
            } else {
                unmatched.add(CanonicalMessage.fromLedger(local));
            }
        }

        if (!unmatched.isEmpty()) {
            log.debug("Ledger rows kept standalone sessionId={}, matched={}, standalone={}",
                    sessionId, matchedCount, unmatched.size());
        }
        List<CanonicalMessage> merged = new ArrayList<>(synthesized.size() + unmatched.size());
        merged.addAll(synthesized);
        merged.addAll(unmatched);
        merged.sort(Comparator.comparing(CanonicalMessage::timestamp, Comparator.nullsFirst(Comparator.naturalOrder())));
        return merged;
    }

    static Map<String, String> streamByRun(List<LocalMessage> ledger, ActiveStream marker) {
        Map<String, String> pairs = new LinkedHashMap<>();
        for (LocalMessage local : ledger) {
            String runId = local.linkedRunId();
            String streamId = local.streamId();
            if (runId != null && streamId != null) {
                pairs.putIfAbsent(runId, streamId);
            }
        }
        if (marker != null && marker.runId() != null && !marker.runId().isBlank()) {
            pairs.put(marker.runId(), marker.streamId());
        }
        return pairs;
    }

    private static List<LocalMessage> inCreationOrder(List<LocalMessage> ledger) {
        List<LocalMessage> ordered = new ArrayList<>();
        for (LocalMessage local : ledger) {
            if (local != null && local.id() != null) {
                ordered.add(local);
            }
        }
        ordered.sort(Comparator.comparing(LocalMessage::createdAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return ordered;
    }

    private static boolean isReferencedByMarker(LocalMessage local, ActiveStream marker) {
        if (marker == null) {
            return false;
        }
        if (marker.streamId().equals(local.streamId())) {
            return true;
        }
        return marker.messageId() != null
                && (marker.messageId().equalsIgnoreCase(local.id()) || marker.messageId().equalsIgnoreCase(local.linkedMessageId()));
    }

    private static boolean isNewerThanRunLog(LocalMessage local, Instant latestRunTimestamp) {
        if (latestRunTimestamp == null) {
            return true;
        }
        return local.createdAt() != null && local.createdAt().isAfter(latestRunTimestamp);
    }

    private static int unclaimedWithSameText(List<CanonicalMessage> synthesized, boolean[] claimed, LocalMessage local) {
        String key = textKey(local.role(), local.content());
        for (int i = 0; i < synthesized.size(); i++) {
            if (!claimed[i] && key.equals(textKey(synthesized.get(i).role(), synthesized.get(i).content()))) {
                return i;
            }
        }
        return -1;
    }

    private static String textKey(MessageRole role, String content) {
        return (role == null ? "" : role.wireName()) + "|" + ContentText.normalize(content);
    }
}
