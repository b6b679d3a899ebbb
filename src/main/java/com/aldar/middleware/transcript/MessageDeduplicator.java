package com.aldar.middleware.transcript;

import com.aldar.middleware.config.TranscriptProperties;
import com.aldar.middleware.model.CanonicalMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collapses duplicates left over after matching, in three passes: same id, same content
 * signature close in time, and assistant text contained in a longer assistant reply.
 * Survivors keep their input order.
 */
@Component
public class MessageDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(MessageDeduplicator.class);

    private final Duration tolerance;

    @Autowired
    public MessageDeduplicator(TranscriptProperties properties) {
        this(properties.getDedupTolerance());
    }

    MessageDeduplicator(Duration tolerance) {
        this.tolerance = tolerance == null ? Duration.ofSeconds(3) : tolerance;
    }

    public List<CanonicalMessage> deduplicate(List<CanonicalMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        List<CanonicalMessage> result = byIdentity(messages);
        result = bySignature(result);
        result = bySubstring(result);
        if (result.size() != messages.size()) {
            log.debug("Deduplicated transcript in={}, out={}", messages.size(), result.size());
        }
        return result;
    }

    List<CanonicalMessage> byIdentity(List<CanonicalMessage> messages) {
        Map<String, Integer> keptIndexById = new LinkedHashMap<>();
        for (int i = 0; i < messages.size(); i++) {
            CanonicalMessage message = messages.get(i);
            if (message.messageId() == null) {
                continue;
            }
            Integer kept = keptIndexById.get(message.messageId());
            if (kept == null || !isEarlier(message.timestamp(), messages.get(kept).timestamp())) {
                keptIndexById.put(message.messageId(), i);
            }
        }
        List<CanonicalMessage> survivors = new ArrayList<>();
        for (int i = 0; i < messages.size(); i++) {
            CanonicalMessage message = messages.get(i);
            if (message.messageId() == null || keptIndexById.get(message.messageId()) == i) {
                survivors.add(message);
            }
        }
        return survivors;
    }

    List<CanonicalMessage> bySignature(List<CanonicalMessage> messages) {
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < messages.size(); i++) {
            groups.computeIfAbsent(signatureKey(messages.get(i)), key -> new ArrayList<>()).add(i);
        }

        boolean[] dropped = new boolean[messages.size()];
        for (List<Integer> group : groups.values()) {
            if (group.size() < 2) {
                continue;
            }
            List<Integer> byTime = new ArrayList<>(group);
            byTime.sort(Comparator.comparing(index -> messages.get(index).timestamp(),
                    Comparator.nullsFirst(Comparator.naturalOrder())));
            int kept = byTime.get(0);
            for (int k = 1; k < byTime.size(); k++) {
                int next = byTime.get(k);
                if (withinTolerance(messages.get(kept).timestamp(), messages.get(next).timestamp())) {
                    dropped[kept] = true;
                }
                kept = next;
            }
        }

        List<CanonicalMessage> survivors = new ArrayList<>();
        for (int i = 0; i < messages.size(); i++) {
            if (!dropped[i]) {
                survivors.add(messages.get(i));
            }
        }
        return survivors;
    }

    List<CanonicalMessage> bySubstring(List<CanonicalMessage> messages) {
        List<CanonicalMessage> survivors = new ArrayList<>(messages);
        for (CanonicalMessage candidate : messages) {
            if (!candidate.isAssistant() || candidate.content().isBlank()) {
                continue;
            }
            String text = candidate.content().trim();
            boolean contained = false;
            for (CanonicalMessage other : survivors) {
                if (other == candidate || !other.isAssistant()) {
                    continue;
                }
                String otherText = other.content().trim();
                if (otherText.length() > text.length() && otherText.contains(text)) {
                    contained = true;
                    break;
                }
            }
            if (contained) {
                survivors.remove(candidate);
                log.debug("Dropped assistant reply contained in a longer one messageId={}, runId={}",
                        candidate.messageId(), candidate.runId());
            }
        }
        return survivors;
    }

    private static String signatureKey(CanonicalMessage message) {
        return (message.role() == null ? "" : message.role().wireName())
                + "|" + ContentText.signature(message.content())
                + "|" + Objects.toString(message.runId(), "");
    }

    private boolean withinTolerance(Instant left, Instant right) {
        if (left == null || right == null) {
            return left == null && right == null;
        }
        return Duration.between(left, right).abs().compareTo(tolerance) <= 0;
    }

    private static boolean isEarlier(Instant candidate, Instant current) {
        if (candidate == null) {
            return current != null;
        }
        return current != null && candidate.isBefore(current);
    }
}
