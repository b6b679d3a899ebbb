package com.aldar.middleware.transcript;

import com.aldar.middleware.model.CanonicalMessage;
import com.aldar.middleware.model.MessageRole;
import com.aldar.middleware.model.RunRecord;
import com.aldar.middleware.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a session's run list into display messages. Delegated child runs never produce
 * messages of their own; every run still gets a summary.
 */
@Component
public class RunLogNormalizer {

    private static final Logger log = LoggerFactory.getLogger(RunLogNormalizer.class);

    public NormalizedRunLog normalize(String sessionId, List<RunRecord> runs) {
        if (runs == null || runs.isEmpty()) {
            return NormalizedRunLog.empty();
        }

        Map<String, RunRecord> runsById = new LinkedHashMap<>();
        for (RunRecord run : runs) {
            if (run == null || run.runId() == null) {
                continue;
            }
            if (runsById.putIfAbsent(run.runId(), run) != null) {
                log.debug("Duplicate run_id in run log sessionId={}, runId={}, keeping first", sessionId, run.runId());
            }
        }

        Set<String> fetchedRunIds = runsById.keySet();
        Map<String, List<String>> childrenByParent = new LinkedHashMap<>();
        for (RunRecord run : runsById.values()) {
            if (run.hasParent() && !run.parentRunId().equals(run.runId()) && fetchedRunIds.contains(run.parentRunId())) {
                childrenByParent.computeIfAbsent(run.parentRunId(), key -> new ArrayList<>()).add(run.runId());
            }
        }
        Set<String> childRunIds = childrenByParent.values().stream()
                .flatMap(List::stream)
                .collect(Collectors.toSet());

        List<RunRecord> ordered = orderByCreatedAt(runsById.values());
        List<CanonicalMessage> messages = new ArrayList<>();
        List<RunSummary> summaries = new ArrayList<>();
        Instant latest = null;

        for (RunRecord run : ordered) {
            if (run.createdAt() != null && (latest == null || run.createdAt().isAfter(latest))) {
                latest = run.createdAt();
            }
            List<String> children = childrenByParent.getOrDefault(run.runId(), List.of());
            if (childRunIds.contains(run.runId())) {
                summaries.add(RunSummary.of(run, children, 0));
                continue;
            }

            int messageCount = 0;
            if (run.hasInput()) {
                messages.add(synthesize(sessionId, run, MessageRole.USER, run.inputContent()));
                messageCount++;
            }
            if (run.hasContent()) {
                messages.add(synthesize(sessionId, run, MessageRole.ASSISTANT, run.content()));
                messageCount++;
            }
            if (messageCount == 0) {
                log.debug("Run produced no message sessionId={}, runId={}, status={}",
                        sessionId, run.runId(), run.status());
            }
            summaries.add(RunSummary.of(run, children, messageCount));
        }

        return new NormalizedRunLog(messages, summaries, runsById, childrenByParent, latest);
    }

    private CanonicalMessage synthesize(String sessionId, RunRecord run, MessageRole role, String content) {
        String messageId = MessageIdentity.assign(sessionId, run.runId(), role, content, run.createdAt());
        return CanonicalMessage.fromRun(messageId, role, content, run.createdAt(), run);
    }

    private static List<RunRecord> orderByCreatedAt(Iterable<RunRecord> runs) {
        List<RunRecord> ordered = new ArrayList<>();
        runs.forEach(ordered::add);
        // Stable sort: runs without a timestamp keep their fetch position relative to each other.
        ordered.sort(Comparator.comparing(RunRecord::createdAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        return ordered;
    }
}
