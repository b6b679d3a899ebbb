package com.aldar.middleware.transcript;

import com.aldar.middleware.model.CanonicalMessage;
import com.aldar.middleware.model.RunRecord;
import com.aldar.middleware.model.RunSummary;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link RunLogNormalizer}: synthesized messages in run order plus per-run
 * bookkeeping used by the later stages.
 *
 * @param latestRunTimestamp newest {@code created_at} among all fetched runs, or {@code null}
 */
public record NormalizedRunLog(
        List<CanonicalMessage> messages,
        List<RunSummary> summaries,
        Map<String, RunRecord> runsById,
        Map<String, List<String>> childRunIdsByParent,
        Instant latestRunTimestamp
) {

    public NormalizedRunLog {
        messages = messages == null ? List.of() : List.copyOf(messages);
        summaries = summaries == null ? List.of() : List.copyOf(summaries);
        runsById = runsById == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(runsById));
        childRunIdsByParent = childRunIdsByParent == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(childRunIdsByParent));
    }

    public static NormalizedRunLog empty() {
        return new NormalizedRunLog(List.of(), List.of(), Map.of(), Map.of(), null);
    }

    public boolean isEmpty() {
        return runsById.isEmpty();
    }

    public List<String> childRunIds(String runId) {
        return childRunIdsByParent.getOrDefault(runId, List.of());
    }
}
