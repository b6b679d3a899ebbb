package com.aldar.middleware.transcript;

import com.aldar.middleware.config.TranscriptProperties;
import com.aldar.middleware.model.ActiveStream;
import com.aldar.middleware.model.CanonicalMessage;
import com.aldar.middleware.model.LocalMessage;
import com.aldar.middleware.model.RunRecord;
import com.aldar.middleware.model.RunSummary;
import com.aldar.middleware.model.api.TranscriptPage;
import com.aldar.middleware.model.api.TranscriptQuery;
import com.aldar.middleware.transcript.source.MessageLedger;
import com.aldar.middleware.transcript.source.RunLogProvider;
import com.aldar.middleware.transcript.source.RunLogUnavailableException;
import com.aldar.middleware.transcript.source.StreamMarkerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple3;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merge-on-read of the orchestration run log and the local ledger into one transcript page.
 * Holds no state between calls.
 */
@Service
public class TranscriptReconciler {

    private static final Logger log = LoggerFactory.getLogger(TranscriptReconciler.class);

    private final RunLogProvider runLogProvider;
    private final MessageLedger messageLedger;
    private final StreamMarkerStore streamMarkerStore;
    private final RunLogNormalizer normalizer;
    private final LedgerMatcher ledgerMatcher;
    private final MessageDeduplicator deduplicator;
    private final TranscriptEnricher enricher;
    private final StreamingOverlay streamingOverlay;
    private final TranscriptPaginator paginator;
    private final TranscriptProperties properties;

    public TranscriptReconciler(
            RunLogProvider runLogProvider,
            MessageLedger messageLedger,
            StreamMarkerStore streamMarkerStore,
            RunLogNormalizer normalizer,
            LedgerMatcher ledgerMatcher,
            MessageDeduplicator deduplicator,
            TranscriptEnricher enricher,
            StreamingOverlay streamingOverlay,
            TranscriptPaginator paginator,
            TranscriptProperties properties
    ) {
        this.runLogProvider = runLogProvider;
        this.messageLedger = messageLedger;
        this.streamMarkerStore = streamMarkerStore;
        this.normalizer = normalizer;
        this.ledgerMatcher = ledgerMatcher;
        this.deduplicator = deduplicator;
        this.enricher = enricher;
        this.streamingOverlay = streamingOverlay;
        this.paginator = paginator;
        this.properties = properties;
    }

    public TranscriptPage reconcile(TranscriptQuery query) {
        long startedAt = System.currentTimeMillis();
        String sessionId = query.sessionId();

        Tuple3<RunLogFetch, List<LocalMessage>, Optional<ActiveStream>> sources = Mono.zip(
                        fetchRunLog(sessionId),
                        fetchLedger(sessionId, query.userId()),
                        fetchMarker(sessionId))
                .block(properties.getSourceTimeout());
        if (sources == null) {
            throw new IllegalStateException("transcript sources returned no result for session " + sessionId);
        }
        RunLogFetch runLogFetch = sources.getT1();
        List<LocalMessage> ledger = sources.getT2();
        Optional<ActiveStream> marker = sources.getT3();

        NormalizedRunLog runLog = normalizer.normalize(sessionId, runLogFetch.runs());
        List<CanonicalMessage> matched = ledgerMatcher.match(sessionId, runLog, ledger, marker);
        List<CanonicalMessage> deduplicated = deduplicator.deduplicate(matched);
        EnrichedTranscript enriched = enricher.enrich(sessionId, query.userId(), deduplicated, runLog);
        List<CanonicalMessage> overlaid = streamingOverlay.apply(sessionId, enriched.messages(), marker);
        List<RunSummary> summaries = withMessageCounts(enriched.summaries(), enriched.messages());

        TranscriptPaginator.Page page = paginator.page(overlaid, query.limit(), query.beforeMessageId(), query.includeSystem());
        log.debug("Reconciled transcript sessionId={}, runs={}, ledger={}, total={}, returned={}, hasMore={}, elapsedMs={}",
                sessionId, runLog.runsById().size(), ledger.size(), overlaid.size(),
                page.messages().size(), page.hasMore(), System.currentTimeMillis() - startedAt);
        return new TranscriptPage(page.messages(), page.hasMore(), summaries, runLogFetch.available());
    }

    private Mono<RunLogFetch> fetchRunLog(String sessionId) {
        return Mono.fromCallable(() -> RunLogFetch.of(runLogProvider.fetchRuns(sessionId)))
                .onErrorResume(RunLogUnavailableException.class, ex -> {
                    log.warn("Run log unavailable, serving ledger only sessionId={}, reason={}", sessionId, ex.getMessage());
                    return Mono.just(RunLogFetch.unavailable());
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<List<LocalMessage>> fetchLedger(String sessionId, String userId) {
        return Mono.fromCallable(() -> {
                    List<LocalMessage> messages = messageLedger.listMessages(sessionId, userId);
                    return messages == null ? List.<LocalMessage>of() : messages;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Optional<ActiveStream>> fetchMarker(String sessionId) {
        return Mono.fromCallable(() -> {
                    Optional<ActiveStream> marker = streamMarkerStore.getActiveStream(sessionId);
                    return marker == null ? Optional.<ActiveStream>empty() : marker;
                })
                .onErrorResume(RuntimeException.class, ex -> {
                    log.warn("Stream marker lookup failed, skipping overlay sessionId={}", sessionId, ex);
                    return Mono.just(Optional.empty());
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static List<RunSummary> withMessageCounts(List<RunSummary> summaries, List<CanonicalMessage> messages) {
        Map<String, Integer> counts = new HashMap<>();
        for (CanonicalMessage message : messages) {
            if (message.runId() != null) {
                counts.merge(message.runId(), 1, Integer::sum);
            }
        }
        List<RunSummary> counted = new ArrayList<>(summaries.size());
        for (RunSummary summary : summaries) {
            counted.add(summary.withMessageCount(counts.getOrDefault(summary.runId(), 0)));
        }
        return counted;
    }

    private record RunLogFetch(List<RunRecord> runs, boolean available) {

        static RunLogFetch of(List<RunRecord> runs) {
            return new RunLogFetch(runs == null ? List.of() : runs, true);
        }

        static RunLogFetch unavailable() {
            return new RunLogFetch(List.of(), false);
        }
    }
}
