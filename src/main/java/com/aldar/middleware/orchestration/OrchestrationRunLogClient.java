package com.aldar.middleware.orchestration;

import com.aldar.middleware.config.OrchestrationProperties;
import com.aldar.middleware.model.RunRecord;
import com.aldar.middleware.transcript.source.RunLogProvider;
import com.aldar.middleware.transcript.source.RunLogUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Fetches a session's runs from the orchestration service. Every failure, including the
 * bounded timeout, surfaces as {@link RunLogUnavailableException}.
 */
public class OrchestrationRunLogClient implements RunLogProvider {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationRunLogClient.class);

    private final WebClient webClient;
    private final OrchestrationProperties properties;
    private final RunLogParser parser;

    public OrchestrationRunLogClient(WebClient webClient, OrchestrationProperties properties, RunLogParser parser) {
        this.webClient = webClient;
        this.properties = properties;
        this.parser = parser;
    }

    @Override
    public List<RunRecord> fetchRuns(String sessionId) {
        if (!StringUtils.hasText(properties.getBaseUrl())) {
            throw new RunLogUnavailableException(sessionId, "orchestration.run-log.base-url is not configured");
        }
        Duration timeout = resolveTimeout();
        long startedAt = System.nanoTime();
        String body;
        try {
            body = webClient.get()
                    .uri(properties.getRunsPath(), sessionId)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException ex) {
            if (ex.getStatusCode().value() == 404) {
                log.debug("Run log has no entry for sessionId={}", sessionId);
                return List.of();
            }
            throw new RunLogUnavailableException(
                    sessionId,
                    "run log request failed with status " + ex.getStatusCode().value(),
                    ex
            );
        } catch (RuntimeException ex) {
            if (hasCause(ex, TimeoutException.class)) {
                throw new RunLogUnavailableException(sessionId, "run log request timed out after " + timeout, ex);
            }
            throw new RunLogUnavailableException(sessionId, "run log request failed", ex);
        }
        List<RunRecord> runs;
        try {
            runs = parser.parse(sessionId, body);
        } catch (JsonProcessingException ex) {
            throw new RunLogUnavailableException(sessionId, "run log body is not valid JSON", ex);
        }
        log.debug("Fetched run log sessionId={}, runs={}, elapsedMs={}",
                sessionId, runs.size(), (System.nanoTime() - startedAt) / 1_000_000L);
        return runs;
    }

    private Duration resolveTimeout() {
        Duration timeout = properties.getTimeout();
        return timeout == null || timeout.isZero() || timeout.isNegative() ? Duration.ofSeconds(10) : timeout;
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
