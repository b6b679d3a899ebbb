package com.aldar.middleware.orchestration;

import com.aldar.middleware.model.MemberResponse;
import com.aldar.middleware.model.RunEvent;
import com.aldar.middleware.model.RunRecord;
import com.aldar.middleware.model.RunStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the orchestration service's run list. Fields whose shape does not match are
 * treated as absent; entries that cannot be read at all are skipped.
 */
@Component
public class RunLogParser {

    private static final Logger log = LoggerFactory.getLogger(RunLogParser.class);

    // Epoch values above this are milliseconds.
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    private final ObjectMapper objectMapper;

    public RunLogParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * A blank body means no runs. A body that is not JSON at all is reported to the caller.
     */
    public List<RunRecord> parse(String sessionId, String body) throws JsonProcessingException {
        if (!StringUtils.hasText(body)) {
            return List.of();
        }
        return parse(sessionId, objectMapper.readTree(body));
    }

    public List<RunRecord> parse(String sessionId, JsonNode root) {
        JsonNode items = resolveRunArray(root);
        if (items == null) {
            return List.of();
        }
        List<RunRecord> runs = new ArrayList<>();
        int index = 0;
        for (JsonNode item : items) {
            try {
                RunRecord run = toRunRecord(item);
                if (run == null) {
                    log.warn("Skipping run entry without run_id sessionId={}, index={}", sessionId, index);
                } else {
                    runs.add(run);
                }
            } catch (Exception ex) {
                log.warn("Skipping malformed run entry sessionId={}, index={}", sessionId, index, ex);
            }
            index++;
        }
        return List.copyOf(runs);
    }

    private JsonNode resolveRunArray(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return null;
        }
        if (root.isArray()) {
            return root;
        }
        if (root.isObject()) {
            for (String field : List.of("data", "runs", "items")) {
                JsonNode candidate = root.get(field);
                if (candidate != null && candidate.isArray()) {
                    return candidate;
                }
            }
        }
        return null;
    }

    RunRecord toRunRecord(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String runId = text(node.get("run_id"));
        if (runId == null) {
            return null;
        }
        return new RunRecord(
                runId,
                text(node.get("parent_run_id")),
                text(node.get("team_id")),
                text(node.get("team_name")),
                text(node.get("agent_id")),
                text(node.get("agent_name")),
                RunStatus.from(text(node.get("status"))),
                timestamp(node.get("created_at")),
                inputContent(node.get("input")),
                contentText(node.get("content")),
                events(node.get("events")),
                memberResponses(node.get("member_responses"))
        );
    }

    private String inputContent(JsonNode input) {
        if (input == null || input.isNull()) {
            return null;
        }
        if (input.isTextual()) {
            return text(input);
        }
        if (!input.isObject()) {
            return null;
        }
        JsonNode content = input.has("content") ? input.get("content") : input.get("input_content");
        if (content == null || content.isNull()) {
            return null;
        }
        if (content.isTextual()) {
            return text(content);
        }
        if (content.isArray()) {
            for (JsonNode part : content) {
                if (part != null && part.isObject() && "user".equalsIgnoreCase(part.path("role").asText(""))) {
                    return contentText(part.get("content"));
                }
            }
        }
        return null;
    }

    private String contentText(JsonNode content) {
        if (content == null || content.isNull()) {
            return null;
        }
        if (content.isTextual()) {
            return text(content);
        }
        if (content.isObject() || content.isArray()) {
            // Structured output; keep its JSON form rather than dropping it.
            return content.toString();
        }
        return content.asText();
    }

    private List<RunEvent> events(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<RunEvent> events = new ArrayList<>();
        for (JsonNode item : node) {
            if (item == null || !item.isObject()) {
                continue;
            }
            events.add(new RunEvent(
                    text(item.get("event")),
                    text(item.get("agent_id")),
                    text(item.get("agent_name")),
                    text(item.get("team_id")),
                    text(item.get("team_name")),
                    timestamp(item.get("created_at"))
            ));
        }
        return events;
    }

    private List<MemberResponse> memberResponses(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<MemberResponse> responses = new ArrayList<>();
        for (JsonNode item : node) {
            if (item == null || !item.isObject()) {
                continue;
            }
            String agentId = text(item.get("agent_id"));
            String agentPublicId = text(item.get("agent_public_id"));
            String agentName = text(item.get("agent_name"));
            if (agentId == null && agentPublicId == null && agentName == null) {
                continue;
            }
            responses.add(new MemberResponse(agentId, agentPublicId, agentName));
        }
        return responses;
    }

    static Instant timestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return fromEpoch(node.asDouble());
        }
        if (!node.isTextual()) {
            return null;
        }
        String raw = node.asText().trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return fromEpoch(Double.parseDouble(raw));
        } catch (NumberFormatException ignored) {
            // not numeric, try ISO forms below
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException ignored) {
            // no offset
        }
        try {
            return LocalDateTime.parse(raw.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static Instant fromEpoch(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value <= 0) {
            return null;
        }
        if (value >= EPOCH_MILLIS_THRESHOLD) {
            return Instant.ofEpochMilli((long) value);
        }
        long seconds = (long) value;
        long nanos = Math.round((value - seconds) * 1_000_000_000L);
        return Instant.ofEpochSecond(seconds, nanos);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject() || node.isArray()) {
            return null;
        }
        String value = node.asText();
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
