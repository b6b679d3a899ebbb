package com.aldar.middleware.model;

import java.time.Instant;
import java.util.List;

/**
 * One top-level or delegated run as recorded by the orchestration service.
 * Fields the upstream omitted or sent in an unexpected shape are {@code null}.
 */
public record RunRecord(
        String runId,
        String parentRunId,
        String teamId,
        String teamName,
        String agentId,
        String agentName,
        RunStatus status,
        Instant createdAt,
        String inputContent,
        String content,
        List<RunEvent> events,
        List<MemberResponse> memberResponses
) {

    public RunRecord {
        status = status == null ? RunStatus.UNKNOWN : status;
        events = events == null ? List.of() : List.copyOf(events);
        memberResponses = memberResponses == null ? List.of() : List.copyOf(memberResponses);
    }

    public boolean hasParent() {
        return parentRunId != null && !parentRunId.isBlank();
    }

    public boolean hasInput() {
        return inputContent != null && !inputContent.isBlank();
    }

    public boolean hasContent() {
        return content != null && !content.isBlank();
    }
}
