package com.aldar.middleware.transcript;

import com.aldar.middleware.model.LocalMessage;
import com.aldar.middleware.model.MemberResponse;
import com.aldar.middleware.model.MessageRole;
import com.aldar.middleware.model.RunEvent;
import com.aldar.middleware.model.RunRecord;
import com.aldar.middleware.model.RunStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

final class TranscriptFixtures {

    static final String SESSION_ID = "5b1f2a9e-0c44-4c1d-9d7e-2f8e61a0b7c3";
    static final String USER_ID = "user-7f3a";
    static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private TranscriptFixtures() {
    }

    static RunRecord run(String runId, Instant createdAt, String input, String content) {
        return new RunRecord(runId, null, null, null, "agent-main", "Main Agent", RunStatus.COMPLETED,
                createdAt, input, content, List.of(), List.of());
    }

    static RunRecord teamRun(String runId, Instant createdAt, String input, String content) {
        return new RunRecord(runId, null, "team-1", "Research Team", "agent-coordinator", "Coordinator",
                RunStatus.COMPLETED, createdAt, input, content, List.of(), List.of());
    }

    static RunRecord childRun(String runId, String parentRunId, Instant createdAt, String agentId, String agentName,
                              String content) {
        return new RunRecord(runId, parentRunId, null, null, agentId, agentName, RunStatus.COMPLETED,
                createdAt, null, content, List.of(), List.of());
    }

    static RunRecord runWithParticipants(String runId, Instant createdAt, String input, String content,
                                         List<RunEvent> events, List<MemberResponse> members) {
        return new RunRecord(runId, null, null, null, "agent-main", "Main Agent", RunStatus.COMPLETED,
                createdAt, input, content, events, members);
    }

    static LocalMessage local(String id, MessageRole role, String content, Instant createdAt) {
        return new LocalMessage(id, SESSION_ID, role, content, createdAt, null, Map.of());
    }

    static LocalMessage local(String id, MessageRole role, String content, Instant createdAt, Map<String, Object> metadata) {
        return new LocalMessage(id, SESSION_ID, role, content, createdAt, null, metadata);
    }
}
