package com.aldar.middleware.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One entry of the reconciled transcript. Built per read and never persisted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CanonicalMessage(
        String messageId,
        MessageRole role,
        String content,
        Instant timestamp,
        String runId,
        String agentId,
        String agentName,
        String teamId,
        String teamName,
        List<Attachment> attachments,
        List<AgentRef> agentsInvolved,
        Feedback feedback,
        String streamId,
        String streamStatus,
        String localMessageId,
        Map<String, Object> customFields,
        MessageSource source
) {

    public CanonicalMessage {
        content = content == null ? "" : content;
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        agentsInvolved = agentsInvolved == null ? List.of() : List.copyOf(agentsInvolved);
        customFields = customFields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(customFields));
    }

    public static CanonicalMessage fromRun(
            String messageId,
            MessageRole role,
            String content,
            Instant timestamp,
            RunRecord run
    ) {
        return new CanonicalMessage(
                messageId,
                role,
                content,
                timestamp,
                run.runId(),
                run.agentId(),
                run.agentName(),
                run.teamId(),
                run.teamName(),
                List.of(),
                List.of(),
                null,
                null,
                null,
                null,
                Map.of(),
                MessageSource.RUN_LOG
        );
    }

    public static CanonicalMessage fromLedger(LocalMessage local) {
        return new CanonicalMessage(
                local.id(),
                local.role(),
                local.content(),
                local.createdAt(),
                local.linkedRunId(),
                local.agentId(),
                null,
                null,
                null,
                local.attachments(),
                List.of(),
                null,
                local.streamId(),
                null,
                local.id(),
                local.customFields(),
                MessageSource.LEDGER
        );
    }

    public boolean isUser() {
        return role == MessageRole.USER;
    }

    public boolean isAssistant() {
        return role == MessageRole.ASSISTANT;
    }

    public CanonicalMessage inheritFrom(LocalMessage local) {
        List<Attachment> merged = new ArrayList<>(attachments);
        merged.addAll(local.attachments());
        Map<String, Object> fields = new LinkedHashMap<>(customFields);
        local.customFields().forEach(fields::putIfAbsent);
        return new CanonicalMessage(
                messageId, role, content, timestamp, runId,
                agentId != null ? agentId : local.agentId(),
                agentName, teamId, teamName,
                merged, agentsInvolved, feedback,
                streamId != null ? streamId : local.streamId(),
                streamStatus, local.id(), fields, source
        );
    }

    public CanonicalMessage withAgentName(String name) {
        return new CanonicalMessage(messageId, role, content, timestamp, runId, agentId, name, teamId, teamName,
                attachments, agentsInvolved, feedback, streamId, streamStatus, localMessageId, customFields, source);
    }

    public CanonicalMessage withTeamName(String name) {
        return new CanonicalMessage(messageId, role, content, timestamp, runId, agentId, agentName, teamId, name,
                attachments, agentsInvolved, feedback, streamId, streamStatus, localMessageId, customFields, source);
    }

    public CanonicalMessage withAttachments(List<Attachment> value) {
        return new CanonicalMessage(messageId, role, content, timestamp, runId, agentId, agentName, teamId, teamName,
                value, agentsInvolved, feedback, streamId, streamStatus, localMessageId, customFields, source);
    }

    public CanonicalMessage withAgentsInvolved(List<AgentRef> value) {
        return new CanonicalMessage(messageId, role, content, timestamp, runId, agentId, agentName, teamId, teamName,
                attachments, value, feedback, streamId, streamStatus, localMessageId, customFields, source);
    }

    public CanonicalMessage withFeedback(Feedback value) {
        return new CanonicalMessage(messageId, role, content, timestamp, runId, agentId, agentName, teamId, teamName,
                attachments, agentsInvolved, value, streamId, streamStatus, localMessageId, customFields, source);
    }

    public CanonicalMessage withStream(String id, String status) {
        return new CanonicalMessage(messageId, role, content, timestamp, runId, agentId, agentName, teamId, teamName,
                attachments, agentsInvolved, feedback, id, status, localMessageId, customFields, source);
    }
}
