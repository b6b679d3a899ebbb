package com.aldar.middleware.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * Per-run rollup kept for every fetched run, including runs that produced no message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunSummary(
        String runId,
        String parentRunId,
        String teamId,
        String teamName,
        String agentId,
        String agentName,
        RunStatus status,
        Instant createdAt,
        List<RunEvent> events,
        List<MemberResponse> memberResponses,
        List<String> childRunIds,
        int messageCount,
        List<AgentRef> agentsInvolved
) {

    public RunSummary {
        events = events == null ? List.of() : List.copyOf(events);
        memberResponses = memberResponses == null ? List.of() : List.copyOf(memberResponses);
        childRunIds = childRunIds == null ? List.of() : List.copyOf(childRunIds);
        agentsInvolved = agentsInvolved == null ? List.of() : List.copyOf(agentsInvolved);
    }

    public static RunSummary of(RunRecord run, List<String> childRunIds, int messageCount) {
        return new RunSummary(
                run.runId(),
                run.parentRunId(),
                run.teamId(),
                run.teamName(),
                run.agentId(),
                run.agentName(),
                run.status(),
                run.createdAt(),
                run.events(),
                run.memberResponses(),
                childRunIds,
                messageCount,
                List.of()
        );
    }

    public RunSummary withMessageCount(int count) {
        return new RunSummary(runId, parentRunId, teamId, teamName, agentId, agentName, status, createdAt,
                events, memberResponses, childRunIds, count, agentsInvolved);
    }

    public RunSummary withAgentsInvolved(List<AgentRef> agents) {
        return new RunSummary(runId, parentRunId, teamId, teamName, agentId, agentName, status, createdAt,
                events, memberResponses, childRunIds, messageCount, agents);
    }

    public RunSummary withNames(String resolvedAgentName, String resolvedTeamName) {
        return new RunSummary(runId, parentRunId, teamId, resolvedTeamName, agentId, resolvedAgentName, status, createdAt,
                events, memberResponses, childRunIds, messageCount, agentsInvolved);
    }
}
