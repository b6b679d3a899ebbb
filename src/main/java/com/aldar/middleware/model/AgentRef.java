package com.aldar.middleware.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AgentRef(
        String agentId,
        String agentName
) {

    public AgentRef withAgentName(String name) {
        return new AgentRef(agentId, name);
    }

    public AgentRef withAgentId(String id) {
        return new AgentRef(id, agentName);
    }
}
