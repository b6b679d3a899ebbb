package com.aldar.middleware.transcript.source;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

public interface AgentDirectory {

    /**
     * Current display names keyed by agent id. Unknown ids are absent from the result.
     */
    Map<String, String> resolveAgentNames(Collection<String> agentIds);

    /**
     * Canonical id of the agent currently carrying {@code agentName}, compared case-insensitively.
     */
    Optional<String> findAgentIdByName(String agentName);
}
