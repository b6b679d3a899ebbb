package com.aldar.middleware.controller;

import com.aldar.middleware.model.api.ApiResponse;
import com.aldar.middleware.model.api.RegisterAgentRequest;
import com.aldar.middleware.store.AgentDirectoryStore;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Keeps the agent directory current. Renames reach transcripts once the cached name expires.
 */
@RestController
@RequestMapping("/api/agents")
public class AgentDirectoryController {

    private final AgentDirectoryStore agentDirectoryStore;

    public AgentDirectoryController(AgentDirectoryStore agentDirectoryStore) {
        this.agentDirectoryStore = agentDirectoryStore;
    }

    @PutMapping("/{agentId}")
    public Mono<ApiResponse<Map<String, String>>> register(
            @PathVariable String agentId,
            @Valid @RequestBody RegisterAgentRequest request
    ) {
        return Mono.fromCallable(() -> {
                    agentDirectoryStore.registerAgent(agentId, request.name());
                    return Map.of("agent_id", agentId, "name", request.name().trim());
                })
                .subscribeOn(Schedulers.boundedElastic())
                .map(ApiResponse::success);
    }
}
