package com.aldar.middleware.model.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AppendMessageRequest(
        String messageId,
        String role,
        @NotBlank
        String content,
        String agentId,
        Map<String, Object> metadata
) {
}
