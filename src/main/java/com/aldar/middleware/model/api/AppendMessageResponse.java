package com.aldar.middleware.model.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AppendMessageResponse(
        String messageId,
        String sessionId,
        Instant createdAt
) {
}
