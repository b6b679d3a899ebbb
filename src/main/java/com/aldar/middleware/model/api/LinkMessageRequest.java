package com.aldar.middleware.model.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Links a ledger message to the stream and run started for it. Either field may be omitted.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LinkMessageRequest(
        String streamId,
        String runId
) {
}
