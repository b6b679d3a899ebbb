package com.aldar.middleware.model.api;

import com.aldar.middleware.model.CanonicalMessage;
import com.aldar.middleware.model.RunSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TranscriptPage(
        List<CanonicalMessage> messages,
        boolean hasMore,
        List<RunSummary> runSummaries,
        boolean runLogAvailable
) {

    public TranscriptPage {
        messages = messages == null ? List.of() : List.copyOf(messages);
        runSummaries = runSummaries == null ? List.of() : List.copyOf(runSummaries);
    }

    public static TranscriptPage empty(boolean runLogAvailable) {
        return new TranscriptPage(List.of(), false, List.of(), runLogAvailable);
    }
}
