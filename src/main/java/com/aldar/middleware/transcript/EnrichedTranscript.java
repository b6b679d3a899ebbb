package com.aldar.middleware.transcript;

import com.aldar.middleware.model.CanonicalMessage;
import com.aldar.middleware.model.RunSummary;

import java.util.List;

public record EnrichedTranscript(List<CanonicalMessage> messages, List<RunSummary> summaries) {

    public EnrichedTranscript {
        messages = messages == null ? List.of() : List.copyOf(messages);
        summaries = summaries == null ? List.of() : List.copyOf(summaries);
    }
}
