package com.aldar.middleware.transcript.source;

import com.aldar.middleware.model.Feedback;

import java.util.Optional;

public interface FeedbackStore {

    /**
     * The user's reaction to a message. Message ids compare case-insensitively.
     */
    Optional<Feedback> getFeedback(String messageId, String userId);
}
