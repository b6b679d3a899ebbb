package com.aldar.middleware.transcript.source;

import com.aldar.middleware.model.LocalMessage;

import java.util.List;

public interface MessageLedger {

    /**
     * Messages of one session owned by one user, oldest first.
     */
    List<LocalMessage> listMessages(String sessionId, String userId);
}
