package com.aldar.middleware.transcript.source;

public class RunLogUnavailableException extends RuntimeException {

    private final String sessionId;

    public RunLogUnavailableException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public RunLogUnavailableException(String sessionId, String message) {
        this(sessionId, message, null);
    }

    public String getSessionId() {
        return sessionId;
    }
}
