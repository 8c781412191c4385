package com.keyco.assist.exception;

/**
 * Thrown when an input surface refers to a session that was never created or has been torn down.
 */
public class SessionNotFoundException extends AssistException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Assist session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
