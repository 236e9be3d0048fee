package com.sessionmemory.ai.memory;

/**
 * Raised when a session id is null, blank, or rejected by the configured
 * {@link SessionIdValidator}. Nothing is created or mutated when it is thrown.
 */
public class InvalidSessionIdException extends IllegalArgumentException {

    private final String sessionId;

    public InvalidSessionIdException(String sessionId, String reason) {
        super("Invalid session id: " + reason);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
