package com.sessionmemory.ai.memory;

/**
 * An exchange tried to commit into a session that was closed or evicted after
 * the exchange had rendered it.
 */
public class SessionClosedException extends IllegalStateException {

    private final String sessionId;

    public SessionClosedException(String sessionId) {
        super("Session " + sessionId + " was closed before the exchange could be committed");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
