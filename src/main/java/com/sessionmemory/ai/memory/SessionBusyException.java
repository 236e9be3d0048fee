package com.sessionmemory.ai.memory;

import java.time.Duration;

/**
 * The session lock could not be acquired within the configured wait.
 * Callers may retry; the manager never does.
 */
public class SessionBusyException extends IllegalStateException {

    private final String sessionId;

    public SessionBusyException(String sessionId, Duration waited) {
        super("Session " + sessionId + " is busy, lock not acquired within " + waited);
        this.sessionId = sessionId;
    }

    public SessionBusyException(String sessionId, InterruptedException cause) {
        super("Interrupted while waiting for session " + sessionId, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
