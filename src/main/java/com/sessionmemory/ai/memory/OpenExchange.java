package com.sessionmemory.ai.memory;

import java.util.List;
import java.util.Objects;

/**
 * An exchange started by {@link SessionMemoryManager#openExchange(String)}: the
 * session it belongs to and the memory rendered for the prompt.
 */
public record OpenExchange(SessionHandle session, List<Turn> shortTerm, String longTerm) {

    public OpenExchange {
        Objects.requireNonNull(session, "session");
        shortTerm = List.copyOf(shortTerm);
        longTerm = longTerm == null ? "" : longTerm;
    }

    public String sessionId() {
        return session.sessionId();
    }
}
