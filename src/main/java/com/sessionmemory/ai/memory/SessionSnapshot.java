package com.sessionmemory.ai.memory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Point-in-time copy of one session, the unit persistence adapters read and
 * write. {@code turns} and {@code facts} are in conversation and retention order.
 * {@code revision} counts the mutations the session has seen; a higher revision
 * of the same session is always the more recent state.
 */
public record SessionSnapshot(
        int version,
        String sessionId,
        long revision,
        List<Turn> turns,
        List<String> facts,
        Instant capturedAt
) {

    public static final int CURRENT_VERSION = 1;

    public SessionSnapshot {
        Objects.requireNonNull(sessionId, "sessionId");
        if (revision < 0) {
            throw new IllegalArgumentException("revision must be >= 0 but was " + revision);
        }
        turns = turns == null ? List.of() : List.copyOf(turns);
        facts = facts == null ? List.of() : List.copyOf(facts);
    }
}
