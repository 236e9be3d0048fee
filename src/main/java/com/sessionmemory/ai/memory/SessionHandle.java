package com.sessionmemory.ai.memory;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single live state object of one session. Handles are handed out by
 * {@link SessionMemoryManager#getOrCreateSession(String)}; two calls for the same
 * id return the same instance until the session is closed. The memory tiers are
 * only reachable from inside this package, so the manager stays their sole mutator.
 */
public final class SessionHandle {

    private final String sessionId;
    private final ShortTermBuffer shortTerm;
    private final LongTermStore longTerm;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Instant createdAt;
    private volatile Instant lastAccessedAt;
    private volatile boolean closed;
    // guarded by lock
    private long revision;
    private int exchangesInFlight;

    SessionHandle(String sessionId, MemorySettings settings, Instant createdAt) {
        this.sessionId = sessionId;
        this.shortTerm = new ShortTermBuffer(settings.shortTermMaxTurns());
        this.longTerm = new LongTermStore(settings.longTermCapacity());
        this.createdAt = createdAt;
        this.lastAccessedAt = createdAt;
    }

    public String sessionId() {
        return sessionId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastAccessedAt() {
        return lastAccessedAt;
    }

    void touch(Instant now) {
        lastAccessedAt = now;
    }

    ShortTermBuffer shortTerm() {
        return shortTerm;
    }

    LongTermStore longTerm() {
        return longTerm;
    }

    ReentrantLock lock() {
        return lock;
    }

    /**
     * Whether the session was closed or evicted. A closed handle is never reused;
     * the next reference to the same id gets a fresh session.
     */
    public boolean isClosed() {
        return closed;
    }

    void markClosed() {
        closed = true;
    }

    long revision() {
        return revision;
    }

    void setRevision(long revision) {
        this.revision = revision;
    }

    void bumpRevision() {
        revision++;
    }

    int exchangesInFlight() {
        return exchangesInFlight;
    }

    void exchangeStarted() {
        exchangesInFlight++;
    }

    void exchangeFinished() {
        if (exchangesInFlight > 0) {
            exchangesInFlight--;
        }
    }

    @Override
    public String toString() {
        return "SessionHandle[" + sessionId + "]";
    }
}
