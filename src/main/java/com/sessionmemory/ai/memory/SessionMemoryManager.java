package com.sessionmemory.ai.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the short-term and long-term memory of every session.
 *
 * <p>Sessions are created lazily on first reference. Operations on one session
 * run under that session's lock, so they are linearizable with respect to each
 * other; operations on different sessions never contend beyond the map lookup.
 * Nothing here performs I/O, so callers are expected to render, release, talk
 * to the model, and then come back to append. {@link #openExchange(String)},
 * {@link #commitExchange(OpenExchange, String, String)} and
 * {@link #finishExchange(OpenExchange)} package that sequence: an open exchange
 * keeps its session from being evicted as idle, and a commit never lands in a
 * session other than the one the exchange was rendered from.
 */
public class SessionMemoryManager {

    private static final Logger log = LoggerFactory.getLogger(SessionMemoryManager.class);

    private final ConcurrentMap<String, SessionHandle> sessions = new ConcurrentHashMap<>();
    private final MemorySettings settings;
    private final RetentionPolicy retentionPolicy;
    private final SessionIdValidator sessionIdValidator;
    private final Clock clock;

    public SessionMemoryManager(MemorySettings settings) {
        this(settings, new LengthRetentionPolicy(settings.retentionThresholdChars()));
    }

    public SessionMemoryManager(MemorySettings settings, RetentionPolicy retentionPolicy) {
        this(settings, retentionPolicy, SessionIdValidator.acceptAll(), Clock.systemUTC());
    }

    public SessionMemoryManager(
            MemorySettings settings,
            RetentionPolicy retentionPolicy,
            SessionIdValidator sessionIdValidator,
            Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.retentionPolicy = Objects.requireNonNull(retentionPolicy, "retentionPolicy");
        this.sessionIdValidator = Objects.requireNonNull(sessionIdValidator, "sessionIdValidator");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SessionHandle getOrCreateSession(String sessionId) {
        validate(sessionId);
        SessionHandle handle = sessions.computeIfAbsent(sessionId, this::newSession);
        handle.touch(clock.instant());
        return handle;
    }

    /**
     * Applies the same validation every operation applies, without touching any
     * session.
     *
     * @throws InvalidSessionIdException if the id is null, blank, or rejected by the validator
     */
    public void requireValidSessionId(String sessionId) {
        validate(sessionId);
    }

    public boolean hasSession(String sessionId) {
        return sessionId != null && sessions.containsKey(sessionId);
    }

    public void appendTurn(String sessionId, Turn turn) {
        Objects.requireNonNull(turn, "turn");
        withSession(sessionId, handle -> {
            handle.shortTerm().append(turn);
            handle.bumpRevision();
            return null;
        });
    }

    /**
     * Offers user input to the retention policy.
     *
     * @return {@code true} if a fact was stored, {@code false} if the policy rejected it
     */
    public boolean recordForLongTerm(String sessionId, String candidateText) {
        return recordForLongTerm(sessionId, Role.USER, candidateText);
    }

    public boolean recordForLongTerm(String sessionId, Role role, String candidateText) {
        Objects.requireNonNull(role, "role");
        return withSession(sessionId, handle -> retain(handle, role, candidateText));
    }

    public List<Turn> renderShortTerm(String sessionId) {
        return withSession(sessionId, handle -> handle.shortTerm().snapshot());
    }

    /**
     * Facts joined with {@code ". "}, oldest first, or an empty string when the
     * session has none.
     */
    public String renderLongTerm(String sessionId) {
        return withSession(sessionId, handle -> handle.longTerm().render());
    }

    /**
     * Starts an exchange: renders both tiers and marks the session as having an
     * exchange in flight, all under one acquisition of the session lock. Every
     * open exchange must be finished with {@link #finishExchange(OpenExchange)}.
     */
    public OpenExchange openExchange(String sessionId) {
        return withSession(sessionId, handle -> {
            handle.exchangeStarted();
            return new OpenExchange(handle, handle.shortTerm().snapshot(), handle.longTerm().render());
        });
    }

    /**
     * Appends the user turn and the assistant turn of an exchange and offers them
     * to the retention policy, atomically. The assistant answer is only offered
     * when {@link MemorySettings#retainAssistantResponses()} is set.
     *
     * @throws SessionClosedException if the session was closed after the exchange opened
     */
    public ExchangeOutcome commitExchange(OpenExchange exchange, String userInput, String answer) {
        Objects.requireNonNull(exchange, "exchange");
        Turn userTurn = Turn.user(userInput);
        Turn assistantTurn = Turn.assistant(answer);
        SessionHandle handle = exchange.session();
        acquire(handle);
        try {
            if (handle.isClosed()) {
                throw new SessionClosedException(handle.sessionId());
            }
            handle.touch(clock.instant());
            handle.shortTerm().append(userTurn);
            handle.shortTerm().append(assistantTurn);
            handle.bumpRevision();

            int retained = 0;
            int rejected = 0;
            if (retain(handle, Role.USER, userInput)) {
                retained++;
            } else {
                rejected++;
            }
            if (settings.retainAssistantResponses()) {
                if (retain(handle, Role.ASSISTANT, answer)) {
                    retained++;
                } else {
                    rejected++;
                }
            }
            return new ExchangeOutcome(retained, rejected, handle.longTerm().render());
        } finally {
            handle.lock().unlock();
        }
    }

    /**
     * Ends an exchange, committed or not. Safe to call on a closed session.
     */
    public void finishExchange(OpenExchange exchange) {
        SessionHandle handle = exchange.session();
        // not bounded by the lock timeout: a missed count-down pins the session forever
        handle.lock().lock();
        try {
            handle.exchangeFinished();
            handle.touch(clock.instant());
        } finally {
            handle.lock().unlock();
        }
    }

    public Optional<SessionSnapshot> snapshot(String sessionId) {
        validate(sessionId);
        SessionHandle handle = sessions.get(sessionId);
        if (handle == null) {
            return Optional.empty();
        }
        return snapshot(handle);
    }

    /**
     * Snapshot of the given handle, or empty once that handle has been closed,
     * even if a newer session with the same id exists.
     */
    public Optional<SessionSnapshot> snapshot(SessionHandle handle) {
        acquire(handle);
        try {
            if (handle.isClosed()) {
                return Optional.empty();
            }
            return Optional.of(new SessionSnapshot(
                    SessionSnapshot.CURRENT_VERSION,
                    handle.sessionId(),
                    handle.revision(),
                    handle.shortTerm().snapshot(),
                    handle.longTerm().snapshot(),
                    clock.instant()));
        } finally {
            handle.lock().unlock();
        }
    }

    /**
     * Recreates a session from a snapshot. A session that is already live wins:
     * it is returned as-is and the snapshot is ignored. Restored facts bypass the
     * retention policy but are still trimmed to the current capacity.
     */
    public SessionHandle restore(SessionSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        String sessionId = snapshot.sessionId();
        validate(sessionId);
        SessionHandle handle = sessions.computeIfAbsent(sessionId, id -> {
            SessionHandle restored = newSession(id);
            snapshot.turns().forEach(restored.shortTerm()::append);
            snapshot.facts().forEach(restored.longTerm()::add);
            restored.setRevision(snapshot.revision());
            log.info("Session restored sessionId={} turns={} facts={}",
                    id, restored.shortTerm().size(), restored.longTerm().size());
            return restored;
        });
        handle.touch(clock.instant());
        return handle;
    }

    public boolean closeSession(String sessionId) {
        validate(sessionId);
        SessionHandle handle = sessions.get(sessionId);
        if (handle == null) {
            return false;
        }
        acquire(handle);
        try {
            if (handle.isClosed()) {
                return false;
            }
            handle.markClosed();
            sessions.remove(sessionId, handle);
        } finally {
            handle.lock().unlock();
        }
        log.info("Session closed sessionId={}", sessionId);
        return true;
    }

    /**
     * Closes every session not accessed for longer than {@code idleFor}. Sessions
     * whose lock is currently held, or that have an exchange in flight, are in use
     * and are skipped.
     *
     * @return ids of the sessions that were closed
     */
    public List<String> evictIdleSessions(Duration idleFor) {
        Objects.requireNonNull(idleFor, "idleFor");
        Instant cutoff = clock.instant().minus(idleFor);
        List<String> evicted = new ArrayList<>();
        for (SessionHandle handle : sessions.values()) {
            if (!handle.lastAccessedAt().isBefore(cutoff) || !handle.lock().tryLock()) {
                continue;
            }
            try {
                if (!handle.isClosed()
                        && handle.exchangesInFlight() == 0
                        && handle.lastAccessedAt().isBefore(cutoff)) {
                    handle.markClosed();
                    sessions.remove(handle.sessionId(), handle);
                    evicted.add(handle.sessionId());
                }
            } finally {
                handle.lock().unlock();
            }
        }
        if (!evicted.isEmpty()) {
            log.info("Idle sessions evicted count={} idleFor={}", evicted.size(), idleFor);
        }
        return evicted;
    }

    public int sessionCount() {
        return sessions.size();
    }

    public MemorySettings settings() {
        return settings;
    }

    private <T> T withSession(String sessionId, Function<SessionHandle, T> action) {
        while (true) {
            SessionHandle handle = getOrCreateSession(sessionId);
            acquire(handle);
            try {
                // closed between lookup and lock: retry against the replacement
                if (!handle.isClosed()) {
                    return action.apply(handle);
                }
            } finally {
                handle.lock().unlock();
            }
        }
    }

    // caller holds the handle's lock
    private boolean retain(SessionHandle handle, Role role, String candidateText) {
        if (!retentionPolicy.accepts(candidateText)) {
            return false;
        }
        int evicted = handle.longTerm().add(role.toFact(candidateText));
        handle.bumpRevision();
        if (evicted > 0) {
            log.debug("Long-term eviction sessionId={} evicted={} capacity={}",
                    handle.sessionId(), evicted, handle.longTerm().capacity());
        }
        return true;
    }

    private void acquire(SessionHandle handle) {
        Duration timeout = settings.lockTimeout();
        if (timeout.isZero()) {
            handle.lock().lock();
            return;
        }
        try {
            if (!handle.lock().tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                log.warn("Session lock timeout sessionId={} waited={}", handle.sessionId(), timeout);
                throw new SessionBusyException(handle.sessionId(), timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionBusyException(handle.sessionId(), e);
        }
    }

    private SessionHandle newSession(String sessionId) {
        log.debug("Session created sessionId={}", sessionId);
        return new SessionHandle(sessionId, settings, clock.instant());
    }

    private void validate(String sessionId) {
        if (sessionId == null) {
            throw new InvalidSessionIdException(null, "must not be null");
        }
        if (sessionId.isBlank()) {
            throw new InvalidSessionIdException(sessionId, "must not be blank");
        }
        String reason = sessionIdValidator.rejectReason(sessionId);
        if (reason != null) {
            throw new InvalidSessionIdException(sessionId, reason);
        }
    }
}
