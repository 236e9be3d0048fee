package com.sessionmemory.ai.memory;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of a {@link SessionMemoryManager}. Validated on construction so
 * that a bad capacity fails at startup rather than on the first request.
 *
 * @param longTermCapacity maximum number of facts kept per session, {@code >= 0}
 * @param retentionThresholdChars threshold used by the baseline {@link LengthRetentionPolicy}
 * @param shortTermMaxTurns cap on short-term turns per session, {@code 0} for unbounded
 * @param retainAssistantResponses whether assistant responses are also offered to the retention policy
 * @param lockTimeout bounded wait for a session lock, {@link Duration#ZERO} to wait indefinitely
 */
public record MemorySettings(
        int longTermCapacity,
        int retentionThresholdChars,
        int shortTermMaxTurns,
        boolean retainAssistantResponses,
        Duration lockTimeout
) {

    public static final int DEFAULT_LONG_TERM_CAPACITY = 5;
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(2);

    public MemorySettings {
        if (longTermCapacity < 0) {
            throw new CapacityMisconfigurationException(longTermCapacity);
        }
        if (retentionThresholdChars < 0) {
            throw new IllegalArgumentException("Retention threshold must be >= 0 but was " + retentionThresholdChars);
        }
        if (shortTermMaxTurns < 0) {
            throw new IllegalArgumentException("Short-term max turns must be >= 0 but was " + shortTermMaxTurns);
        }
        Objects.requireNonNull(lockTimeout, "lockTimeout");
        if (lockTimeout.isNegative()) {
            throw new IllegalArgumentException("Lock timeout must not be negative but was " + lockTimeout);
        }
    }

    public static MemorySettings defaults() {
        return new MemorySettings(
                DEFAULT_LONG_TERM_CAPACITY,
                LengthRetentionPolicy.DEFAULT_THRESHOLD,
                0,
                false,
                DEFAULT_LOCK_TIMEOUT);
    }

    public MemorySettings withLongTermCapacity(int capacity) {
        return new MemorySettings(capacity, retentionThresholdChars, shortTermMaxTurns,
                retainAssistantResponses, lockTimeout);
    }

    public MemorySettings withShortTermMaxTurns(int maxTurns) {
        return new MemorySettings(longTermCapacity, retentionThresholdChars, maxTurns,
                retainAssistantResponses, lockTimeout);
    }

    public MemorySettings withLockTimeout(Duration timeout) {
        return new MemorySettings(longTermCapacity, retentionThresholdChars, shortTermMaxTurns,
                retainAssistantResponses, timeout);
    }

    public MemorySettings withRetainAssistantResponses(boolean retain) {
        return new MemorySettings(longTermCapacity, retentionThresholdChars, shortTermMaxTurns,
                retain, lockTimeout);
    }
}
