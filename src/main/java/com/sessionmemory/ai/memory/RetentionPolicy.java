package com.sessionmemory.ai.memory;

/**
 * Decides whether a piece of conversation text is salient enough to become a
 * long-term fact. Implementations must be side-effect free; the manager may
 * call them while holding a session lock.
 */
@FunctionalInterface
public interface RetentionPolicy {

    boolean accepts(String turnText);
}
