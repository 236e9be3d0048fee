package com.sessionmemory.ai.memory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, insertion-ordered facts of one session. Once full, each new fact
 * evicts the oldest one. Not thread-safe; guarded by the owning
 * {@link SessionHandle}'s lock.
 */
final class LongTermStore {

    static final String DELIMITER = ". ";

    private final Deque<String> facts = new ArrayDeque<>();
    private final int capacity;

    LongTermStore(int capacity) {
        this.capacity = capacity;
    }

    /**
     * Appends {@code fact} and returns how many older facts were evicted to stay
     * within capacity.
     */
    int add(String fact) {
        facts.addLast(fact);
        int evicted = 0;
        while (facts.size() > capacity) {
            facts.removeFirst();
            evicted++;
        }
        return evicted;
    }

    String render() {
        return String.join(DELIMITER, facts);
    }

    List<String> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(facts));
    }

    int size() {
        return facts.size();
    }

    int capacity() {
        return capacity;
    }
}
