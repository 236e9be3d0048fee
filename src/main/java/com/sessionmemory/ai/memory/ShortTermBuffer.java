package com.sessionmemory.ai.memory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Verbatim turns of one session in conversation order. Not thread-safe; guarded
 * by the owning {@link SessionHandle}'s lock.
 */
final class ShortTermBuffer {

    private final Deque<Turn> turns = new ArrayDeque<>();
    private final int maxTurns;

    ShortTermBuffer(int maxTurns) {
        this.maxTurns = maxTurns;
    }

    void append(Turn turn) {
        turns.addLast(turn);
        while (maxTurns > 0 && turns.size() > maxTurns) {
            turns.removeFirst();
        }
    }

    List<Turn> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(turns));
    }

    int size() {
        return turns.size();
    }
}
