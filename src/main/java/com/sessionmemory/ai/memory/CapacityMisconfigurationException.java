package com.sessionmemory.ai.memory;

public class CapacityMisconfigurationException extends IllegalArgumentException {

    public CapacityMisconfigurationException(int capacity) {
        super("Long-term capacity must be >= 0 but was " + capacity);
    }
}
