package com.sessionmemory.ai.memory;

/**
 * Speaker of a {@link Turn}. Each role also carries the prefix used when text
 * spoken in that role is retained as a long-term fact.
 */
public enum Role {
    USER("User said: "),
    ASSISTANT("Assistant said: ");

    private final String factPrefix;

    Role(String factPrefix) {
        this.factPrefix = factPrefix;
    }

    public String toFact(String text) {
        return factPrefix + text;
    }
}
