package com.sessionmemory.ai.memory;

/**
 * Accepts text strictly longer than a character threshold. Length is counted in
 * code points, so a surrogate pair counts as one character.
 */
public class LengthRetentionPolicy implements RetentionPolicy {

    public static final int DEFAULT_THRESHOLD = 20;

    private final int thresholdChars;

    public LengthRetentionPolicy() {
        this(DEFAULT_THRESHOLD);
    }

    public LengthRetentionPolicy(int thresholdChars) {
        if (thresholdChars < 0) {
            throw new IllegalArgumentException("Retention threshold must be >= 0 but was " + thresholdChars);
        }
        this.thresholdChars = thresholdChars;
    }

    @Override
    public boolean accepts(String turnText) {
        if (turnText == null) {
            return false;
        }
        return turnText.codePointCount(0, turnText.length()) > thresholdChars;
    }

    @Override
    public String toString() {
        return "LengthRetentionPolicy[thresholdChars=" + thresholdChars + "]";
    }
}
