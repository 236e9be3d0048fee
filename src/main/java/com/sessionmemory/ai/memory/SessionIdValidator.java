package com.sessionmemory.ai.memory;

/**
 * Caller-defined validation for session ids, applied after the built-in
 * null/blank check. Return {@code null} to accept, or a short reason to reject.
 */
@FunctionalInterface
public interface SessionIdValidator {

    String rejectReason(String sessionId);

    static SessionIdValidator acceptAll() {
        return sessionId -> null;
    }

    /**
     * Rejects ids longer than {@code maxLength} or containing ISO control characters.
     */
    static SessionIdValidator maxLength(int maxLength) {
        return sessionId -> {
            if (sessionId.length() > maxLength) {
                return "longer than " + maxLength + " characters";
            }
            for (int i = 0; i < sessionId.length(); i++) {
                if (Character.isISOControl(sessionId.charAt(i))) {
                    return "contains control characters";
                }
            }
            return null;
        };
    }
}
