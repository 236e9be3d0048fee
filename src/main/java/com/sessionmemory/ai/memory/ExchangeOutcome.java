package com.sessionmemory.ai.memory;

/**
 * Result of committing an exchange: how many candidates the retention policy
 * kept or turned down, and the long-term view afterwards.
 */
public record ExchangeOutcome(int factsRetained, int factsRejected, String longTerm) {
}
