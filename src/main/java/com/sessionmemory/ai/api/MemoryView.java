package com.sessionmemory.ai.api;

import com.sessionmemory.ai.memory.Turn;
import java.util.List;

/**
 * Read-only view of both memory tiers of a session.
 *
 * @param sessionId the session rendered
 * @param shortTerm turns in conversation order
 * @param longTerm retained facts joined oldest first, empty when none
 */
public record MemoryView(String sessionId, List<Turn> shortTerm, String longTerm) {}
