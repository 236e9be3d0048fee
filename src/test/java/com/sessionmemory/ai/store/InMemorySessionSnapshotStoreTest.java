package com.sessionmemory.ai.store;

import static org.junit.jupiter.api.Assertions.*;

import com.sessionmemory.ai.memory.SessionSnapshot;
import com.sessionmemory.ai.memory.Turn;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

public class InMemorySessionSnapshotStoreTest {

  private final InMemorySessionSnapshotStore store = new InMemorySessionSnapshotStore();

  @Test
  void putGetRemove() {
    SessionSnapshot snapshot = snapshot("s", "fact", 1);

    store.put(snapshot);
    assertEquals(snapshot, store.get("s").orElseThrow());

    store.remove("s");
    assertTrue(store.get("s").isEmpty());
    assertEquals(0, store.size());
  }

  @Test
  void olderRevisionDoesNotReplaceNewer() {
    SessionSnapshot newer = snapshot("s", "newer", 5);
    SessionSnapshot older = snapshot("s", "older", 3);

    store.put(newer);
    store.put(older);

    assertEquals(List.of("newer"), store.get("s").orElseThrow().facts());
  }

  private static SessionSnapshot snapshot(String sessionId, String fact, long revision) {
    return new SessionSnapshot(1, sessionId, revision, List.of(Turn.user("hi")), List.of(fact),
        Instant.parse("2026-01-01T00:00:00Z"));
  }
}
