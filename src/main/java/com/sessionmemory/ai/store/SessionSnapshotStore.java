package com.sessionmemory.ai.store;

import com.sessionmemory.ai.memory.SessionSnapshot;
import java.util.Optional;

public interface SessionSnapshotStore {
  Optional<SessionSnapshot> get(String sessionId);
  void put(SessionSnapshot snapshot);
  void remove(String sessionId);
}
