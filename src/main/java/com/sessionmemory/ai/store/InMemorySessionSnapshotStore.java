package com.sessionmemory.ai.store;

import com.sessionmemory.ai.memory.SessionSnapshot;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemorySessionSnapshotStore implements SessionSnapshotStore {

  private final ConcurrentMap<String, SessionSnapshot> snapshots = new ConcurrentHashMap<>();

  @Override
  public Optional<SessionSnapshot> get(String sessionId) {
    return Optional.ofNullable(snapshots.get(sessionId));
  }

  @Override
  public void put(SessionSnapshot snapshot) {
    // a slower writer must not roll a session back to an older revision
    snapshots.merge(snapshot.sessionId(), snapshot,
        (current, candidate) -> candidate.revision() > current.revision() ? candidate : current);
  }

  @Override
  public void remove(String sessionId) {
    snapshots.remove(sessionId);
  }

  int size() {
    return snapshots.size();
  }
}
