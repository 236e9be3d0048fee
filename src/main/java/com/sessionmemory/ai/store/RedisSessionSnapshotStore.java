package com.sessionmemory.ai.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionmemory.ai.memory.SessionSnapshot;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Stores each session snapshot as one JSON string under {@code keyPrefix + sessionId}.
 * Every write refreshes the TTL, so a session idle for longer than the TTL is
 * forgotten by Redis as well.
 *
 * <p>Writes are compare-and-set on {@link SessionSnapshot#revision()} under
 * {@code WATCH}/{@code MULTI}: a snapshot whose revision is not newer than the
 * stored one is dropped, so writers finishing out of order cannot roll a session back.
 */
public class RedisSessionSnapshotStore implements SessionSnapshotStore {

  private static final Logger log = LoggerFactory.getLogger(RedisSessionSnapshotStore.class);
  private static final int MAX_WRITE_ATTEMPTS = 5;

  private final StringRedisTemplate redis;
  private final ObjectMapper mapper;
  private final Duration ttl;
  private final String keyPrefix;

  public RedisSessionSnapshotStore(
      StringRedisTemplate redis,
      ObjectMapper mapper,
      Duration ttl,
      String keyPrefix) {
    this.redis = redis;
    this.mapper = mapper;
    this.ttl = ttl;
    this.keyPrefix = keyPrefix;
  }

  @Override
  public Optional<SessionSnapshot> get(String sessionId) {
    String json = redis.opsForValue().get(key(sessionId));
    if (json == null || json.isBlank()) {
      return Optional.empty();
    }

    SessionSnapshot snapshot = deserialize(json, sessionId);
    if (snapshot.version() > SessionSnapshot.CURRENT_VERSION) {
      throw new IllegalStateException("Unsupported session snapshot version " + snapshot.version()
          + " for " + sessionId);
    }
    return Optional.of(snapshot);
  }

  @Override
  public void put(SessionSnapshot snapshot) {
    String json;
    try {
      json = mapper.writeValueAsString(snapshot);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to serialize session snapshot for " + snapshot.sessionId(), e);
    }

    String key = key(snapshot.sessionId());
    for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
      WriteResult result = redis.execute(new ConditionalWrite(key, json, snapshot));
      if (result == WriteResult.WRITTEN) {
        log.debug("Session snapshot saved sessionId={} revision={} turns={} facts={}",
            snapshot.sessionId(), snapshot.revision(), snapshot.turns().size(), snapshot.facts().size());
        return;
      }
      if (result == WriteResult.STALE) {
        log.debug("Session snapshot skipped, newer revision stored sessionId={} revision={}",
            snapshot.sessionId(), snapshot.revision());
        return;
      }
      log.debug("Session snapshot write raced sessionId={} attempt={}", snapshot.sessionId(), attempt);
    }
    throw new IllegalStateException("Concurrent writers kept racing on session snapshot for "
        + snapshot.sessionId() + " after " + MAX_WRITE_ATTEMPTS + " attempts");
  }

  @Override
  public void remove(String sessionId) {
    redis.delete(key(sessionId));
  }

  private String key(String sessionId) {
    return keyPrefix + sessionId;
  }

  private SessionSnapshot deserialize(String json, String sessionId) {
    try {
      return mapper.readValue(json, SessionSnapshot.class);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to deserialize session snapshot for " + sessionId, e);
    }
  }

  private enum WriteResult { WRITTEN, STALE, RACED }

  private final class ConditionalWrite implements SessionCallback<WriteResult> {

    private final String key;
    private final String json;
    private final SessionSnapshot snapshot;

    ConditionalWrite(String key, String json, SessionSnapshot snapshot) {
      this.key = key;
      this.json = json;
      this.snapshot = snapshot;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <K, V> WriteResult execute(RedisOperations<K, V> operations) throws DataAccessException {
      RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
      ops.watch(key);
      String stored = ops.opsForValue().get(key);
      if (stored != null && !stored.isBlank() && storedRevision(stored) >= snapshot.revision()) {
        ops.unwatch();
        return WriteResult.STALE;
      }
      ops.multi();
      ops.opsForValue().set(key, json, ttl);
      List<Object> replies = ops.exec();
      // an aborted transaction replies with nothing
      return replies == null || replies.isEmpty() ? WriteResult.RACED : WriteResult.WRITTEN;
    }

    private long storedRevision(String stored) {
      try {
        return mapper.readTree(stored).path("revision").asLong(0L);
      } catch (Exception e) {
        log.warn("Unreadable session snapshot will be replaced sessionId={}", snapshot.sessionId(), e);
        return -1L;
      }
    }
  }
}
