package com.sessionmemory.ai.store;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sessionmemory.ai.memory.SessionSnapshot;
import com.sessionmemory.ai.memory.Turn;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

class RedisSessionSnapshotStoreTest {

  private static final Duration TTL = Duration.ofMinutes(30);

  private final Map<String, String> values = new HashMap<>();
  private StringRedisTemplate redis;
  private ValueOperations<String, String> ops;
  private RedisSessionSnapshotStore store;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    redis = mock(StringRedisTemplate.class);
    ops = mock(ValueOperations.class);
    when(redis.opsForValue()).thenReturn(ops);
    when(ops.get(anyString())).thenAnswer(inv -> values.get(inv.getArgument(0, String.class)));
    doAnswer(inv -> {
      values.put(inv.getArgument(0), inv.getArgument(1));
      return null;
    }).when(ops).set(anyString(), anyString(), any(Duration.class));
    when(redis.execute(any(SessionCallback.class)))
        .thenAnswer(inv -> inv.getArgument(0, SessionCallback.class).execute(redis));
    when(redis.exec()).thenReturn(List.of(true));

    ObjectMapper mapper = new ObjectMapper()
        .findAndRegisterModules()
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    store = new RedisSessionSnapshotStore(redis, mapper, TTL, "memory:");
  }

  @Test
  void writesJsonUnderPrefixedKeyWithTtlAndReadsItBack() {
    SessionSnapshot snapshot = new SessionSnapshot(
        1,
        "abc",
        3,
        List.of(Turn.user("My name is Alice."), Turn.assistant("Hi Alice!")),
        List.of("User said: My name is Alice and I live in Lisbon"),
        Instant.parse("2026-01-01T10:15:30Z"));

    store.put(snapshot);

    ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
    verify(ops).set(eq("memory:abc"), json.capture(), eq(TTL));
    assertTrue(json.getValue().contains("\"role\":\"USER\""));
    assertTrue(json.getValue().contains("\"revision\":3"));
    verify(redis).watch("memory:abc");
    verify(redis).multi();

    assertEquals(snapshot, store.get("abc").orElseThrow());
  }

  @Test
  @DisplayName("Writes finishing out of order keep the newer revision")
  void olderRevisionDoesNotReplaceNewer() {
    SessionSnapshot newer = snapshot(4, "User said: Hello! My name is Alice.", "User said: Do you remember my name?");
    SessionSnapshot older = snapshot(2, "User said: Hello! My name is Alice.");

    store.put(newer);
    store.put(older);

    assertEquals(newer, store.get("abc").orElseThrow());
    verify(ops, times(1)).set(anyString(), anyString(), any(Duration.class));
    verify(redis).unwatch();
  }

  @Test
  void sameRevisionIsNotRewritten() {
    store.put(snapshot(2, "first"));
    store.put(snapshot(2, "first"));

    verify(ops, times(1)).set(anyString(), anyString(), any(Duration.class));
  }

  @Test
  void abortedTransactionIsRetried() {
    // first transaction aborts: its queued write never happens
    when(redis.exec()).thenAnswer(inv -> {
      values.clear();
      return List.of();
    }).thenReturn(List.of(true));

    store.put(snapshot(1, "fact"));

    verify(redis, times(2)).multi();
    assertEquals(1, store.get("abc").orElseThrow().revision());
  }

  @Test
  void writeGivesUpWhenEveryAttemptRaces() {
    when(redis.exec()).thenAnswer(inv -> {
      values.clear();
      return List.of();
    });

    IllegalStateException e = assertThrows(IllegalStateException.class, () -> store.put(snapshot(1, "fact")));
    assertTrue(e.getMessage().contains("abc"));
  }

  @Test
  void unreadableStoredValueIsReplaced() {
    values.put("memory:abc", "{not json");

    store.put(snapshot(1, "fact"));

    assertEquals(List.of("fact"), store.get("abc").orElseThrow().facts());
  }

  @Test
  void missingOrBlankValueIsEmpty() {
    values.put("memory:blank", " ");

    assertTrue(store.get("none").isEmpty());
    assertTrue(store.get("blank").isEmpty());
  }

  @Test
  void corruptPayloadFails() {
    values.put("memory:abc", "{not json");

    IllegalStateException e = assertThrows(IllegalStateException.class, () -> store.get("abc"));
    assertTrue(e.getMessage().contains("abc"));
  }

  @Test
  void newerSchemaVersionIsRefused() {
    values.put("memory:abc",
        "{\"version\":2,\"sessionId\":\"abc\",\"revision\":1,\"turns\":[],\"facts\":[],"
            + "\"capturedAt\":\"2026-01-01T00:00:00Z\"}");

    assertThrows(IllegalStateException.class, () -> store.get("abc"));
  }

  @Test
  void removeDeletesKey() {
    store.remove("abc");
    verify(redis).delete("memory:abc");
  }

  private static SessionSnapshot snapshot(long revision, String... facts) {
    return new SessionSnapshot(1, "abc", revision, List.of(Turn.user("hi")), List.of(facts),
        Instant.parse("2026-01-01T00:00:00Z"));
  }
}
