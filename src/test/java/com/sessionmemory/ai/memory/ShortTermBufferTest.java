package com.sessionmemory.ai.memory;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

public class ShortTermBufferTest {

  @Test
  void keepsConversationOrder() {
    ShortTermBuffer buffer = new ShortTermBuffer(0);
    Turn t1 = Turn.user("Hi there");
    Turn t2 = Turn.assistant("Hello! How can I help?");
    Turn t3 = Turn.user("Tell me a joke");

    buffer.append(t1);
    buffer.append(t2);
    buffer.append(t3);

    assertEquals(List.of(t1, t2, t3), buffer.snapshot());
  }

  @Test
  void unboundedWhenMaxIsZero() {
    ShortTermBuffer buffer = new ShortTermBuffer(0);
    for (int i = 0; i < 500; i++) {
      buffer.append(Turn.user("turn " + i));
    }
    assertEquals(500, buffer.size());
  }

  @Test
  void capDropsOldestTurns() {
    ShortTermBuffer buffer = new ShortTermBuffer(2);
    buffer.append(Turn.user("one"));
    buffer.append(Turn.assistant("two"));
    buffer.append(Turn.user("three"));

    assertEquals(List.of(Turn.assistant("two"), Turn.user("three")), buffer.snapshot());
  }

  @Test
  void duplicateTurnsAreNotCollapsed() {
    ShortTermBuffer buffer = new ShortTermBuffer(0);
    buffer.append(Turn.user("again"));
    buffer.append(Turn.user("again"));
    assertEquals(2, buffer.snapshot().size());
  }

  @Test
  void snapshotIsReadOnly() {
    ShortTermBuffer buffer = new ShortTermBuffer(0);
    buffer.append(Turn.user("x"));
    assertThrows(UnsupportedOperationException.class, () -> buffer.snapshot().clear());
  }
}
