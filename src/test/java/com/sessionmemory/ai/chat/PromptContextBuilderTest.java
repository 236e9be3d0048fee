package com.sessionmemory.ai.chat;

import static org.junit.jupiter.api.Assertions.*;

import com.sessionmemory.ai.memory.Turn;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.UserMessage;

class PromptContextBuilderTest {

  @Test
  void emptyMemoryUsesPlainSystemPrompt() {
    PromptContextBuilder builder = new PromptContextBuilder("");

    PromptContext context = builder.build("s", List.of(), "", "Hello");

    assertEquals(PromptContextBuilder.DEFAULT_SYSTEM_PROMPT.strip(), context.systemText());
    assertFalse(context.systemText().contains("LONG_TERM_MEMORY"));
    assertTrue(context.history().isEmpty());
    assertEquals("Hello", context.userInput());
    assertEquals("s", context.sessionId());
  }

  @Test
  void longTermViewIsAppendedToSystemText() {
    PromptContextBuilder builder = new PromptContextBuilder("You are terse.");

    PromptContext context = builder.build(
        "s", List.of(), "User said: Hello! My name is Alice.", "Do you remember my name?");

    assertEquals("You are terse.\n\nLONG_TERM_MEMORY (oldest first):\nUser said: Hello! My name is Alice.",
        context.systemText());
  }

  @Test
  void historyKeepsRolesAndOrder() {
    PromptContextBuilder builder = new PromptContextBuilder(null);

    PromptContext context = builder.build("s",
        List.of(Turn.user("What is Java?"), Turn.assistant("A language."), Turn.user("Example?")),
        "", "More");

    assertEquals(3, context.history().size());
    assertInstanceOf(UserMessage.class, context.history().get(0));
    assertInstanceOf(AssistantMessage.class, context.history().get(1));
    assertInstanceOf(UserMessage.class, context.history().get(2));
    assertEquals("What is Java?", context.history().get(0).getText());
    assertEquals("A language.", context.history().get(1).getText());
  }
}
