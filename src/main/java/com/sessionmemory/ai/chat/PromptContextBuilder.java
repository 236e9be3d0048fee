package com.sessionmemory.ai.chat;

import com.sessionmemory.ai.memory.Turn;
import java.util.ArrayList;
import java.util.List;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class PromptContextBuilder {

    static final String DEFAULT_SYSTEM_PROMPT = """
            You are a helpful assistant with memory of this conversation.
            Use LONG_TERM_MEMORY only as reference about the user.
            Do NOT invent facts that are not in the conversation or in memory.
            """;

    private final String systemPrompt;

    public PromptContextBuilder(@Value("${app.chat.system-prompt:}") String systemPrompt) {
        this.systemPrompt = systemPrompt == null || systemPrompt.isBlank()
                ? DEFAULT_SYSTEM_PROMPT
                : systemPrompt;
    }

    public PromptContext build(String sessionId, List<Turn> shortTerm, String longTerm, String userInput) {
        String systemText = systemPrompt.strip();
        if (longTerm != null && !longTerm.isBlank()) {
            systemText += "\n\nLONG_TERM_MEMORY (oldest first):\n" + longTerm;
        }
        return new PromptContext(sessionId, systemText, toMessages(shortTerm), userInput);
    }

    List<Message> toMessages(List<Turn> turns) {
        List<Message> messages = new ArrayList<>(turns.size());
        for (Turn turn : turns) {
            switch (turn.role()) {
                case USER -> messages.add(new UserMessage(turn.text()));
                case ASSISTANT -> messages.add(new AssistantMessage(turn.text()));
            }
        }
        return messages;
    }
}
