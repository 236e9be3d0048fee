package com.sessionmemory.ai.chat;

import java.util.List;
import org.springframework.ai.chat.messages.Message;

/**
 * Everything the language model sees for one exchange.
 */
public record PromptContext(
        String sessionId,
        String systemText,
        List<Message> history,
        String userInput
) {}
