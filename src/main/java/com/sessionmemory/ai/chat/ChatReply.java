package com.sessionmemory.ai.chat;

public record ChatReply(
    String sessionId,
    String answer,
    String longTermMemory
) {}
