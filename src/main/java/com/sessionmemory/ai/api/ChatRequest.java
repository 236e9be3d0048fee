package com.sessionmemory.ai.api;

public record ChatRequest(String sessionId, String message) {}
