package com.sessionmemory.ai.chat;

import reactor.core.publisher.Flux;

/**
 * The model call made between rendering memory and appending the result.
 * Failures are not translated; they reach the caller as thrown.
 */
public interface LanguageModelClient {

    String complete(PromptContext context);

    Flux<String> stream(PromptContext context);
}
