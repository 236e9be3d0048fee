package com.sessionmemory.ai.chat;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

@Component
public class SpringAiLanguageModelClient implements LanguageModelClient {

    private final ChatClient chatClient;

    public SpringAiLanguageModelClient(@Qualifier("memoryChatClient") ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public String complete(PromptContext context) {
        return chatClient.prompt()
                .system(context.systemText())
                .messages(context.history())
                .user(context.userInput())
                .call()
                .content();
    }

    @Override
    public Flux<String> stream(PromptContext context) {
        return chatClient.prompt()
                .system(context.systemText())
                .messages(context.history())
                .user(context.userInput())
                .stream()
                .content();
    }
}
