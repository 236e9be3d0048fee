package com.sessionmemory.ai.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChatClientConfig {

    @Bean(name = "memoryChatClient")
    public ChatClient memoryChatClient(
            OllamaChatModel chatModel,
            @Value("${app.models.chat:llama3.2:3b}") String chatModelName,
            @Value("${app.models.temperature:0.7}") double temperature) {
        return ChatClient.builder(chatModel)
                .defaultOptions(ChatOptions.builder()
                        .model(chatModelName)
                        .temperature(temperature)
                        .build())
                .build();
    }
}
