package com.multipost.provider;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "multipost.adaptation", name = "mock-provider", havingValue = "false")
class AdaptationClientConfiguration {

    @Bean
    ChatClient adaptationChatClient(ChatClient.Builder builder) {
        return builder.build();
    }

    @Bean
    ChatClientGenerativeAdaptationClient chatClientGenerativeAdaptationClient(ChatClient adaptationChatClient) {
        return new ChatClientGenerativeAdaptationClient(adaptationChatClient);
    }
}
