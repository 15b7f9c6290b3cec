package com.multipost.provider;

import com.multipost.model.SocialNetwork;
import org.springframework.ai.chat.client.ChatClient;

import java.util.Map;

/**
 * Adapts content through the configured chat model, asking for a structured JSON answer.
 */
public class ChatClientGenerativeAdaptationClient implements GenerativeAdaptationClient {

    private static final Map<SocialNetwork, String> NETWORK_GUIDELINES = Map.of(
            SocialNetwork.FACEBOOK,
            "Conversational and engaging. Medium length, 1 to 3 paragraphs. Up to 3 hashtags. Emojis are fine.",
            SocialNetwork.INSTAGRAM,
            "Visual and inspiring. Strong first line. 5 to 15 relevant hashtags at the end. Needs an image.",
            SocialNetwork.LINKEDIN,
            "Professional and insightful. Clear structure, a question or call to action at the end. 3 to 5 hashtags.",
            SocialNetwork.TIKTOK,
            "Short, punchy and trend aware. Hook in the first words. 3 to 6 hashtags. Describes a short video.",
            SocialNetwork.WHATSAPP,
            "Personal and direct, like a message to a friend. Very short. No hashtags. Sent as a status with media."
    );

    private final ChatClient chatClient;

    public ChatClientGenerativeAdaptationClient(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public GeneratedAdaptation generate(AdaptationRequest request) {
        SocialNetwork network = request.network();
        GeneratedAdaptation adaptation = chatClient.prompt()
                .system("""
                        You are a social media editor. Rewrite the given content for %s.
                        Guidelines: %s
                        Keep the text under %d characters. Answer with adaptedText, hashtags,
                        imageSuggestion (null when no image is needed) and tone.
                        """.formatted(network.code(), NETWORK_GUIDELINES.get(network), network.maxTextLength()))
                .user("Title: " + request.title() + "\n\n" + request.body())
                .call()
                .entity(GeneratedAdaptation.class);
        if (adaptation == null || adaptation.adaptedText() == null || adaptation.adaptedText().isBlank()) {
            throw new IllegalStateException("Chat model returned no adapted text for " + network.code());
        }
        return adaptation;
    }
}
