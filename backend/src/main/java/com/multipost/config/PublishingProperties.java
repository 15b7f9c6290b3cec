package com.multipost.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Publish retry policy and network credentials.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "multipost.publishing")
public class PublishingProperties {

    private int maxRetries = 3;
    private long retryBackoffMs = 60_000;

    /**
     * Register simulated publishers for every network instead of the live API clients.
     */
    private boolean mockNetworks = true;

    private Facebook facebook = new Facebook();
    private Instagram instagram = new Instagram();
    private Whatsapp whatsapp = new Whatsapp();

    @Getter
    @Setter
    public static class Facebook {
        private String baseUrl = "https://graph.facebook.com/v19.0";
        private String pageId;
        private String accessToken;
    }

    /**
     * Instagram publishes through the Graph API with the Facebook page token.
     */
    @Getter
    @Setter
    public static class Instagram {
        private String userId;
    }

    @Getter
    @Setter
    public static class Whatsapp {
        private String baseUrl = "https://gate.whapi.cloud";
        private String token;
    }
}
