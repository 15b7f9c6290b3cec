package com.multipost.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Generative adaptation settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "multipost.adaptation")
public class AdaptationProperties {

    /**
     * Use the deterministic local generator instead of the chat model.
     */
    private boolean mockProvider = true;
    private int timeoutSeconds = 30;
    private int concurrency = 5;
    private List<String> defaultNetworks = List.of("facebook", "instagram", "linkedin", "whatsapp");
}
