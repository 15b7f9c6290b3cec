package com.multipost.provider;

import java.util.List;

/**
 * Raw generator output for one network, before length limits are applied.
 */
public record GeneratedAdaptation(
        String adaptedText,
        List<String> hashtags,
        String imageSuggestion,
        String tone
) {
    public GeneratedAdaptation {
        hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
    }
}
