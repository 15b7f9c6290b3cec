package com.multipost.provider;

import com.multipost.model.SocialNetwork;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic adapter used for local runs and tests. The same request always yields the same output.
 */
@Component
@ConditionalOnProperty(
        prefix = "multipost.adaptation",
        name = "mock-provider",
        havingValue = "true",
        matchIfMissing = true
)
public class MockGenerativeAdaptationClient implements GenerativeAdaptationClient {

    private static final List<String> TONES = List.of("friendly", "professional", "enthusiastic", "informative");
    private static final int MAX_HASHTAGS = 5;

    @Override
    public GeneratedAdaptation generate(AdaptationRequest request) {
        SocialNetwork network = request.network();
        List<String> hashtags = hashtagsFor(request);
        String tone = network == SocialNetwork.LINKEDIN
                ? "professional"
                : TONES.get(stableIndex(seed(request, "tone"), TONES.size()));

        StringBuilder text = new StringBuilder();
        text.append(request.title().trim());
        text.append(network == SocialNetwork.WHATSAPP ? "\n" : "\n\n");
        text.append(request.body().trim());
        if (!hashtags.isEmpty() && network != SocialNetwork.WHATSAPP) {
            text.append("\n\n").append(String.join(" ", hashtags));
        }

        String imageSuggestion = network.mediaRequired()
                ? "Vertical visual illustrating \"" + request.title().trim() + "\""
                : null;
        return new GeneratedAdaptation(text.toString(), hashtags, imageSuggestion, tone);
    }

    private static List<String> hashtagsFor(AdaptationRequest request) {
        if (request.network() == SocialNetwork.WHATSAPP) {
            return List.of();
        }
        Set<String> tags = new LinkedHashSet<>();
        for (String word : request.title().split("[^\\p{L}\\p{N}]+")) {
            if (word.length() < 4) {
                continue;
            }
            tags.add("#" + word.toLowerCase(Locale.ROOT));
            if (tags.size() == MAX_HASHTAGS) {
                break;
            }
        }
        return new ArrayList<>(tags);
    }

    private static String seed(AdaptationRequest request, String suffix) {
        return request.contentItemId()
                + "|"
                + request.network().code()
                + "|"
                + request.title()
                + "|"
                + suffix;
    }

    private static int stableIndex(String seed, int bound) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(seed.getBytes(StandardCharsets.UTF_8));
            int raw = ByteBuffer.wrap(hash).getInt();
            return Math.floorMod(raw, bound);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 digest algorithm is required", ex);
        }
    }
}
