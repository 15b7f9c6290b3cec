package com.multipost.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of publication targets. Each network carries its wire code, the maximum
 * length of an adapted post and whether a publish call needs an image or video.
 */
public enum SocialNetwork {
    FACEBOOK("facebook", 63_206, false),
    INSTAGRAM("instagram", 2_200, true),
    LINKEDIN("linkedin", 3_000, false),
    TIKTOK("tiktok", 2_200, true),
    WHATSAPP("whatsapp", 700, true);

    private final String code;
    private final int maxTextLength;
    private final boolean mediaRequired;

    SocialNetwork(String code, int maxTextLength, boolean mediaRequired) {
        this.code = code;
        this.maxTextLength = maxTextLength;
        this.mediaRequired = mediaRequired;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public int maxTextLength() {
        return maxTextLength;
    }

    public boolean mediaRequired() {
        return mediaRequired;
    }

    /**
     * Cuts {@code text} to this network's limit, counted in code points so a surrogate pair is
     * never split. Blank input yields an empty string.
     */
    public String truncate(String text) {
        if (text == null) {
            return "";
        }
        String normalized = text.strip();
        if (normalized.codePointCount(0, normalized.length()) <= maxTextLength) {
            return normalized;
        }
        return normalized.substring(0, normalized.offsetByCodePoints(0, maxTextLength));
    }

    public static int characterCount(String text) {
        return text == null ? 0 : text.codePointCount(0, text.length());
    }

    public static Optional<SocialNetwork> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (SocialNetwork network : values()) {
            if (network.code.equals(normalized)) {
                return Optional.of(network);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static SocialNetwork fromJson(String code) {
        return fromCode(code).orElseThrow(() -> new IllegalArgumentException("Unknown network: " + code));
    }
}
