package com.multipost.network;

import com.multipost.model.SocialNetwork;

import java.util.UUID;

public record NetworkPublishRequest(
        UUID publicationAttemptId,
        SocialNetwork network,
        String content,
        String imageUrl
) {
    public boolean hasImage() {
        return imageUrl != null && !imageUrl.isBlank();
    }
}
