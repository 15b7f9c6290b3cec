package com.multipost.provider;

import com.multipost.model.SocialNetwork;

import java.util.UUID;

public record AdaptationRequest(
        UUID contentItemId,
        String title,
        String body,
        SocialNetwork network
) {
}
