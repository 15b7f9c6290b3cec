package com.multipost.service;

import com.multipost.model.SocialNetwork;

import java.util.UUID;

/**
 * One unit of publication work: publish one attempt's content to its network.
 * {@code delivery} starts at 1 and grows with every transient retry of the same work unit.
 */
public record PublicationQueueMessage(
        UUID workUnitId,
        UUID publicationAttemptId,
        UUID contentItemId,
        SocialNetwork network,
        String content,
        String imageUrl,
        int delivery
) {
    public PublicationQueueMessage {
        if (workUnitId == null) {
            throw new IllegalArgumentException("workUnitId is required");
        }
        if (publicationAttemptId == null) {
            throw new IllegalArgumentException("publicationAttemptId is required");
        }
        if (contentItemId == null) {
            throw new IllegalArgumentException("contentItemId is required");
        }
        if (network == null) {
            throw new IllegalArgumentException("network is required");
        }
        if (delivery < 1) {
            throw new IllegalArgumentException("delivery must be at least 1");
        }
        if (imageUrl != null && imageUrl.isBlank()) {
            imageUrl = null;
        }
    }

    public static PublicationQueueMessage firstDelivery(
            UUID publicationAttemptId,
            UUID contentItemId,
            SocialNetwork network,
            String content,
            String imageUrl
    ) {
        return new PublicationQueueMessage(
                UUID.randomUUID(),
                publicationAttemptId,
                contentItemId,
                network,
                content,
                imageUrl,
                1
        );
    }

    public PublicationQueueMessage nextDelivery() {
        return new PublicationQueueMessage(
                workUnitId,
                publicationAttemptId,
                contentItemId,
                network,
                content,
                imageUrl,
                delivery + 1
        );
    }
}
