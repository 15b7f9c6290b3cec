package com.multipost.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.multipost.model.ContentItemStatus;
import com.multipost.model.PublicationAttemptStatus;
import com.multipost.model.SocialNetwork;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class ContentItemResponses {

    private ContentItemResponses() {
    }

    public record ContentItemSummary(
            UUID id,
            String title,
            ContentItemStatus status,
            long publicationCount,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record ContentItemDetail(
            UUID id,
            String title,
            String content,
            ContentItemStatus status,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt,
            List<Publication> publications
    ) {
    }

    public record Publication(
            UUID id,
            UUID contentItemId,
            SocialNetwork network,
            String adaptedContent,
            PublicationAttemptStatus status,
            String imageUrl,
            int retryCount,
            OffsetDateTime publishedAt,
            String errorMessage,
            JsonNode metadata,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record NetworkAdaptation(
            SocialNetwork network,
            String adaptedText,
            List<String> hashtags,
            String imageSuggestion,
            Integer characterCount,
            String tone,
            String error
    ) {
        public static NetworkAdaptation failed(SocialNetwork network, String error) {
            return new NetworkAdaptation(network, null, List.of(), null, null, null, error);
        }

        public boolean succeeded() {
            return error == null;
        }
    }

    public record AdaptationResult(
            UUID contentItemId,
            boolean previewOnly,
            List<NetworkAdaptation> adaptations,
            List<Publication> publications,
            int failedNetworks
    ) {
    }
}
