package com.multipost.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.multipost.model.ContentItemStatus;
import com.multipost.model.PublicationAttemptStatus;
import com.multipost.model.SocialNetwork;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class PublicationResponses {

    public static final String DISPATCH_STATUS_ENQUEUED = "enqueued";

    private PublicationResponses() {
    }

    public record DispatchResult(
            UUID publicationId,
            SocialNetwork network,
            String workUnitId,
            String status
    ) {
    }

    public record PublishResult(
            UUID contentItemId,
            int totalPublications,
            List<DispatchResult> results
    ) {
    }

    public record StatusSummary(
            UUID contentItemId,
            ContentItemStatus contentStatus,
            int totalPublications,
            Map<String, Long> byStatus,
            List<PublicationStatus> publications
    ) {
    }

    public record PublicationStatus(
            UUID id,
            SocialNetwork network,
            PublicationAttemptStatus status,
            OffsetDateTime publishedAt,
            String errorMessage,
            JsonNode metadata,
            int retryCount
    ) {
    }
}
