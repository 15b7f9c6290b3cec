package com.multipost.mapper;

import com.multipost.dto.ContentItemResponses;
import com.multipost.dto.PublicationResponses;
import com.multipost.model.ContentItem;
import com.multipost.model.PublicationAttempt;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class PublicationResponseMapper {

    public ContentItemResponses.ContentItemSummary toContentItemSummary(ContentItem contentItem, long publicationCount) {
        return new ContentItemResponses.ContentItemSummary(
                contentItem.getContentItemId(),
                contentItem.getTitle(),
                contentItem.getStatus(),
                publicationCount,
                contentItem.getCreatedAt(),
                contentItem.getUpdatedAt()
        );
    }

    public ContentItemResponses.ContentItemDetail toContentItemDetail(
            ContentItem contentItem,
            Collection<PublicationAttempt> attempts
    ) {
        return new ContentItemResponses.ContentItemDetail(
                contentItem.getContentItemId(),
                contentItem.getTitle(),
                contentItem.getBody(),
                contentItem.getStatus(),
                contentItem.getCreatedAt(),
                contentItem.getUpdatedAt(),
                toPublications(attempts)
        );
    }

    public ContentItemResponses.Publication toPublication(PublicationAttempt attempt) {
        return new ContentItemResponses.Publication(
                attempt.getPublicationAttemptId(),
                attempt.getContentItemId(),
                attempt.getNetwork(),
                attempt.getAdaptedContent(),
                attempt.getStatus(),
                attempt.getImageUrl(),
                retryCount(attempt),
                attempt.getPublishedAt(),
                attempt.getErrorMessage(),
                attempt.getMetadata(),
                attempt.getCreatedAt(),
                attempt.getUpdatedAt()
        );
    }

    public List<ContentItemResponses.Publication> toPublications(Collection<PublicationAttempt> attempts) {
        return attempts.stream().map(this::toPublication).toList();
    }

    public PublicationResponses.PublicationStatus toPublicationStatus(PublicationAttempt attempt) {
        return new PublicationResponses.PublicationStatus(
                attempt.getPublicationAttemptId(),
                attempt.getNetwork(),
                attempt.getStatus(),
                attempt.getPublishedAt(),
                attempt.getErrorMessage(),
                attempt.getMetadata(),
                retryCount(attempt)
        );
    }

    private static int retryCount(PublicationAttempt attempt) {
        return attempt.getRetryCount() == null ? 0 : attempt.getRetryCount();
    }
}
