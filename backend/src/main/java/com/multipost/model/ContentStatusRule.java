package com.multipost.model;

import java.util.Collection;

/**
 * Derives a content item's status from the statuses of its publication attempts.
 * <p>
 * No attempts means {@code draft}. Any attempt still pending or processing means
 * {@code processing}. Once every attempt is terminal the item is {@code published}
 * when at least one attempt went out and {@code failed} otherwise.
 */
public final class ContentStatusRule {

    private ContentStatusRule() {
    }

    public static ContentItemStatus derive(Collection<PublicationAttemptStatus> attemptStatuses) {
        if (attemptStatuses == null || attemptStatuses.isEmpty()) {
            return ContentItemStatus.DRAFT;
        }
        boolean anyPublished = false;
        for (PublicationAttemptStatus status : attemptStatuses) {
            if (status.isInFlight()) {
                return ContentItemStatus.PROCESSING;
            }
            if (status == PublicationAttemptStatus.PUBLISHED) {
                anyPublished = true;
            }
        }
        return anyPublished ? ContentItemStatus.PUBLISHED : ContentItemStatus.FAILED;
    }
}
