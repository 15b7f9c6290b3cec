package com.multipost.service;

import com.multipost.dto.PublicationResponses;
import com.multipost.model.ContentItem;
import com.multipost.model.PublicationAttempt;
import com.multipost.model.PublicationAttemptStatus;
import com.multipost.repository.ContentItemRepository;
import com.multipost.repository.PublicationAttemptRepository;
import com.multipost.web.PublishingApiException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Moves pending attempts to processing and hands one work unit per attempt to the queue.
 * Never waits for workers and never calls a network.
 * <p>
 * Each attempt is claimed in its own short transaction with a conditional update, so two
 * concurrent publish calls for the same item enqueue every attempt at most once. The
 * work unit is queued only after the claim has committed.
 */
@Service
@RequiredArgsConstructor
public class PublicationDispatchService {

    private static final Logger log = LoggerFactory.getLogger(PublicationDispatchService.class);

    private final ContentItemRepository contentItemRepository;
    private final PublicationAttemptRepository publicationAttemptRepository;
    private final ContentStatusRecalculator contentStatusRecalculator;
    private final PublicationQueue publicationQueue;
    private final TransactionTemplate transactionTemplate;

    public PublicationResponses.PublishResult publish(UUID contentItemId, String imageUrl) {
        if (!contentItemRepository.existsById(contentItemId)) {
            throw PublishingApiException.notFound("Content item not found: " + contentItemId);
        }
        String normalizedImageUrl = normalizeImageUrl(imageUrl);

        List<PublicationAttempt> pendingAttempts = publicationAttemptRepository
                .findByContentItemIdAndStatusOrderByCreatedAtAsc(contentItemId, PublicationAttemptStatus.PENDING);
        List<PublicationResponses.DispatchResult> results = new ArrayList<>();
        for (PublicationAttempt attempt : pendingAttempts) {
            ClaimedAttempt claimed = transactionTemplate.execute(status -> claimPending(
                    contentItemId,
                    attempt.getPublicationAttemptId(),
                    normalizedImageUrl
            ));
            if (claimed == null) {
                log.debug(
                        "Attempt {} for content item {} was claimed by another dispatch",
                        attempt.getPublicationAttemptId(),
                        contentItemId
                );
                continue;
            }

            PublicationQueueMessage message = PublicationQueueMessage.firstDelivery(
                    attempt.getPublicationAttemptId(),
                    contentItemId,
                    attempt.getNetwork(),
                    claimed.adaptedContent(),
                    normalizedImageUrl
            );
            String workUnitId = enqueueOrRollBack(message, PublicationAttemptStatus.PENDING);
            results.add(new PublicationResponses.DispatchResult(
                    attempt.getPublicationAttemptId(),
                    attempt.getNetwork(),
                    workUnitId,
                    PublicationResponses.DISPATCH_STATUS_ENQUEUED
            ));
        }

        log.info(
                "Dispatched {} of {} pending publication attempts for content item {}",
                results.size(),
                pendingAttempts.size(),
                contentItemId
        );
        return new PublicationResponses.PublishResult(contentItemId, results.size(), results);
    }

    /**
     * Re-dispatches one failed attempt, or dispatches a single pending one, reusing the
     * image URL stored at the original dispatch.
     */
    public PublicationResponses.DispatchResult retry(UUID publicationAttemptId) {
        PublicationAttempt attempt = publicationAttemptRepository.findById(publicationAttemptId)
                .orElseThrow(() -> PublishingApiException.notFound("Publication not found: " + publicationAttemptId));
        PublicationAttemptStatus previousStatus = attempt.getStatus();
        if (previousStatus != PublicationAttemptStatus.FAILED && previousStatus != PublicationAttemptStatus.PENDING) {
            throw PublishingApiException.conflict(
                    "Publication " + publicationAttemptId + " is " + previousStatus.code()
                            + "; only failed or pending publications can be retried"
            );
        }

        ClaimedAttempt claimed = transactionTemplate.execute(status -> {
            if (previousStatus == PublicationAttemptStatus.PENDING) {
                return claimPending(attempt.getContentItemId(), publicationAttemptId, attempt.getImageUrl());
            }
            return claimFailed(attempt.getContentItemId(), publicationAttemptId);
        });
        if (claimed == null) {
            throw PublishingApiException.conflict(
                    "Publication " + publicationAttemptId + " changed state while the retry was requested"
            );
        }

        PublicationQueueMessage message = PublicationQueueMessage.firstDelivery(
                publicationAttemptId,
                attempt.getContentItemId(),
                attempt.getNetwork(),
                claimed.adaptedContent(),
                attempt.getImageUrl()
        );
        String workUnitId = enqueueOrRollBack(message, previousStatus);
        log.info(
                "Manual retry queued for publication {} ({}) as work unit {}",
                publicationAttemptId,
                attempt.getNetwork().code(),
                workUnitId
        );
        return new PublicationResponses.DispatchResult(
                publicationAttemptId,
                attempt.getNetwork(),
                workUnitId,
                PublicationResponses.DISPATCH_STATUS_ENQUEUED
        );
    }

    private ClaimedAttempt claimPending(UUID contentItemId, UUID publicationAttemptId, String imageUrl) {
        ContentItem contentItem = contentStatusRecalculator.lockContentItem(contentItemId).orElse(null);
        if (contentItem == null) {
            return null;
        }
        int claimed = publicationAttemptRepository.claimPendingForDispatch(
                publicationAttemptId,
                imageUrl,
                OffsetDateTime.now()
        );
        if (claimed == 0) {
            return null;
        }
        contentStatusRecalculator.recalculate(contentItem);
        return readClaimed(publicationAttemptId);
    }

    private ClaimedAttempt claimFailed(UUID contentItemId, UUID publicationAttemptId) {
        ContentItem contentItem = contentStatusRecalculator.lockContentItem(contentItemId).orElse(null);
        if (contentItem == null) {
            return null;
        }
        int claimed = publicationAttemptRepository.claimForRetry(
                publicationAttemptId,
                PublicationAttemptStatus.FAILED,
                OffsetDateTime.now()
        );
        if (claimed == 0) {
            return null;
        }
        contentStatusRecalculator.recalculate(contentItem);
        return readClaimed(publicationAttemptId);
    }

    /**
     * Reads the copy under the content item lock, after the claim, so a re-adaptation that
     * committed before the claim is what gets published.
     */
    private ClaimedAttempt readClaimed(UUID publicationAttemptId) {
        return new ClaimedAttempt(publicationAttemptRepository.findAdaptedContentById(publicationAttemptId).orElse(null));
    }

    private String enqueueOrRollBack(PublicationQueueMessage message, PublicationAttemptStatus restoreStatus) {
        try {
            return publicationQueue.enqueue(message);
        } catch (RuntimeException ex) {
            log.error(
                    "Failed to enqueue publication {} for content item {}; restoring {}",
                    message.publicationAttemptId(),
                    message.contentItemId(),
                    restoreStatus.code(),
                    ex
            );
            transactionTemplate.executeWithoutResult(status -> restore(message, restoreStatus));
            throw PublishingApiException.dispatchFailed(
                    "Could not queue publication " + message.publicationAttemptId() + " for " + message.network().code()
            );
        }
    }

    private void restore(PublicationQueueMessage message, PublicationAttemptStatus restoreStatus) {
        ContentItem contentItem = contentStatusRecalculator.lockContentItem(message.contentItemId()).orElse(null);
        if (contentItem == null) {
            return;
        }
        publicationAttemptRepository.compareAndSetStatus(
                message.publicationAttemptId(),
                PublicationAttemptStatus.PROCESSING,
                restoreStatus,
                OffsetDateTime.now()
        );
        contentStatusRecalculator.recalculate(contentItem);
    }

    private static String normalizeImageUrl(String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank()) {
            return null;
        }
        return imageUrl.trim();
    }

    private record ClaimedAttempt(String adaptedContent) {
    }
}
