package com.multipost.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.multipost.config.PublishingProperties;
import com.multipost.model.ContentItem;
import com.multipost.model.PublicationAttempt;
import com.multipost.model.PublicationAttemptStatus;
import com.multipost.network.NetworkPublishRequest;
import com.multipost.network.NetworkPublishResult;
import com.multipost.network.NetworkPublisherRegistry;
import com.multipost.network.PublishFailureException;
import com.multipost.repository.PublicationAttemptRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Executes publication work units. The network call runs outside any transaction; the
 * outcome is written back under the content item lock.
 * <p>
 * Transient failures keep the attempt in {@code processing}, bump its retry counter and
 * re-submit the unit after a fixed back-off. Permanent failures, and transient ones once
 * the retry budget is spent, end the attempt in {@code failed}.
 */
@Service
@RequiredArgsConstructor
public class PublicationWorkerService {

    private static final Logger log = LoggerFactory.getLogger(PublicationWorkerService.class);
    private static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

    private final PublicationQueue publicationQueue;
    private final PublicationAttemptRepository publicationAttemptRepository;
    private final ContentStatusRecalculator contentStatusRecalculator;
    private final NetworkPublisherRegistry networkPublisherRegistry;
    private final PublishingProperties publishingProperties;
    private final TaskScheduler taskScheduler;
    private final TransactionTemplate transactionTemplate;

    @PostConstruct
    void registerQueueConsumer() {
        publicationQueue.setConsumer(this::consumeQueueMessage);
    }

    void consumeQueueMessage(PublicationQueueMessage message) {
        try {
            process(message);
        } catch (RuntimeException ex) {
            log.error(
                    "Publication work unit {} failed for attempt {}",
                    message.workUnitId(),
                    message.publicationAttemptId(),
                    ex
            );
        }
    }

    private void process(PublicationQueueMessage message) {
        PublicationAttempt attempt = publicationAttemptRepository.findById(message.publicationAttemptId()).orElse(null);
        if (attempt == null) {
            log.warn(
                    "Dropping work unit {} because publication {} no longer exists",
                    message.workUnitId(),
                    message.publicationAttemptId()
            );
            return;
        }
        if (attempt.getStatus() != PublicationAttemptStatus.PROCESSING) {
            log.debug(
                    "Dropping duplicate work unit {} for publication {} in status {}",
                    message.workUnitId(),
                    attempt.getPublicationAttemptId(),
                    attempt.getStatus()
            );
            return;
        }

        NetworkPublishRequest request = new NetworkPublishRequest(
                message.publicationAttemptId(),
                message.network(),
                attempt.getAdaptedContent() == null ? message.content() : attempt.getAdaptedContent(),
                message.imageUrl()
        );
        NetworkPublishResult result;
        try {
            result = networkPublisherRegistry.publish(request);
        } catch (PublishFailureException ex) {
            handleFailure(message, ex.isPermanent(), ex);
            return;
        } catch (RuntimeException ex) {
            handleFailure(message, false, ex);
            return;
        }
        markPublished(message, result);
    }

    private void markPublished(PublicationQueueMessage message, NetworkPublishResult result) {
        transactionTemplate.executeWithoutResult(status -> {
            LockedAttempt locked = lockProcessingAttempt(message);
            if (locked == null) {
                return;
            }
            PublicationAttempt attempt = locked.attempt();
            OffsetDateTime now = OffsetDateTime.now();
            ObjectNode metadata = attempt.getMetadata() instanceof ObjectNode existing
                    ? existing.deepCopy()
                    : JsonNodeFactory.instance.objectNode();
            metadata.set("publish", result.metadata() == null ? JsonNodeFactory.instance.objectNode() : result.metadata());
            metadata.put("work_unit_id", message.workUnitId().toString());
            metadata.put("delivery", message.delivery());

            attempt.setStatus(PublicationAttemptStatus.PUBLISHED);
            attempt.setPublishedAt(now);
            attempt.setErrorMessage(null);
            attempt.setMetadata(metadata);
            attempt.setUpdatedAt(now);
            publicationAttemptRepository.save(attempt);
            contentStatusRecalculator.recalculate(locked.contentItem());
            log.info(
                    "Publication {} published to {} on delivery {}",
                    attempt.getPublicationAttemptId(),
                    attempt.getNetwork().code(),
                    message.delivery()
            );
        });
    }

    private void handleFailure(PublicationQueueMessage message, boolean permanent, RuntimeException failure) {
        PublicationQueueMessage retryMessage = transactionTemplate.execute(status -> {
            LockedAttempt locked = lockProcessingAttempt(message);
            if (locked == null) {
                return null;
            }
            PublicationAttempt attempt = locked.attempt();
            int retryCount = attempt.getRetryCount() == null ? 0 : Math.max(0, attempt.getRetryCount());
            int maxRetries = Math.max(0, publishingProperties.getMaxRetries());
            if (permanent || retryCount >= maxRetries) {
                markFailed(attempt, failure.getMessage());
                contentStatusRecalculator.recalculate(locked.contentItem());
                if (permanent) {
                    log.info(
                            "Publication {} to {} failed permanently: {}",
                            attempt.getPublicationAttemptId(),
                            attempt.getNetwork().code(),
                            attempt.getErrorMessage()
                    );
                } else {
                    log.warn(
                            "Publication {} to {} failed after {} retries: {}",
                            attempt.getPublicationAttemptId(),
                            attempt.getNetwork().code(),
                            retryCount,
                            attempt.getErrorMessage()
                    );
                }
                return null;
            }

            attempt.setRetryCount(retryCount + 1);
            attempt.setUpdatedAt(OffsetDateTime.now());
            publicationAttemptRepository.save(attempt);
            log.info(
                    "Publication {} to {} failed transiently (retry {} of {}): {}",
                    attempt.getPublicationAttemptId(),
                    attempt.getNetwork().code(),
                    retryCount + 1,
                    maxRetries,
                    truncateMessage(failure.getMessage())
            );
            return message.nextDelivery();
        });
        if (retryMessage != null) {
            scheduleRetry(retryMessage);
        }
    }

    private void scheduleRetry(PublicationQueueMessage retryMessage) {
        Instant runAt = Instant.now().plusMillis(Math.max(0L, publishingProperties.getRetryBackoffMs()));
        try {
            taskScheduler.schedule(() -> resubmit(retryMessage), runAt);
        } catch (RuntimeException ex) {
            failUnqueuedRetry(retryMessage, ex);
        }
    }

    private void resubmit(PublicationQueueMessage retryMessage) {
        try {
            publicationQueue.enqueue(retryMessage);
        } catch (RuntimeException ex) {
            failUnqueuedRetry(retryMessage, ex);
        }
    }

    private void failUnqueuedRetry(PublicationQueueMessage retryMessage, RuntimeException cause) {
        log.error(
                "Could not re-submit publication {} for delivery {}",
                retryMessage.publicationAttemptId(),
                retryMessage.delivery(),
                cause
        );
        transactionTemplate.executeWithoutResult(status -> {
            LockedAttempt locked = lockProcessingAttempt(retryMessage);
            if (locked == null) {
                return;
            }
            markFailed(locked.attempt(), "Retry could not be queued: " + cause.getMessage());
            contentStatusRecalculator.recalculate(locked.contentItem());
        });
    }

    /**
     * Locks the content item, then the attempt. Returns null when either is gone or the
     * attempt has already left {@code processing}.
     */
    private LockedAttempt lockProcessingAttempt(PublicationQueueMessage message) {
        ContentItem contentItem = contentStatusRecalculator.lockContentItem(message.contentItemId()).orElse(null);
        if (contentItem == null) {
            log.warn(
                    "Dropping outcome of work unit {} because content item {} no longer exists",
                    message.workUnitId(),
                    message.contentItemId()
            );
            return null;
        }
        PublicationAttempt attempt =
                publicationAttemptRepository.findByIdForUpdate(message.publicationAttemptId()).orElse(null);
        if (attempt == null || attempt.getStatus() != PublicationAttemptStatus.PROCESSING) {
            log.debug(
                    "Dropping outcome of work unit {} for publication {} because it is no longer processing",
                    message.workUnitId(),
                    message.publicationAttemptId()
            );
            return null;
        }
        return new LockedAttempt(contentItem, attempt);
    }

    private void markFailed(PublicationAttempt attempt, String errorMessage) {
        attempt.setStatus(PublicationAttemptStatus.FAILED);
        attempt.setErrorMessage(truncateMessage(errorMessage));
        attempt.setUpdatedAt(OffsetDateTime.now());
        publicationAttemptRepository.save(attempt);
    }

    private static String truncateMessage(String message) {
        if (message == null || message.isBlank()) {
            return "unknown";
        }
        String normalized = message.trim();
        if (normalized.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }

    private record LockedAttempt(ContentItem contentItem, PublicationAttempt attempt) {
    }
}
