package com.multipost.service;

import com.multipost.model.ContentItem;
import com.multipost.model.ContentItemStatus;
import com.multipost.model.ContentStatusRule;
import com.multipost.model.PublicationAttemptStatus;
import com.multipost.repository.ContentItemRepository;
import com.multipost.repository.PublicationAttemptRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps the stored content item status equal to the rule applied to its attempts.
 * Callers lock the content item row first and only then touch attempt rows, so every
 * writer of one item serializes on the same lock.
 */
@Service
@RequiredArgsConstructor
public class ContentStatusRecalculator {

    private static final Logger log = LoggerFactory.getLogger(ContentStatusRecalculator.class);

    private final ContentItemRepository contentItemRepository;
    private final PublicationAttemptRepository publicationAttemptRepository;

    /**
     * Must be called inside a transaction.
     */
    public Optional<ContentItem> lockContentItem(UUID contentItemId) {
        return contentItemRepository.findByIdForUpdate(contentItemId);
    }

    /**
     * Must be called inside the transaction that holds the lock from {@link #lockContentItem(UUID)}.
     */
    public ContentItemStatus recalculate(ContentItem contentItem) {
        List<PublicationAttemptStatus> attemptStatuses =
                publicationAttemptRepository.findStatusesByContentItemId(contentItem.getContentItemId());
        ContentItemStatus derived = ContentStatusRule.derive(attemptStatuses);
        if (derived != contentItem.getStatus()) {
            log.debug(
                    "Content item {} status {} -> {}",
                    contentItem.getContentItemId(),
                    contentItem.getStatus(),
                    derived
            );
            contentItem.setStatus(derived);
            contentItem.setUpdatedAt(OffsetDateTime.now());
            contentItemRepository.save(contentItem);
        }
        return derived;
    }
}
