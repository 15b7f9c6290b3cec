package com.multipost.service;

import com.multipost.dto.PublicationResponses;
import com.multipost.mapper.PublicationResponseMapper;
import com.multipost.model.ContentStatusRule;
import com.multipost.model.PublicationAttempt;
import com.multipost.model.PublicationAttemptStatus;
import com.multipost.repository.ContentItemRepository;
import com.multipost.repository.PublicationAttemptRepository;
import com.multipost.web.PublishingApiException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only snapshot of a content item's publications, always read from the store.
 */
@Service
@RequiredArgsConstructor
public class PublicationStatusService {

    private final ContentItemRepository contentItemRepository;
    private final PublicationAttemptRepository publicationAttemptRepository;
    private final PublicationResponseMapper publicationResponseMapper;

    @Transactional(readOnly = true)
    public PublicationResponses.StatusSummary status(UUID contentItemId) {
        if (!contentItemRepository.existsById(contentItemId)) {
            throw PublishingApiException.notFound("Content item not found: " + contentItemId);
        }
        List<PublicationAttempt> attempts =
                publicationAttemptRepository.findByContentItemIdOrderByCreatedAtAsc(contentItemId);

        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (PublicationAttemptStatus status : PublicationAttemptStatus.values()) {
            byStatus.put(status.code(), 0L);
        }
        for (PublicationAttempt attempt : attempts) {
            byStatus.merge(attempt.getStatus().code(), 1L, Long::sum);
        }

        return new PublicationResponses.StatusSummary(
                contentItemId,
                ContentStatusRule.derive(attempts.stream().map(PublicationAttempt::getStatus).toList()),
                attempts.size(),
                byStatus,
                attempts.stream().map(publicationResponseMapper::toPublicationStatus).toList()
        );
    }
}
