package com.multipost.service;

import com.multipost.dto.ContentItemRequests;
import com.multipost.dto.ContentItemResponses;
import com.multipost.mapper.PublicationResponseMapper;
import com.multipost.model.ContentItem;
import com.multipost.model.ContentItemStatus;
import com.multipost.model.PublicationAttempt;
import com.multipost.repository.ContentItemRepository;
import com.multipost.repository.PublicationAttemptCountRow;
import com.multipost.repository.PublicationAttemptRepository;
import com.multipost.web.PublishingApiException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ContentItemService {

    private static final Logger log = LoggerFactory.getLogger(ContentItemService.class);

    public static final int MAX_PAGE_SIZE = 500;

    private final ContentItemRepository contentItemRepository;
    private final PublicationAttemptRepository publicationAttemptRepository;
    private final PublicationResponseMapper publicationResponseMapper;

    @Transactional
    public ContentItemResponses.ContentItemDetail create(ContentItemRequests.CreateContentItemRequest request) {
        OffsetDateTime now = OffsetDateTime.now();
        ContentItem contentItem = new ContentItem();
        contentItem.setContentItemId(UUID.randomUUID());
        contentItem.setTitle(request.title().trim());
        contentItem.setBody(request.content());
        contentItem.setStatus(ContentItemStatus.DRAFT);
        contentItem.setCreatedAt(now);
        contentItem.setUpdatedAt(now);

        ContentItem saved = contentItemRepository.save(contentItem);
        log.info("Created content item {}", saved.getContentItemId());
        return publicationResponseMapper.toContentItemDetail(saved, List.of());
    }

    @Transactional(readOnly = true)
    public List<ContentItemResponses.ContentItemSummary> list(int offset, int limit, String status) {
        if (offset < 0) {
            throw PublishingApiException.validation("offset must be non-negative");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw PublishingApiException.validation("limit must be between 1 and " + MAX_PAGE_SIZE);
        }

        List<ContentItem> page;
        if (status == null || status.isBlank()) {
            page = contentItemRepository.findPageNewestFirst(offset, limit);
        } else {
            ContentItemStatus statusFilter = ContentItemStatus.fromCode(status)
                    .orElseThrow(() -> PublishingApiException.validation("Unknown content status: " + status));
            page = contentItemRepository.findPageByStatusNewestFirst(statusFilter.name(), offset, limit);
        }
        if (page.isEmpty()) {
            return List.of();
        }

        Map<UUID, Long> counts = publicationAttemptRepository.countByContentItemIds(
                        page.stream().map(ContentItem::getContentItemId).toList()
                )
                .stream()
                .collect(Collectors.toMap(
                        PublicationAttemptCountRow::getContentItemId,
                        PublicationAttemptCountRow::getAttemptCount
                ));
        return page.stream()
                .map(item -> publicationResponseMapper.toContentItemSummary(
                        item,
                        counts.getOrDefault(item.getContentItemId(), 0L)
                ))
                .toList();
    }

    @Transactional(readOnly = true)
    public ContentItemResponses.ContentItemDetail get(UUID contentItemId) {
        ContentItem contentItem = requireContentItem(contentItemId);
        List<PublicationAttempt> attempts =
                publicationAttemptRepository.findByContentItemIdOrderByCreatedAtAsc(contentItemId);
        return publicationResponseMapper.toContentItemDetail(contentItem, attempts);
    }

    /**
     * Removes the item and all of its attempts. Workers still holding a unit of work for
     * one of these attempts find it gone and drop the unit.
     */
    @Transactional
    public void delete(UUID contentItemId) {
        ContentItem contentItem = contentItemRepository.findByIdForUpdate(contentItemId)
                .orElseThrow(() -> PublishingApiException.notFound("Content item not found: " + contentItemId));
        int removedAttempts = publicationAttemptRepository.deleteByContentItemId(contentItemId);
        contentItemRepository.delete(contentItem);
        log.info("Deleted content item {} with {} publication attempts", contentItemId, removedAttempts);
    }

    private ContentItem requireContentItem(UUID contentItemId) {
        return contentItemRepository.findById(contentItemId)
                .orElseThrow(() -> PublishingApiException.notFound("Content item not found: " + contentItemId));
    }
}
