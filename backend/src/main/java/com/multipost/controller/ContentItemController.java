package com.multipost.controller;

import com.multipost.dto.ContentItemRequests;
import com.multipost.dto.ContentItemResponses;
import com.multipost.dto.PublicationResponses;
import com.multipost.service.ContentAdaptationService;
import com.multipost.service.ContentItemService;
import com.multipost.service.PublicationDispatchService;
import com.multipost.service.PublicationStatusService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/posts")
public class ContentItemController {

    private final ContentItemService contentItemService;
    private final ContentAdaptationService contentAdaptationService;
    private final PublicationDispatchService publicationDispatchService;
    private final PublicationStatusService publicationStatusService;

    public ContentItemController(
            ContentItemService contentItemService,
            ContentAdaptationService contentAdaptationService,
            PublicationDispatchService publicationDispatchService,
            PublicationStatusService publicationStatusService
    ) {
        this.contentItemService = contentItemService;
        this.contentAdaptationService = contentAdaptationService;
        this.publicationDispatchService = publicationDispatchService;
        this.publicationStatusService = publicationStatusService;
    }

    @PostMapping
    public ResponseEntity<ContentItemResponses.ContentItemDetail> createContentItem(
            @Valid @RequestBody ContentItemRequests.CreateContentItemRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(contentItemService.create(request));
    }

    @GetMapping
    public ResponseEntity<List<ContentItemResponses.ContentItemSummary>> listContentItems(
            @RequestParam(defaultValue = "0") @Min(value = 0, message = "offset must be non-negative") int offset,
            @RequestParam(defaultValue = "100")
            @Min(value = 1, message = "limit must be between 1 and 500")
            @Max(value = ContentItemService.MAX_PAGE_SIZE, message = "limit must be between 1 and 500") int limit,
            @RequestParam(required = false) String status
    ) {
        return ResponseEntity.ok(contentItemService.list(offset, limit, status));
    }

    @GetMapping("/{contentItemId}")
    public ResponseEntity<ContentItemResponses.ContentItemDetail> getContentItem(@PathVariable UUID contentItemId) {
        return ResponseEntity.ok(contentItemService.get(contentItemId));
    }

    @DeleteMapping("/{contentItemId}")
    public ResponseEntity<Void> deleteContentItem(@PathVariable UUID contentItemId) {
        contentItemService.delete(contentItemId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{contentItemId}/adapt")
    public ResponseEntity<ContentItemResponses.AdaptationResult> adaptContentItem(
            @PathVariable UUID contentItemId,
            @RequestBody(required = false) ContentItemRequests.AdaptContentRequest request
    ) {
        return ResponseEntity.ok(contentAdaptationService.adapt(contentItemId, request));
    }

    @PostMapping("/{contentItemId}/publish")
    public ResponseEntity<PublicationResponses.PublishResult> publishContentItem(
            @PathVariable UUID contentItemId,
            @Valid @RequestBody(required = false) ContentItemRequests.PublishRequest request
    ) {
        String imageUrl = request == null ? null : request.imageUrl();
        return ResponseEntity.ok(publicationDispatchService.publish(contentItemId, imageUrl));
    }

    @GetMapping("/{contentItemId}/status")
    public ResponseEntity<PublicationResponses.StatusSummary> getPublicationStatus(@PathVariable UUID contentItemId) {
        return ResponseEntity.ok(publicationStatusService.status(contentItemId));
    }
}
