package com.multipost.controller;

import com.multipost.dto.PublicationResponses;
import com.multipost.service.PublicationDispatchService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/publications")
public class PublicationAttemptController {

    private final PublicationDispatchService publicationDispatchService;

    public PublicationAttemptController(PublicationDispatchService publicationDispatchService) {
        this.publicationDispatchService = publicationDispatchService;
    }

    @PostMapping("/{publicationId}/retry")
    public ResponseEntity<PublicationResponses.DispatchResult> retryPublication(@PathVariable UUID publicationId) {
        return ResponseEntity.ok(publicationDispatchService.retry(publicationId));
    }
}
