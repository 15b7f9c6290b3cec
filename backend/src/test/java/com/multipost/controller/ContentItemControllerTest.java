package com.multipost.controller;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.multipost.dto.ContentItemResponses;
import com.multipost.dto.PublicationResponses;
import com.multipost.model.ContentItemStatus;
import com.multipost.model.PublicationAttemptStatus;
import com.multipost.model.SocialNetwork;
import com.multipost.service.ContentAdaptationService;
import com.multipost.service.ContentItemService;
import com.multipost.service.PublicationDispatchService;
import com.multipost.service.PublicationStatusService;
import com.multipost.web.PublishingApiException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ContentItemController.class)
class ContentItemControllerTest {

    private static final UUID CONTENT_ITEM_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");
    private static final UUID PUBLICATION_ID = UUID.fromString("00000000-0000-0000-0000-000000000201");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ContentItemService contentItemService;

    @MockitoBean
    private ContentAdaptationService contentAdaptationService;

    @MockitoBean
    private PublicationDispatchService publicationDispatchService;

    @MockitoBean
    private PublicationStatusService publicationStatusService;

    @Test
    void createContentItemReturnsCreatedDraft() throws Exception {
        when(contentItemService.create(any())).thenReturn(sampleDetail(List.of()));

        mockMvc.perform(post("/api/posts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "title": "Autumn menu",
                                  "content": "New dishes arrive Friday."
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(CONTENT_ITEM_ID.toString()))
                .andExpect(jsonPath("$.status").value("draft"))
                .andExpect(jsonPath("$.publications").isEmpty());
    }

    @Test
    void createContentItemWithBlankTitleReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/posts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "title": " ",
                                  "content": "Body"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.title").value("title is required"));

        verify(contentItemService, never()).create(any());
    }

    @Test
    void malformedBodyReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/posts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Malformed request body"));
    }

    @Test
    void listContentItemsPassesPagingAndFilter() throws Exception {
        when(contentItemService.list(20, 10, "failed")).thenReturn(List.of(
                new ContentItemResponses.ContentItemSummary(
                        CONTENT_ITEM_ID,
                        "Autumn menu",
                        ContentItemStatus.FAILED,
                        3,
                        OffsetDateTime.parse("2026-03-01T10:00:00Z"),
                        OffsetDateTime.parse("2026-03-01T10:05:00Z")
                )
        ));

        mockMvc.perform(get("/api/posts")
                        .param("offset", "20")
                        .param("limit", "10")
                        .param("status", "failed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("failed"))
                .andExpect(jsonPath("$[0].publicationCount").value(3));
    }

    @Test
    void listContentItemsDefaultsToFirstHundred() throws Exception {
        when(contentItemService.list(0, 100, null)).thenReturn(List.of());

        mockMvc.perform(get("/api/posts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void listContentItemsRejectsOversizedPage() throws Exception {
        mockMvc.perform(get("/api/posts").param("limit", "501"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.limit").value("limit must be between 1 and 500"));

        verify(contentItemService, never()).list(anyInt(), anyInt(), any());
    }

    @Test
    void getContentItemIncludesPublications() throws Exception {
        when(contentItemService.get(CONTENT_ITEM_ID)).thenReturn(sampleDetail(List.of(samplePublication())));

        mockMvc.perform(get("/api/posts/{id}", CONTENT_ITEM_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.publications[0].id").value(PUBLICATION_ID.toString()))
                .andExpect(jsonPath("$.publications[0].network").value("linkedin"))
                .andExpect(jsonPath("$.publications[0].status").value("pending"))
                .andExpect(jsonPath("$.publications[0].metadata.adaptation.tone").value("professional"));
    }

    @Test
    void getUnknownContentItemReturnsNotFound() throws Exception {
        when(contentItemService.get(CONTENT_ITEM_ID))
                .thenThrow(PublishingApiException.notFound("Content item not found: " + CONTENT_ITEM_ID));

        mockMvc.perform(get("/api/posts/{id}", CONTENT_ITEM_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not_found"));
    }

    @Test
    void deleteContentItemReturnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/posts/{id}", CONTENT_ITEM_ID))
                .andExpect(status().isNoContent());

        verify(contentItemService).delete(CONTENT_ITEM_ID);
    }

    @Test
    void adaptWithoutBodyUsesDefaults() throws Exception {
        when(contentAdaptationService.adapt(eq(CONTENT_ITEM_ID), isNull())).thenReturn(
                new ContentItemResponses.AdaptationResult(
                        CONTENT_ITEM_ID,
                        false,
                        List.of(new ContentItemResponses.NetworkAdaptation(
                                SocialNetwork.LINKEDIN,
                                "Autumn menu for professionals",
                                List.of("#autumn"),
                                null,
                                29,
                                "professional",
                                null
                        )),
                        List.of(samplePublication()),
                        0
                )
        );

        mockMvc.perform(post("/api/posts/{id}/adapt", CONTENT_ITEM_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.previewOnly").value(false))
                .andExpect(jsonPath("$.adaptations[0].characterCount").value(29))
                .andExpect(jsonPath("$.publications[0].status").value("pending"));
    }

    @Test
    void adaptWithUnknownNetworkReturnsBadRequest() throws Exception {
        when(contentAdaptationService.adapt(eq(CONTENT_ITEM_ID), any()))
                .thenThrow(PublishingApiException.invalidNetwork(List.of("myspace")));

        mockMvc.perform(post("/api/posts/{id}/adapt", CONTENT_ITEM_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"networks\":[\"myspace\"],\"previewOnly\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_network"))
                .andExpect(jsonPath("$.message").value("Unknown networks: myspace"));
    }

    @Test
    void publishReturnsEnqueuedWorkUnits() throws Exception {
        when(publicationDispatchService.publish(CONTENT_ITEM_ID, "https://cdn.example.com/menu.jpg")).thenReturn(
                new PublicationResponses.PublishResult(
                        CONTENT_ITEM_ID,
                        1,
                        List.of(new PublicationResponses.DispatchResult(
                                PUBLICATION_ID,
                                SocialNetwork.INSTAGRAM,
                                "6f1c2b9e-0000-0000-0000-000000000001",
                                PublicationResponses.DISPATCH_STATUS_ENQUEUED
                        ))
                )
        );

        mockMvc.perform(post("/api/posts/{id}/publish", CONTENT_ITEM_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"imageUrl\":\"https://cdn.example.com/menu.jpg\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalPublications").value(1))
                .andExpect(jsonPath("$.results[0].network").value("instagram"))
                .andExpect(jsonPath("$.results[0].status").value("enqueued"));
    }

    @Test
    void publishWithoutBodyPassesNoImage() throws Exception {
        when(publicationDispatchService.publish(CONTENT_ITEM_ID, null))
                .thenReturn(new PublicationResponses.PublishResult(CONTENT_ITEM_ID, 0, List.of()));

        mockMvc.perform(post("/api/posts/{id}/publish", CONTENT_ITEM_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalPublications").value(0));
    }

    @Test
    void publishQueueFailureReturnsServiceUnavailable() throws Exception {
        when(publicationDispatchService.publish(CONTENT_ITEM_ID, null))
                .thenThrow(PublishingApiException.dispatchFailed("Could not queue publication"));

        mockMvc.perform(post("/api/posts/{id}/publish", CONTENT_ITEM_ID))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("dispatch_failed"));
    }

    @Test
    void statusReturnsCountsForEveryStatus() throws Exception {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        byStatus.put("pending", 0L);
        byStatus.put("processing", 1L);
        byStatus.put("published", 1L);
        byStatus.put("failed", 0L);
        when(publicationStatusService.status(CONTENT_ITEM_ID)).thenReturn(new PublicationResponses.StatusSummary(
                CONTENT_ITEM_ID,
                ContentItemStatus.PROCESSING,
                2,
                byStatus,
                List.of()
        ));

        mockMvc.perform(get("/api/posts/{id}/status", CONTENT_ITEM_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.contentStatus").value("processing"))
                .andExpect(jsonPath("$.byStatus.processing").value(1))
                .andExpect(jsonPath("$.byStatus.pending").value(0));
    }

    private static ContentItemResponses.ContentItemDetail sampleDetail(List<ContentItemResponses.Publication> publications) {
        return new ContentItemResponses.ContentItemDetail(
                CONTENT_ITEM_ID,
                "Autumn menu",
                "New dishes arrive Friday.",
                ContentItemStatus.DRAFT,
                OffsetDateTime.parse("2026-03-01T10:00:00Z"),
                OffsetDateTime.parse("2026-03-01T10:00:00Z"),
                publications
        );
    }

    private static ContentItemResponses.Publication samplePublication() {
        return new ContentItemResponses.Publication(
                PUBLICATION_ID,
                CONTENT_ITEM_ID,
                SocialNetwork.LINKEDIN,
                "Autumn menu for professionals",
                PublicationAttemptStatus.PENDING,
                null,
                0,
                null,
                null,
                JsonNodeFactory.instance.objectNode().set("adaptation",
                        JsonNodeFactory.instance.objectNode().put("tone", "professional")),
                OffsetDateTime.parse("2026-03-01T10:01:00Z"),
                OffsetDateTime.parse("2026-03-01T10:01:00Z")
        );
    }
}
