package com.multipost.service;

import com.multipost.config.AdaptationProperties;
import com.multipost.dto.ContentItemRequests;
import com.multipost.dto.ContentItemResponses;
import com.multipost.mapper.PublicationResponseMapper;
import com.multipost.model.ContentItem;
import com.multipost.model.PublicationAttempt;
import com.multipost.model.PublicationAttemptStatus;
import com.multipost.model.SocialNetwork;
import com.multipost.provider.AdaptationRequest;
import com.multipost.provider.GeneratedAdaptation;
import com.multipost.provider.GenerativeAdaptationClient;
import com.multipost.repository.ContentItemRepository;
import com.multipost.repository.PublicationAttemptRepository;
import com.multipost.web.PublishingApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContentAdaptationServiceTest {

    @Mock
    private ContentItemRepository contentItemRepository;

    @Mock
    private PublicationAttemptRepository publicationAttemptRepository;

    @Mock
    private ContentStatusRecalculator contentStatusRecalculator;

    @Mock
    private GenerativeAdaptationClient generativeAdaptationClient;

    private AdaptationProperties adaptationProperties;
    private ContentAdaptationService contentAdaptationService;
    private ContentItem contentItem;

    @BeforeEach
    void setUp() {
        adaptationProperties = new AdaptationProperties();
        adaptationProperties.setTimeoutSeconds(5);
        contentAdaptationService = new ContentAdaptationService(
                contentItemRepository,
                publicationAttemptRepository,
                contentStatusRecalculator,
                generativeAdaptationClient,
                new PublicationResponseMapper(),
                adaptationProperties,
                new TransactionTemplate(mock(PlatformTransactionManager.class)),
                Runnable::run
        );

        contentItem = new ContentItem();
        contentItem.setContentItemId(UUID.randomUUID());
        contentItem.setTitle("Autumn Menu Launch");
        contentItem.setBody("Our new seasonal menu arrives this Friday.");
    }

    @Test
    void previewReturnsVariantsWithoutPersistingAttempts() {
        when(contentItemRepository.findById(contentItem.getContentItemId())).thenReturn(Optional.of(contentItem));
        when(generativeAdaptationClient.generate(any(AdaptationRequest.class))).thenAnswer(invocation -> generated(invocation.getArgument(0)));

        ContentItemResponses.AdaptationResult result = contentAdaptationService.adapt(
                contentItem.getContentItemId(),
                new ContentItemRequests.AdaptContentRequest(List.of("facebook", "linkedin"), true)
        );

        assertTrue(result.previewOnly());
        assertEquals(2, result.adaptations().size());
        assertEquals(0, result.failedNetworks());
        assertTrue(result.publications().isEmpty());
        verify(publicationAttemptRepository, never()).save(any());
        verifyNoInteractions(contentStatusRecalculator);
    }

    @Test
    void commitStoresPendingAttemptPerSucceededNetworkAndReportsFailures() {
        when(contentItemRepository.findById(contentItem.getContentItemId())).thenReturn(Optional.of(contentItem));
        when(contentStatusRecalculator.lockContentItem(contentItem.getContentItemId())).thenReturn(Optional.of(contentItem));
        when(publicationAttemptRepository.findByContentItemIdAndNetworkInAndStatus(
                eq(contentItem.getContentItemId()), anyCollection(), any(PublicationAttemptStatus.class)
        )).thenReturn(List.of());
        when(publicationAttemptRepository.save(any(PublicationAttempt.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(generativeAdaptationClient.generate(any(AdaptationRequest.class))).thenAnswer(invocation -> {
            AdaptationRequest request = invocation.getArgument(0);
            if (request.network() == SocialNetwork.INSTAGRAM) {
                throw new IllegalStateException("model overloaded");
            }
            return generated(request);
        });

        ContentItemResponses.AdaptationResult result = contentAdaptationService.adapt(
                contentItem.getContentItemId(),
                new ContentItemRequests.AdaptContentRequest(List.of("facebook", "instagram"), false)
        );

        assertFalse(result.previewOnly());
        assertEquals(1, result.failedNetworks());
        assertEquals("model overloaded", result.adaptations().get(1).error());
        assertEquals(1, result.publications().size());
        ContentItemResponses.Publication publication = result.publications().get(0);
        assertEquals(SocialNetwork.FACEBOOK, publication.network());
        assertEquals(PublicationAttemptStatus.PENDING, publication.status());
        assertEquals(0, publication.retryCount());
        assertEquals("friendly", publication.metadata().path("adaptation").path("tone").asText());
        verify(contentStatusRecalculator).recalculate(contentItem);
    }

    @Test
    void commitSupersedesExistingPendingAttemptForSameNetwork() {
        PublicationAttempt existing = new PublicationAttempt();
        existing.setPublicationAttemptId(UUID.randomUUID());
        existing.setContentItemId(contentItem.getContentItemId());
        existing.setNetwork(SocialNetwork.LINKEDIN);
        existing.setAdaptedContent("old copy");
        existing.setStatus(PublicationAttemptStatus.PENDING);

        when(contentItemRepository.findById(contentItem.getContentItemId())).thenReturn(Optional.of(contentItem));
        when(contentStatusRecalculator.lockContentItem(contentItem.getContentItemId())).thenReturn(Optional.of(contentItem));
        when(publicationAttemptRepository.findByContentItemIdAndNetworkInAndStatus(
                eq(contentItem.getContentItemId()), anyCollection(), eq(PublicationAttemptStatus.PROCESSING)
        )).thenReturn(List.of());
        when(publicationAttemptRepository.findByContentItemIdAndNetworkInAndStatus(
                eq(contentItem.getContentItemId()), anyCollection(), eq(PublicationAttemptStatus.PENDING)
        )).thenReturn(List.of(existing));
        when(publicationAttemptRepository.save(any(PublicationAttempt.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(generativeAdaptationClient.generate(any(AdaptationRequest.class))).thenAnswer(invocation -> generated(invocation.getArgument(0)));

        ContentItemResponses.AdaptationResult result = contentAdaptationService.adapt(
                contentItem.getContentItemId(),
                new ContentItemRequests.AdaptContentRequest(List.of("linkedin"), false)
        );

        assertEquals(1, result.publications().size());
        assertEquals(existing.getPublicationAttemptId(), result.publications().get(0).id());
        assertTrue(existing.getAdaptedContent().startsWith("linkedin copy"));
    }

    @Test
    void commitIsRejectedWhileNetworkIsBeingPublished() {
        PublicationAttempt processing = new PublicationAttempt();
        processing.setNetwork(SocialNetwork.FACEBOOK);
        processing.setStatus(PublicationAttemptStatus.PROCESSING);
        when(contentItemRepository.findById(contentItem.getContentItemId())).thenReturn(Optional.of(contentItem));
        when(publicationAttemptRepository.findByContentItemIdAndNetworkInAndStatus(
                eq(contentItem.getContentItemId()), anyCollection(), eq(PublicationAttemptStatus.PROCESSING)
        )).thenReturn(List.of(processing));

        PublishingApiException thrown = assertThrows(
                PublishingApiException.class,
                () -> contentAdaptationService.adapt(
                        contentItem.getContentItemId(),
                        new ContentItemRequests.AdaptContentRequest(List.of("facebook"), false)
                )
        );

        assertEquals(HttpStatus.CONFLICT, thrown.getStatus());
        verifyNoInteractions(generativeAdaptationClient);
    }

    @Test
    void unknownNetworkIsRejectedBeforeAnyLookup() {
        PublishingApiException thrown = assertThrows(
                PublishingApiException.class,
                () -> contentAdaptationService.adapt(
                        contentItem.getContentItemId(),
                        new ContentItemRequests.AdaptContentRequest(List.of("facebook", "myspace"), true)
                )
        );

        assertEquals(HttpStatus.BAD_REQUEST, thrown.getStatus());
        assertEquals("invalid_network", thrown.getCode());
        assertTrue(thrown.getMessage().contains("myspace"));
        verifyNoInteractions(contentItemRepository, generativeAdaptationClient);
    }

    @Test
    void emptyNetworkListIsValidationError() {
        PublishingApiException thrown = assertThrows(
                PublishingApiException.class,
                () -> contentAdaptationService.adapt(
                        contentItem.getContentItemId(),
                        new ContentItemRequests.AdaptContentRequest(List.of(), true)
                )
        );

        assertEquals("validation_error", thrown.getCode());
    }

    @Test
    void missingContentItemIsNotFound() {
        UUID missingId = UUID.randomUUID();
        when(contentItemRepository.findById(missingId)).thenReturn(Optional.empty());

        PublishingApiException thrown = assertThrows(
                PublishingApiException.class,
                () -> contentAdaptationService.adapt(missingId, null)
        );

        assertEquals(HttpStatus.NOT_FOUND, thrown.getStatus());
    }

    @Test
    void omittedNetworksUseConfiguredDefaultsWithoutDuplicates() {
        adaptationProperties.setDefaultNetworks(List.of("facebook", "FACEBOOK", "whatsapp"));
        when(contentItemRepository.findById(contentItem.getContentItemId())).thenReturn(Optional.of(contentItem));
        when(generativeAdaptationClient.generate(any(AdaptationRequest.class))).thenAnswer(invocation -> generated(invocation.getArgument(0)));

        ContentItemResponses.AdaptationResult result = contentAdaptationService.adapt(
                contentItem.getContentItemId(),
                new ContentItemRequests.AdaptContentRequest(null, true)
        );

        assertEquals(
                List.of(SocialNetwork.FACEBOOK, SocialNetwork.WHATSAPP),
                result.adaptations().stream().map(ContentItemResponses.NetworkAdaptation::network).toList()
        );
        verify(generativeAdaptationClient, times(2)).generate(any(AdaptationRequest.class));
    }

    @Test
    void generatedTextIsCutToNetworkLimit() {
        when(contentItemRepository.findById(contentItem.getContentItemId())).thenReturn(Optional.of(contentItem));
        when(generativeAdaptationClient.generate(any(AdaptationRequest.class)))
                .thenReturn(new GeneratedAdaptation("w".repeat(1_500), List.of(), "Sunset photo", "casual"));

        ContentItemResponses.AdaptationResult result = contentAdaptationService.adapt(
                contentItem.getContentItemId(),
                new ContentItemRequests.AdaptContentRequest(List.of("whatsapp"), true)
        );

        ContentItemResponses.NetworkAdaptation adaptation = result.adaptations().get(0);
        assertEquals(700, adaptation.adaptedText().length());
        assertEquals(700, adaptation.characterCount());
        assertNull(adaptation.error());
    }

    @Test
    void characterCountReportsCodePointsForEmojiCopy() {
        String rocket = new String(Character.toChars(0x1F680));
        when(contentItemRepository.findById(contentItem.getContentItemId())).thenReturn(Optional.of(contentItem));
        when(generativeAdaptationClient.generate(any(AdaptationRequest.class)))
                .thenReturn(new GeneratedAdaptation("w".repeat(699) + rocket + rocket, List.of(), null, "casual"));

        ContentItemResponses.AdaptationResult result = contentAdaptationService.adapt(
                contentItem.getContentItemId(),
                new ContentItemRequests.AdaptContentRequest(List.of("whatsapp"), true)
        );

        ContentItemResponses.NetworkAdaptation adaptation = result.adaptations().get(0);
        assertEquals("w".repeat(699) + rocket, adaptation.adaptedText());
        assertEquals(700, adaptation.characterCount());
    }

    @Test
    void timedOutGenerationIsInterruptedAndFreesItsThread() throws InterruptedException {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            adaptationProperties.setTimeoutSeconds(1);
            ContentAdaptationService timedService = new ContentAdaptationService(
                    contentItemRepository,
                    publicationAttemptRepository,
                    contentStatusRecalculator,
                    generativeAdaptationClient,
                    new PublicationResponseMapper(),
                    adaptationProperties,
                    new TransactionTemplate(mock(PlatformTransactionManager.class)),
                    pool
            );
            CountDownLatch interrupted = new CountDownLatch(1);
            when(contentItemRepository.findById(contentItem.getContentItemId())).thenReturn(Optional.of(contentItem));
            when(generativeAdaptationClient.generate(any(AdaptationRequest.class))).thenAnswer(invocation -> {
                try {
                    new CountDownLatch(1).await();
                } catch (InterruptedException ex) {
                    interrupted.countDown();
                    throw ex;
                }
                return null;
            });

            ContentItemResponses.AdaptationResult result = timedService.adapt(
                    contentItem.getContentItemId(),
                    new ContentItemRequests.AdaptContentRequest(List.of("linkedin"), true)
            );

            assertEquals("Generation timed out after 1s", result.adaptations().get(0).error());
            assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void blankGeneratorOutputCountsAsFailedNetwork() {
        when(contentItemRepository.findById(contentItem.getContentItemId())).thenReturn(Optional.of(contentItem));
        when(generativeAdaptationClient.generate(any(AdaptationRequest.class)))
                .thenReturn(new GeneratedAdaptation("   ", null, null, null));

        ContentItemResponses.AdaptationResult result = contentAdaptationService.adapt(
                contentItem.getContentItemId(),
                new ContentItemRequests.AdaptContentRequest(List.of("linkedin"), true)
        );

        assertEquals(1, result.failedNetworks());
        assertEquals("Generator returned no text", result.adaptations().get(0).error());
    }

    private static GeneratedAdaptation generated(AdaptationRequest request) {
        return new GeneratedAdaptation(
                request.network().code() + " copy: " + request.title(),
                List.of("#autumn"),
                null,
                "friendly"
        );
    }
}
