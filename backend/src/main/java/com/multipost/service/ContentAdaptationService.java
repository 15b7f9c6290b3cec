package com.multipost.service;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Produces per-network variants of a content item. Preview mode only returns them;
 * commit mode stores one pending attempt per successfully adapted network.
 * <p>
 * Generation runs outside any transaction, one task per network, so a slow model call
 * for one network does not hold up the others.
 */
@Service
public class ContentAdaptationService {

    private static final Logger log = LoggerFactory.getLogger(ContentAdaptationService.class);
    private static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

    private final ContentItemRepository contentItemRepository;
    private final PublicationAttemptRepository publicationAttemptRepository;
    private final ContentStatusRecalculator contentStatusRecalculator;
    private final GenerativeAdaptationClient generativeAdaptationClient;
    private final PublicationResponseMapper publicationResponseMapper;
    private final AdaptationProperties adaptationProperties;
    private final TransactionTemplate transactionTemplate;
    private final Executor adaptationExecutor;

    public ContentAdaptationService(
            ContentItemRepository contentItemRepository,
            PublicationAttemptRepository publicationAttemptRepository,
            ContentStatusRecalculator contentStatusRecalculator,
            GenerativeAdaptationClient generativeAdaptationClient,
            PublicationResponseMapper publicationResponseMapper,
            AdaptationProperties adaptationProperties,
            TransactionTemplate transactionTemplate,
            @Qualifier("adaptationExecutor") Executor adaptationExecutor
    ) {
        this.contentItemRepository = contentItemRepository;
        this.publicationAttemptRepository = publicationAttemptRepository;
        this.contentStatusRecalculator = contentStatusRecalculator;
        this.generativeAdaptationClient = generativeAdaptationClient;
        this.publicationResponseMapper = publicationResponseMapper;
        this.adaptationProperties = adaptationProperties;
        this.transactionTemplate = transactionTemplate;
        this.adaptationExecutor = adaptationExecutor;
    }

    public ContentItemResponses.AdaptationResult adapt(
            UUID contentItemId,
            ContentItemRequests.AdaptContentRequest request
    ) {
        List<String> requestedNetworks = request == null ? null : request.networks();
        boolean previewOnly = request != null && request.isPreview();
        List<SocialNetwork> networks = resolveNetworks(requestedNetworks);

        ContentItem contentItem = contentItemRepository.findById(contentItemId)
                .orElseThrow(() -> PublishingApiException.notFound("Content item not found: " + contentItemId));
        if (!previewOnly) {
            rejectInFlightNetworks(contentItemId, networks);
        }

        List<ContentItemResponses.NetworkAdaptation> adaptations = generateAll(contentItem, networks);
        int failedNetworks = (int) adaptations.stream().filter(adaptation -> !adaptation.succeeded()).count();

        if (previewOnly) {
            log.info(
                    "Previewed content item {} for {} networks ({} failed)",
                    contentItemId,
                    networks.size(),
                    failedNetworks
            );
            return new ContentItemResponses.AdaptationResult(contentItemId, true, adaptations, List.of(), failedNetworks);
        }

        List<PublicationAttempt> committed = transactionTemplate.execute(status -> commit(contentItemId, adaptations));
        log.info(
                "Committed {} pending publication attempts for content item {} ({} networks failed)",
                committed == null ? 0 : committed.size(),
                contentItemId,
                failedNetworks
        );
        return new ContentItemResponses.AdaptationResult(
                contentItemId,
                false,
                adaptations,
                publicationResponseMapper.toPublications(committed == null ? List.of() : committed),
                failedNetworks
        );
    }

    List<SocialNetwork> resolveNetworks(List<String> requestedNetworks) {
        List<String> names = requestedNetworks == null ? adaptationProperties.getDefaultNetworks() : requestedNetworks;
        if (names == null || names.isEmpty()) {
            throw PublishingApiException.validation("At least one network is required");
        }

        Set<SocialNetwork> networks = new LinkedHashSet<>();
        List<String> invalid = new ArrayList<>();
        for (String name : names) {
            SocialNetwork.fromCode(name).ifPresentOrElse(networks::add, () -> invalid.add(String.valueOf(name)));
        }
        if (!invalid.isEmpty()) {
            throw PublishingApiException.invalidNetwork(invalid);
        }
        return List.copyOf(networks);
    }

    private void rejectInFlightNetworks(UUID contentItemId, List<SocialNetwork> networks) {
        List<PublicationAttempt> inFlight = publicationAttemptRepository.findByContentItemIdAndNetworkInAndStatus(
                contentItemId,
                networks,
                PublicationAttemptStatus.PROCESSING
        );
        if (!inFlight.isEmpty()) {
            String busyNetworks = inFlight.stream()
                    .map(attempt -> attempt.getNetwork().code())
                    .distinct()
                    .collect(Collectors.joining(", "));
            throw PublishingApiException.conflict("Publication already in progress for: " + busyNetworks);
        }
    }

    /**
     * Runs one generation task per network and waits for all of them against a shared
     * deadline. A task still running at the deadline is cancelled with an interrupt so it
     * gives its adaptation thread back.
     */
    private List<ContentItemResponses.NetworkAdaptation> generateAll(ContentItem contentItem, List<SocialNetwork> networks) {
        long timeoutSeconds = Math.max(1, adaptationProperties.getTimeoutSeconds());
        Map<SocialNetwork, FutureTask<ContentItemResponses.NetworkAdaptation>> tasks = new LinkedHashMap<>();
        for (SocialNetwork network : networks) {
            AdaptationRequest adaptationRequest = new AdaptationRequest(
                    contentItem.getContentItemId(),
                    contentItem.getTitle(),
                    contentItem.getBody(),
                    network
            );
            FutureTask<ContentItemResponses.NetworkAdaptation> task = new FutureTask<>(() -> generateOne(adaptationRequest));
            tasks.put(network, task);
            try {
                adaptationExecutor.execute(task);
            } catch (RejectedExecutionException ex) {
                task.cancel(false);
            }
        }

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
        List<ContentItemResponses.NetworkAdaptation> adaptations = new ArrayList<>();
        for (Map.Entry<SocialNetwork, FutureTask<ContentItemResponses.NetworkAdaptation>> entry : tasks.entrySet()) {
            SocialNetwork network = entry.getKey();
            FutureTask<ContentItemResponses.NetworkAdaptation> task = entry.getValue();
            String failure;
            try {
                adaptations.add(task.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS));
                continue;
            } catch (TimeoutException ex) {
                task.cancel(true);
                failure = "Generation timed out after " + timeoutSeconds + "s";
            } catch (ExecutionException ex) {
                failure = describeFailure(ex.getCause() == null ? ex : ex.getCause());
            } catch (CancellationException ex) {
                failure = "Generation could not be scheduled";
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                task.cancel(true);
                failure = "Generation interrupted";
            }
            log.warn(
                    "Adaptation failed for content item {} on {}: {}",
                    contentItem.getContentItemId(),
                    network.code(),
                    failure
            );
            adaptations.add(ContentItemResponses.NetworkAdaptation.failed(network, failure));
        }
        return adaptations;
    }

    private ContentItemResponses.NetworkAdaptation generateOne(AdaptationRequest request) {
        GeneratedAdaptation generated = generativeAdaptationClient.generate(request);
        if (generated == null || generated.adaptedText() == null || generated.adaptedText().isBlank()) {
            throw new IllegalStateException("Generator returned no text");
        }
        String text = request.network().truncate(generated.adaptedText());
        return new ContentItemResponses.NetworkAdaptation(
                request.network(),
                text,
                generated.hashtags(),
                generated.imageSuggestion(),
                SocialNetwork.characterCount(text),
                generated.tone(),
                null
        );
    }

    private List<PublicationAttempt> commit(
            UUID contentItemId,
            List<ContentItemResponses.NetworkAdaptation> adaptations
    ) {
        ContentItem contentItem = contentStatusRecalculator.lockContentItem(contentItemId)
                .orElseThrow(() -> PublishingApiException.notFound("Content item not found: " + contentItemId));

        List<SocialNetwork> succeeded = adaptations.stream()
                .filter(ContentItemResponses.NetworkAdaptation::succeeded)
                .map(ContentItemResponses.NetworkAdaptation::network)
                .toList();
        if (succeeded.isEmpty()) {
            return List.of();
        }
        rejectInFlightNetworks(contentItemId, succeeded);

        Map<SocialNetwork, PublicationAttempt> pendingByNetwork = publicationAttemptRepository
                .findByContentItemIdAndNetworkInAndStatus(contentItemId, succeeded, PublicationAttemptStatus.PENDING)
                .stream()
                .collect(Collectors.toMap(
                        PublicationAttempt::getNetwork,
                        Function.identity(),
                        (first, ignored) -> first
                ));

        OffsetDateTime now = OffsetDateTime.now();
        List<PublicationAttempt> committed = new ArrayList<>();
        for (ContentItemResponses.NetworkAdaptation adaptation : adaptations) {
            if (!adaptation.succeeded()) {
                continue;
            }
            PublicationAttempt attempt = pendingByNetwork.get(adaptation.network());
            if (attempt == null) {
                attempt = new PublicationAttempt();
                attempt.setPublicationAttemptId(UUID.randomUUID());
                attempt.setContentItemId(contentItemId);
                attempt.setNetwork(adaptation.network());
                attempt.setStatus(PublicationAttemptStatus.PENDING);
                attempt.setRetryCount(0);
                attempt.setCreatedAt(now);
            } else {
                log.debug(
                        "Superseding pending attempt {} for {} on content item {}",
                        attempt.getPublicationAttemptId(),
                        adaptation.network().code(),
                        contentItemId
                );
            }
            attempt.setAdaptedContent(adaptation.adaptedText());
            attempt.setMetadata(adaptationMetadata(adaptation));
            attempt.setUpdatedAt(now);
            committed.add(publicationAttemptRepository.save(attempt));
        }

        contentStatusRecalculator.recalculate(contentItem);
        return committed;
    }

    private static ObjectNode adaptationMetadata(ContentItemResponses.NetworkAdaptation adaptation) {
        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        ObjectNode details = metadata.putObject("adaptation");
        ArrayNode hashtags = details.putArray("hashtags");
        adaptation.hashtags().forEach(hashtags::add);
        details.put("image_suggestion", adaptation.imageSuggestion());
        details.put("tone", adaptation.tone());
        details.put("character_count", adaptation.characterCount());
        return metadata;
    }

    private static String describeFailure(Throwable cause) {
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            message = cause.getClass().getSimpleName();
        }
        String normalized = message.trim();
        return normalized.length() <= MAX_ERROR_MESSAGE_LENGTH
                ? normalized
                : normalized.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }
}
