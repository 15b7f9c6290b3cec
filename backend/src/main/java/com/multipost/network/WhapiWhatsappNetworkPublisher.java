package com.multipost.network;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.multipost.config.PublishingProperties;
import com.multipost.model.SocialNetwork;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.Map;

/**
 * Posts a WhatsApp status (story) with media through the Whapi gateway.
 */
public class WhapiWhatsappNetworkPublisher implements NetworkPublisher {

    private final RestClient restClient;
    private final PublishingProperties.Whatsapp whatsapp;

    public WhapiWhatsappNetworkPublisher(RestClient restClient, PublishingProperties.Whatsapp whatsapp) {
        this.restClient = restClient;
        this.whatsapp = whatsapp;
    }

    @Override
    public SocialNetwork network() {
        return SocialNetwork.WHATSAPP;
    }

    @Override
    public NetworkPublishResult publish(NetworkPublishRequest request) {
        if (!request.hasImage()) {
            throw PublishFailureException.permanent("whatsapp requires an image or video");
        }
        if (!StringUtils.hasText(whatsapp.getToken())) {
            throw PublishFailureException.permanent("multipost.publishing.whatsapp.token must be configured");
        }

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/stories/send/media")
                    .headers(headers -> headers.setBearerAuth(whatsapp.getToken()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(Map.of("media", request.imageUrl(), "caption", request.content()))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException ex) {
            throw PublishFailureException.fromHttpStatus(
                    network().code(),
                    ex.getStatusCode(),
                    ex.getResponseBodyAsString(),
                    ex
            );
        } catch (ResourceAccessException ex) {
            throw PublishFailureException.transientFailure("whatsapp API unreachable: " + ex.getMessage(), ex);
        }
        if (response == null) {
            response = JsonNodeFactory.instance.objectNode();
        }

        String storyId = response.hasNonNull("id")
                ? response.get("id").asText()
                : response.path("message").path("id").asText(null);
        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put("network", network().code());
        if (storyId != null) {
            metadata.put("post_id", storyId);
        }
        metadata.put("type", "story");
        metadata.set("response", response);
        return new NetworkPublishResult(storyId, metadata);
    }
}
