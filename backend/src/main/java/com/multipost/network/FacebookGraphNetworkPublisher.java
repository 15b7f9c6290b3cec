package com.multipost.network;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.multipost.config.PublishingProperties;
import com.multipost.model.SocialNetwork;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Publishes to a Facebook page through the Graph API. Text goes to the page feed,
 * posts with an image go to the page photos edge.
 */
public class FacebookGraphNetworkPublisher implements NetworkPublisher {

    private final RestClient restClient;
    private final PublishingProperties.Facebook facebook;

    public FacebookGraphNetworkPublisher(RestClient restClient, PublishingProperties.Facebook facebook) {
        this.restClient = restClient;
        this.facebook = facebook;
    }

    @Override
    public SocialNetwork network() {
        return SocialNetwork.FACEBOOK;
    }

    @Override
    public NetworkPublishResult publish(NetworkPublishRequest request) {
        if (!StringUtils.hasText(facebook.getPageId()) || !StringUtils.hasText(facebook.getAccessToken())) {
            throw PublishFailureException.permanent(
                    "multipost.publishing.facebook.page-id and access-token must be configured"
            );
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        String edge;
        if (request.hasImage()) {
            edge = "photos";
            form.add("url", request.imageUrl());
            form.add("caption", request.content());
        } else {
            edge = "feed";
            form.add("message", request.content());
        }
        form.add("access_token", facebook.getAccessToken());

        JsonNode response = GraphApiCalls.postForm(restClient, "facebook", "/{pageId}/" + edge, form, facebook.getPageId());
        String postId = response.hasNonNull("post_id") ? response.get("post_id").asText() : response.path("id").asText(null);
        if (postId == null) {
            throw PublishFailureException.permanent("facebook accepted the post but returned no post id: " + response);
        }

        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put("network", network().code());
        metadata.put("post_id", postId);
        metadata.put("type", request.hasImage() ? "photo" : "text");
        metadata.set("response", response);
        return new NetworkPublishResult(postId, metadata);
    }

    /**
     * Shared Graph API call handling for the Facebook and Instagram publishers. A 2xx without a
     * body comes back as a missing node; callers decide whether that is retryable.
     */
    static final class GraphApiCalls {

        private GraphApiCalls() {
        }

        static JsonNode postForm(
                RestClient restClient,
                String networkCode,
                String uriTemplate,
                MultiValueMap<String, String> form,
                Object... uriVariables
        ) {
            JsonNode response;
            try {
                response = restClient.post()
                        .uri(uriTemplate, uriVariables)
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .body(form)
                        .retrieve()
                        .body(JsonNode.class);
            } catch (RestClientResponseException ex) {
                throw PublishFailureException.fromHttpStatus(
                        networkCode,
                        ex.getStatusCode(),
                        ex.getResponseBodyAsString(),
                        ex
                );
            } catch (ResourceAccessException ex) {
                throw PublishFailureException.transientFailure(networkCode + " API unreachable: " + ex.getMessage(), ex);
            }
            return response == null ? MissingNode.getInstance() : response;
        }
    }
}
