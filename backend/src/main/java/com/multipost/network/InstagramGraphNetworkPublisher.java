package com.multipost.network;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.multipost.config.PublishingProperties;
import com.multipost.model.SocialNetwork;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Two step Instagram publish: create a media container, then publish it.
 */
public class InstagramGraphNetworkPublisher implements NetworkPublisher {

    private final RestClient restClient;
    private final PublishingProperties.Instagram instagram;
    private final PublishingProperties.Facebook facebook;

    public InstagramGraphNetworkPublisher(
            RestClient restClient,
            PublishingProperties.Instagram instagram,
            PublishingProperties.Facebook facebook
    ) {
        this.restClient = restClient;
        this.instagram = instagram;
        this.facebook = facebook;
    }

    @Override
    public SocialNetwork network() {
        return SocialNetwork.INSTAGRAM;
    }

    @Override
    public NetworkPublishResult publish(NetworkPublishRequest request) {
        if (!request.hasImage()) {
            throw PublishFailureException.permanent("instagram requires an image or video");
        }
        if (!StringUtils.hasText(instagram.getUserId()) || !StringUtils.hasText(facebook.getAccessToken())) {
            throw PublishFailureException.permanent(
                    "multipost.publishing.instagram.user-id and facebook.access-token must be configured"
            );
        }

        MultiValueMap<String, String> createForm = new LinkedMultiValueMap<>();
        createForm.add("image_url", request.imageUrl());
        createForm.add("caption", request.content());
        createForm.add("access_token", facebook.getAccessToken());
        JsonNode created = FacebookGraphNetworkPublisher.GraphApiCalls.postForm(
                restClient, "instagram", "/{userId}/media", createForm, instagram.getUserId()
        );
        String creationId = created.path("id").asText(null);
        if (creationId == null) {
            throw PublishFailureException.transientFailure("instagram media container has no id: " + created, null);
        }

        MultiValueMap<String, String> publishForm = new LinkedMultiValueMap<>();
        publishForm.add("creation_id", creationId);
        publishForm.add("access_token", facebook.getAccessToken());
        JsonNode published = FacebookGraphNetworkPublisher.GraphApiCalls.postForm(
                restClient, "instagram", "/{userId}/media_publish", publishForm, instagram.getUserId()
        );
        String mediaId = published.path("id").asText(null);
        if (mediaId == null) {
            throw PublishFailureException.permanent("instagram accepted the publish but returned no media id: " + published);
        }

        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put("network", network().code());
        metadata.put("post_id", mediaId);
        metadata.put("creation_id", creationId);
        metadata.put("type", "image");
        return new NetworkPublishResult(mediaId, metadata);
    }
}
