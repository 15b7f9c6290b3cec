package com.multipost.network;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.multipost.model.SocialNetwork;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Stand-in publisher for local runs. Applies the network's input rules and
 * returns a synthetic post id without any I/O.
 */
public class SimulatedNetworkPublisher implements NetworkPublisher {

    private final SocialNetwork network;

    public SimulatedNetworkPublisher(SocialNetwork network) {
        this.network = Objects.requireNonNull(network, "network is required");
    }

    @Override
    public SocialNetwork network() {
        return network;
    }

    @Override
    public NetworkPublishResult publish(NetworkPublishRequest request) {
        if (request.content() == null || request.content().isBlank()) {
            throw PublishFailureException.permanent(network.code() + " publish requires non-empty content");
        }
        if (network.mediaRequired() && !request.hasImage()) {
            throw PublishFailureException.permanent(network.code() + " requires an image or video");
        }
        String postId = "sim_" + network.code() + "_" + request.publicationAttemptId().toString().substring(0, 8);
        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put("simulated", true);
        metadata.put("network", network.code());
        metadata.put("post_id", postId);
        metadata.put("type", request.hasImage() ? "media" : "text");
        metadata.put("published_at", OffsetDateTime.now().toString());
        return new NetworkPublishResult(postId, metadata);
    }
}
