package com.multipost.network;

import com.multipost.model.SocialNetwork;

/**
 * Publishes adapted content to one network. Implementations throw
 * {@link PublishFailureException} to signal how a failure should be handled.
 */
public interface NetworkPublisher {

    SocialNetwork network();

    NetworkPublishResult publish(NetworkPublishRequest request);
}
