package com.multipost.provider;

/**
 * Rewrites source content for one target network.
 */
public interface GenerativeAdaptationClient {

    GeneratedAdaptation generate(AdaptationRequest request);
}
