package com.multipost.network;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Successful publish outcome. {@code metadata} is stored on the attempt as-is.
 */
public record NetworkPublishResult(
        String externalId,
        ObjectNode metadata
) {
}
