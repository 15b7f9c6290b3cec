package com.multipost.network;

import com.multipost.model.SocialNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable network to publisher lookup, built once at startup.
 */
@Component
public class NetworkPublisherRegistry {

    private static final Logger log = LoggerFactory.getLogger(NetworkPublisherRegistry.class);

    private final Map<SocialNetwork, NetworkPublisher> publishers;

    public NetworkPublisherRegistry(List<NetworkPublisher> networkPublishers) {
        Map<SocialNetwork, NetworkPublisher> registered = new EnumMap<>(SocialNetwork.class);
        for (NetworkPublisher publisher : networkPublishers) {
            SocialNetwork network = Objects.requireNonNull(publisher.network(), "publisher network is required");
            NetworkPublisher previous = registered.putIfAbsent(network, publisher);
            if (previous != null) {
                throw new IllegalStateException(
                        "Duplicate publisher registration for network " + network.code()
                                + ": " + previous.getClass().getSimpleName()
                                + " and " + publisher.getClass().getSimpleName()
                );
            }
        }
        this.publishers = Collections.unmodifiableMap(registered);
        log.info("Registered network publishers: {}", this.publishers.keySet());
    }

    public NetworkPublishResult publish(NetworkPublishRequest request) {
        NetworkPublisher publisher = publishers.get(request.network());
        if (publisher == null) {
            throw PublishFailureException.permanent("No publisher registered for network " + request.network().code());
        }
        return publisher.publish(request);
    }

    public Set<SocialNetwork> registeredNetworks() {
        return publishers.keySet();
    }
}
