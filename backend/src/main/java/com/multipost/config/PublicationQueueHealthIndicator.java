package com.multipost.config;

import com.multipost.service.InMemoryPublicationQueue;
import com.multipost.service.RedisPublicationQueue;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the active queue mode, the local backlog and whether the Redis queue has fallen back.
 */
@Component
public class PublicationQueueHealthIndicator implements HealthIndicator {

    private final MultipostRuntimeProperties multipostRuntimeProperties;
    private final InMemoryPublicationQueue inMemoryPublicationQueue;
    private final ObjectProvider<RedisPublicationQueue> redisPublicationQueue;

    public PublicationQueueHealthIndicator(
            MultipostRuntimeProperties multipostRuntimeProperties,
            InMemoryPublicationQueue inMemoryPublicationQueue,
            ObjectProvider<RedisPublicationQueue> redisPublicationQueue
    ) {
        this.multipostRuntimeProperties = multipostRuntimeProperties;
        this.inMemoryPublicationQueue = inMemoryPublicationQueue;
        this.redisPublicationQueue = redisPublicationQueue;
    }

    @Override
    public Health health() {
        Health.Builder builder = Health.up()
                .withDetail("queueMode", multipostRuntimeProperties.getWorker().getQueueMode())
                .withDetail("inMemoryBacklog", inMemoryPublicationQueue.backlog());
        RedisPublicationQueue redisQueue = redisPublicationQueue.getIfAvailable();
        if (redisQueue != null) {
            builder.withDetail("redisFallbackMode", redisQueue.isFallbackMode());
        }
        return builder.build();
    }
}
