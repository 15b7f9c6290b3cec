package com.multipost.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Queue and worker runtime settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "multipost")
public class MultipostRuntimeProperties {

    private Worker worker = new Worker();

    @Getter
    @Setter
    public static class Worker {
        /**
         * Number of publication work units that may run in parallel.
         */
        private int concurrency = 4;

        /**
         * {@code in_memory} or {@code redis}.
         */
        private String queueMode = "in_memory";
        private String redisQueueKey = "multipost:publication:queue";
        private long redisPopTimeoutSeconds = 1;
    }
}
