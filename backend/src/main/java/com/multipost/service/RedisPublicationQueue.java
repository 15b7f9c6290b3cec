package com.multipost.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.multipost.config.MultipostRuntimeProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Redis list backed queue. Routes work to the in-memory queue while Redis is unreachable
 * and probes Redis again after a short back-off.
 */
@Service
@Primary
@ConditionalOnProperty(
        prefix = "multipost.worker",
        name = "queue-mode",
        havingValue = "redis"
)
public class RedisPublicationQueue implements PublicationQueue {

    private static final Logger log = LoggerFactory.getLogger(RedisPublicationQueue.class);
    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder().build();
    private static final Duration REDIS_FAILURE_BACKOFF = Duration.ofSeconds(5);

    private final StringRedisTemplate stringRedisTemplate;
    private final MultipostRuntimeProperties multipostRuntimeProperties;
    private final InMemoryPublicationQueue fallbackQueue;
    private final Executor workerExecutor;
    private final Object consumerMonitor = new Object();

    private volatile boolean running = true;
    private volatile PublicationQueueConsumer consumer;
    private volatile boolean fallbackMode;
    private volatile long redisRetryNotBeforeNanos;
    private Thread dispatcherThread;

    public RedisPublicationQueue(
            StringRedisTemplate stringRedisTemplate,
            MultipostRuntimeProperties multipostRuntimeProperties,
            InMemoryPublicationQueue fallbackQueue,
            @Qualifier("publicationWorkerExecutor") Executor workerExecutor
    ) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.multipostRuntimeProperties = multipostRuntimeProperties;
        this.fallbackQueue = fallbackQueue;
        this.workerExecutor = workerExecutor;
    }

    @PostConstruct
    void startDispatcher() {
        dispatcherThread = new Thread(this::dispatchLoop, "publication-redis-queue-dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();
    }

    @PreDestroy
    void stopDispatcher() {
        running = false;
        synchronized (consumerMonitor) {
            consumerMonitor.notifyAll();
        }
        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
        }
    }

    @Override
    public String enqueue(PublicationQueueMessage message) {
        if (!running) {
            throw new IllegalStateException("Publication queue is not running");
        }
        PublicationQueueMessage requiredMessage = Objects.requireNonNull(message, "message is required");
        if (!shouldAttemptRedis()) {
            return fallbackQueue.enqueue(requiredMessage);
        }
        String queueKey = resolveRedisQueueKey();
        String payload = serialize(requiredMessage);
        try {
            Long queueDepth = stringRedisTemplate.opsForList().rightPush(queueKey, payload);
            if (queueDepth != null) {
                markRedisHealthy();
                return requiredMessage.workUnitId().toString();
            }
            log.warn("Redis queue push returned null, routing message to in-memory fallback queue");
            markRedisFailure(null);
        } catch (RuntimeException ex) {
            markRedisFailure(ex);
        }
        return fallbackQueue.enqueue(requiredMessage);
    }

    @Override
    public void setConsumer(PublicationQueueConsumer consumer) {
        PublicationQueueConsumer requiredConsumer = Objects.requireNonNull(consumer, "consumer is required");
        synchronized (consumerMonitor) {
            this.consumer = requiredConsumer;
            consumerMonitor.notifyAll();
        }
        fallbackQueue.setConsumer(requiredConsumer);
    }

    public boolean isFallbackMode() {
        return fallbackMode;
    }

    boolean pollOnce() throws InterruptedException {
        if (!shouldAttemptRedis()) {
            TimeUnit.MILLISECONDS.sleep(200L);
            return false;
        }

        String payload = stringRedisTemplate.opsForList().leftPop(
                resolveRedisQueueKey(),
                resolveRedisPopTimeoutSeconds(),
                TimeUnit.SECONDS
        );
        if (payload == null) {
            return false;
        }
        PublicationQueueConsumer queueConsumer = awaitConsumer();
        if (queueConsumer == null) {
            return false;
        }
        InMemoryPublicationQueue.handOff(workerExecutor, queueConsumer, deserialize(payload));
        markRedisHealthy();
        return true;
    }

    private void dispatchLoop() {
        while (running) {
            try {
                pollOnce();
            } catch (InterruptedException ex) {
                if (!running) {
                    Thread.currentThread().interrupt();
                    return;
                }
            } catch (RuntimeException ex) {
                markRedisFailure(ex);
            }
        }
    }

    private PublicationQueueConsumer awaitConsumer() throws InterruptedException {
        synchronized (consumerMonitor) {
            while (running && consumer == null) {
                consumerMonitor.wait();
            }
            return consumer;
        }
    }

    private String resolveRedisQueueKey() {
        String queueKey = multipostRuntimeProperties.getWorker().getRedisQueueKey();
        if (queueKey == null || queueKey.isBlank()) {
            throw new IllegalStateException("multipost.worker.redis-queue-key must not be blank");
        }
        return queueKey.trim();
    }

    private long resolveRedisPopTimeoutSeconds() {
        long timeoutSeconds = multipostRuntimeProperties.getWorker().getRedisPopTimeoutSeconds();
        if (timeoutSeconds <= 0) {
            throw new IllegalStateException("multipost.worker.redis-pop-timeout-seconds must be greater than zero");
        }
        return timeoutSeconds;
    }

    private String serialize(PublicationQueueMessage message) {
        try {
            return OBJECT_MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize publication queue message payload", ex);
        }
    }

    private PublicationQueueMessage deserialize(String payload) {
        try {
            return OBJECT_MAPPER.readValue(payload, PublicationQueueMessage.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to deserialize publication queue payload", ex);
        }
    }

    private boolean shouldAttemptRedis() {
        return System.nanoTime() >= redisRetryNotBeforeNanos;
    }

    private void markRedisFailure(RuntimeException ex) {
        redisRetryNotBeforeNanos = System.nanoTime() + REDIS_FAILURE_BACKOFF.toNanos();
        if (!fallbackMode) {
            fallbackMode = true;
            if (ex == null) {
                log.warn("Redis queue is unavailable; switching to in-memory fallback mode");
            } else {
                log.warn(
                        "Redis queue is unavailable ({}); switching to in-memory fallback mode",
                        resolveSafeMessage(ex)
                );
            }
        }
    }

    private void markRedisHealthy() {
        if (fallbackMode) {
            log.info("Redis queue connection restored; leaving in-memory fallback mode");
        }
        fallbackMode = false;
        redisRetryNotBeforeNanos = 0L;
    }

    private String resolveSafeMessage(RuntimeException ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }
}
