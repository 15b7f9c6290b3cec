package com.multipost.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.multipost.config.MultipostRuntimeProperties;
import com.multipost.model.SocialNetwork;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisPublicationQueueTest {

    private static final String QUEUE_KEY = "multipost:test:publication:queue";

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ListOperations<String, String> listOperations;

    @Mock
    private InMemoryPublicationQueue fallbackQueue;

    private MultipostRuntimeProperties multipostRuntimeProperties;
    private RedisPublicationQueue redisPublicationQueue;

    @BeforeEach
    void setUp() {
        multipostRuntimeProperties = new MultipostRuntimeProperties();
        multipostRuntimeProperties.getWorker().setRedisQueueKey(QUEUE_KEY);
        multipostRuntimeProperties.getWorker().setRedisPopTimeoutSeconds(2);
        redisPublicationQueue = new RedisPublicationQueue(
                stringRedisTemplate,
                multipostRuntimeProperties,
                fallbackQueue,
                Runnable::run
        );
    }

    @Test
    void enqueuePushesSerializedMessageOntoConfiguredQueue() {
        PublicationQueueMessage message = sampleMessage();
        when(stringRedisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.rightPush(eq(QUEUE_KEY), anyString())).thenReturn(1L);

        String handle = redisPublicationQueue.enqueue(message);

        assertEquals(message.workUnitId().toString(), handle);
        verify(listOperations).rightPush(
                eq(QUEUE_KEY),
                argThat(payload -> payload.contains(message.publicationAttemptId().toString())
                        && payload.contains("\"network\":\"whatsapp\""))
        );
        verify(fallbackQueue, never()).enqueue(any());
        assertFalse(redisPublicationQueue.isFallbackMode());
    }

    @Test
    void enqueueFallsBackToInMemoryWhenRedisPushFails() {
        PublicationQueueMessage message = sampleMessage();
        when(stringRedisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.rightPush(eq(QUEUE_KEY), anyString()))
                .thenThrow(new RuntimeException("redis unavailable"));
        when(fallbackQueue.enqueue(message)).thenReturn(message.workUnitId().toString());

        String handle = redisPublicationQueue.enqueue(message);

        assertEquals(message.workUnitId().toString(), handle);
        verify(fallbackQueue).enqueue(message);
        assertTrue(redisPublicationQueue.isFallbackMode());
    }

    @Test
    void enqueueSkipsRedisDuringFailureBackoff() {
        PublicationQueueMessage first = sampleMessage();
        PublicationQueueMessage second = sampleMessage();
        when(stringRedisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.rightPush(eq(QUEUE_KEY), anyString()))
                .thenThrow(new RuntimeException("redis unavailable"));

        redisPublicationQueue.enqueue(first);
        redisPublicationQueue.enqueue(second);

        verify(listOperations, times(1)).rightPush(eq(QUEUE_KEY), anyString());
        verify(fallbackQueue).enqueue(first);
        verify(fallbackQueue).enqueue(second);
    }

    @Test
    void pollOnceDispatchesDeserializedMessageToConsumer() throws Exception {
        PublicationQueueMessage queuedMessage = sampleMessage();
        String payload = new ObjectMapper().writeValueAsString(queuedMessage);
        when(stringRedisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.leftPop(QUEUE_KEY, 2L, TimeUnit.SECONDS)).thenReturn(payload);

        AtomicReference<PublicationQueueMessage> receivedMessage = new AtomicReference<>();
        redisPublicationQueue.setConsumer(receivedMessage::set);
        verify(fallbackQueue).setConsumer(any());

        boolean processed = redisPublicationQueue.pollOnce();

        assertTrue(processed);
        assertEquals(queuedMessage, receivedMessage.get());
    }

    @Test
    void pollOnceReturnsFalseWhenQueueIsEmpty() throws InterruptedException {
        when(stringRedisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.leftPop(QUEUE_KEY, 2L, TimeUnit.SECONDS)).thenReturn(null);
        redisPublicationQueue.setConsumer(ignored -> {
        });

        boolean processed = redisPublicationQueue.pollOnce();

        assertFalse(processed);
    }

    @Test
    void enqueueFailsFastWhenQueueKeyIsBlank() {
        multipostRuntimeProperties.getWorker().setRedisQueueKey("   ");

        IllegalStateException thrown = assertThrows(
                IllegalStateException.class,
                () -> redisPublicationQueue.enqueue(sampleMessage())
        );

        assertEquals("multipost.worker.redis-queue-key must not be blank", thrown.getMessage());
    }

    @Test
    void pollOnceFailsFastWhenPopTimeoutIsNotPositive() {
        multipostRuntimeProperties.getWorker().setRedisPopTimeoutSeconds(0);
        when(stringRedisTemplate.opsForList()).thenReturn(listOperations);

        IllegalStateException thrown = assertThrows(
                IllegalStateException.class,
                () -> redisPublicationQueue.pollOnce()
        );

        assertEquals("multipost.worker.redis-pop-timeout-seconds must be greater than zero", thrown.getMessage());
    }

    private static PublicationQueueMessage sampleMessage() {
        return PublicationQueueMessage.firstDelivery(
                UUID.randomUUID(),
                UUID.randomUUID(),
                SocialNetwork.WHATSAPP,
                "Story caption",
                "https://cdn.example.com/story.jpg"
        );
    }
}
