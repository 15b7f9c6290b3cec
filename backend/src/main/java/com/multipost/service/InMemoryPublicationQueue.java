package com.multipost.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;

/**
 * Process-local queue. Always present so the Redis queue can fall back to it.
 */
@Service
public class InMemoryPublicationQueue implements PublicationQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPublicationQueue.class);

    private final BlockingQueue<PublicationQueueMessage> queue = new LinkedBlockingQueue<>();
    private final Object consumerMonitor = new Object();
    private final Executor workerExecutor;

    private volatile boolean running = true;
    private volatile PublicationQueueConsumer consumer;
    private Thread dispatcherThread;

    public InMemoryPublicationQueue(@Qualifier("publicationWorkerExecutor") Executor workerExecutor) {
        this.workerExecutor = workerExecutor;
    }

    @PostConstruct
    void startDispatcher() {
        dispatcherThread = new Thread(this::dispatchLoop, "publication-queue-dispatcher");
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
        queue.offer(requiredMessage);
        return requiredMessage.workUnitId().toString();
    }

    @Override
    public void setConsumer(PublicationQueueConsumer consumer) {
        synchronized (consumerMonitor) {
            this.consumer = Objects.requireNonNull(consumer, "consumer is required");
            consumerMonitor.notifyAll();
        }
    }

    public int backlog() {
        return queue.size();
    }

    private void dispatchLoop() {
        while (running) {
            try {
                PublicationQueueMessage message = queue.take();
                PublicationQueueConsumer queueConsumer = awaitConsumer();
                if (queueConsumer == null) {
                    return;
                }
                handOff(workerExecutor, queueConsumer, message);
            } catch (InterruptedException ex) {
                if (!running) {
                    Thread.currentThread().interrupt();
                    return;
                }
            } catch (RuntimeException ex) {
                log.error("Publication queue failed while dispatching queued message", ex);
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

    static void handOff(Executor executor, PublicationQueueConsumer consumer, PublicationQueueMessage message) {
        try {
            executor.execute(() -> {
                try {
                    consumer.accept(message);
                } catch (RuntimeException ex) {
                    log.error(
                            "Publication consumer failed for attempt {} (work unit {})",
                            message.publicationAttemptId(),
                            message.workUnitId(),
                            ex
                    );
                }
            });
        } catch (RejectedExecutionException ex) {
            log.warn(
                    "Worker pool rejected work unit {} for attempt {}; it stays processing until re-driven",
                    message.workUnitId(),
                    message.publicationAttemptId()
            );
        }
    }
}
