package com.multipost.service;

/**
 * At-least-once hand-off of publication work units to the worker pool.
 */
public interface PublicationQueue {

    /**
     * Queues {@code message} and returns the work-unit handle. Throws when the unit could not be queued.
     */
    String enqueue(PublicationQueueMessage message);

    void setConsumer(PublicationQueueConsumer consumer);
}
