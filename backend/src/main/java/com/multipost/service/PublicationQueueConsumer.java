package com.multipost.service;

@FunctionalInterface
public interface PublicationQueueConsumer {

    void accept(PublicationQueueMessage message);
}
