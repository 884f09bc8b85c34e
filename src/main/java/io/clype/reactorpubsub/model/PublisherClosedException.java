package io.clype.reactorpubsub.model;

/**
 * Thrown by publish calls made after the publisher began shutting down.
 */
public class PublisherClosedException extends PubsubException {

    public PublisherClosedException(TopicName topic) {
        super("Publisher for " + topic + " is shut down");
    }
}
