package io.clype.reactorpubsub.transport;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import io.clype.reactorpubsub.model.PubsubMessage;
import io.clype.reactorpubsub.model.TopicName;

/**
 * Sends closed batches to the service.
 *
 * <p>Implementations own serialization, authentication and transport-level retries. The engine
 * calls {@link #sendBatch} exactly once per closed batch and never resends.</p>
 */
@FunctionalInterface
public interface PublisherTransport {

    /**
     * Sends one batch.
     *
     * @param topic    the destination topic
     * @param messages the batch, in publish order
     * @return a future with the service-assigned message ids in the same order as {@code messages},
     *         or completed exceptionally when the send failed
     */
    CompletableFuture<List<String>> sendBatch(TopicName topic, List<PubsubMessage> messages);
}
