package io.clype.reactorpubsub.publisher;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.reactorpubsub.flowcontrol.FlowController;
import io.clype.reactorpubsub.metrics.PublisherMetrics;
import io.clype.reactorpubsub.model.BatchSendFailureException;
import io.clype.reactorpubsub.model.PubsubMessage;
import io.clype.reactorpubsub.model.TopicName;
import io.clype.reactorpubsub.transport.PublisherTransport;
import io.clype.reactorpubsub.util.LogSanitizer;

import reactor.core.publisher.Mono;

/**
 * Hands closed batches to the transport and resolves their handles.
 *
 * <p>Every message in a batch resolves together: to its message id when the transport returns
 * one id per message, otherwise to a {@link BatchSendFailureException}. Each message's
 * flow-control reservation is released as its handle resolves. Nothing is retried.</p>
 */
class BatchSender {

    private static final Logger log = LoggerFactory.getLogger(BatchSender.class);

    private final TopicName topic;
    private final PublisherTransport transport;
    private final CompletionRegistry registry;
    private final FlowController flowController;
    private final PublisherMetrics metrics;

    BatchSender(TopicName topic, PublisherTransport transport, CompletionRegistry registry,
                FlowController flowController, PublisherMetrics metrics) {
        this.topic = topic;
        this.transport = transport;
        this.registry = registry;
        this.flowController = flowController;
        this.metrics = metrics;
    }

    /**
     * Sends a closed batch. The transport is called when the returned Mono is subscribed.
     *
     * @return a Mono completing once every handle in the batch has resolved; it errors with the
     *         {@link BatchSendFailureException} the handles were failed with
     */
    Mono<Void> send(Batch batch) {
        if (batch.isEmpty()) {
            return Mono.empty();
        }
        int batchSize = batch.size();
        List<PubsubMessage> messages = batch.messages();

        return Mono.defer(() -> {
                    long startedAt = metrics != null ? metrics.batchSendStarted() : 0L;
                    return Mono.fromFuture(() -> transport.sendBatch(topic, messages))
                            .switchIfEmpty(Mono.error(() -> new BatchSendFailureException(
                                    topic, batchSize, "transport returned no message ids")))
                            .flatMap(ids -> checkIdCount(ids, batchSize))
                            .onErrorMap(e -> !(e instanceof BatchSendFailureException),
                                    e -> new BatchSendFailureException(topic, batchSize, e))
                            .doOnNext(ids -> resolveSucceeded(batch, ids, startedAt))
                            .doOnError(e -> resolveFailed(batch, e, startedAt));
                })
                .then();
    }

    private Mono<List<String>> checkIdCount(List<String> ids, int batchSize) {
        if (ids.size() != batchSize) {
            return Mono.error(new BatchSendFailureException(topic, batchSize,
                    "transport returned " + ids.size() + " message ids for " + batchSize + " messages"));
        }
        return Mono.just(ids);
    }

    private void resolveSucceeded(Batch batch, List<String> ids, long startedAt) {
        List<PendingMessage> entries = batch.entries();
        for (int i = 0; i < entries.size(); i++) {
            PendingMessage entry = entries.get(i);
            registry.succeed(entry.handle(), ids.get(i));
            flowController.release(entry.permit());
        }
        if (metrics != null) {
            metrics.batchSendSucceeded(startedAt, entries.size());
        }
        log.debug("Successfully published batch of {} messages to {}.", entries.size(), topic);
    }

    private void resolveFailed(Batch batch, Throwable failure, long startedAt) {
        for (PendingMessage entry : batch.entries()) {
            registry.fail(entry.handle(), failure);
            flowController.release(entry.permit());
        }
        if (metrics != null) {
            metrics.batchSendFailed(startedAt, batch.size());
        }
        log.error("Failed to publish batch of {} messages to {}: {}",
                batch.size(), topic, LogSanitizer.sanitize(failure.getMessage()));
    }

    /**
     * Fails a message that never reached a batch send, releasing its reservation.
     */
    void failUnsent(PendingMessage entry, Throwable failure) {
        if (registry.fail(entry.handle(), failure) && metrics != null) {
            metrics.messagesFailedUnsent(1);
        }
        flowController.release(entry.permit());
    }

    TopicName topic() {
        return topic;
    }
}
