package io.clype.reactorpubsub.transport;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import io.clype.reactorpubsub.model.ReceivedMessage;
import io.clype.reactorpubsub.model.SubscriptionName;

import reactor.core.publisher.Flux;

/**
 * Delivery-side capabilities of the service.
 *
 * <p>Acks and nacks are fire-and-forget from the engine's point of view: the returned futures
 * are only observed to log failures.</p>
 */
public interface SubscriberTransport {

    /**
     * Opens the delivery stream for a subscription.
     *
     * <p>The stream is lazy and normally infinite. It terminates with an error on transport-level
     * disconnect; reconnecting is the caller's decision.</p>
     *
     * @param subscription the subscription to pull from
     * @return the stream of delivered messages
     */
    Flux<ReceivedMessage> openDeliveryStream(SubscriptionName subscription);

    /**
     * Sets the ack deadline of a delivered message to {@code deadline} from now.
     *
     * @param ackId    the delivery handle
     * @param deadline the new deadline, relative to the time the service processes the request
     * @return a future completed when the service accepted the change
     */
    CompletableFuture<Void> modifyAckDeadline(String ackId, Duration deadline);

    CompletableFuture<Void> ack(String ackId);

    /**
     * Requests redelivery of a message.
     *
     * @param ackId the delivery handle
     * @return a future completed when the service accepted the request
     */
    CompletableFuture<Void> nack(String ackId);
}
