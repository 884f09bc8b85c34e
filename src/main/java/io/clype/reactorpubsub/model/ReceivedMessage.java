package io.clype.reactorpubsub.model;

import java.util.Objects;

/**
 * A message as delivered on a subscription's delivery stream.
 *
 * @param ackId           the delivery handle used for ack, nack and deadline changes
 * @param message         the delivered message
 * @param deliveryAttempt how many times the service has delivered this message, or 0 when unknown
 */
public record ReceivedMessage(
    String ackId,
    PubsubMessage message,
    int deliveryAttempt
) {
    public ReceivedMessage {
        Objects.requireNonNull(ackId, "ackId cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
        if (ackId.isEmpty()) {
            throw new IllegalArgumentException("ackId cannot be empty");
        }
        if (deliveryAttempt < 0) {
            throw new IllegalArgumentException("deliveryAttempt cannot be negative, got: " + deliveryAttempt);
        }
    }

    public ReceivedMessage(String ackId, PubsubMessage message) {
        this(ackId, message, 0);
    }
}
