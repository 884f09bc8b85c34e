package io.clype.reactorpubsub.subscriber;

/**
 * Delivery state of a received message.
 */
public enum LeaseState {
    /** Received and not settled. */
    DELIVERED,
    /** A deadline extension request is outstanding. */
    EXTENDING,
    ACKED,
    NACKED,
    /** The deadline passed without settlement; the service will redeliver. */
    EXPIRED;

    public boolean isTerminal() {
        return this == ACKED || this == NACKED || this == EXPIRED;
    }
}
