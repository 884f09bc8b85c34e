package io.clype.reactorpubsub.subscriber;

/**
 * Settles one delivered message. Only the first call to {@link #ack()} or {@link #nack()} has
 * an effect, and neither has one after the message's lease expired.
 *
 * <p>Instances may be kept and used from any thread after the handler returns.</p>
 */
public final class AckHandler {

    private final SubscriptionSession session;
    private final Lease lease;

    AckHandler(SubscriptionSession session, Lease lease) {
        this.session = session;
        this.lease = lease;
    }

    /**
     * Acknowledges the message so that the service does not redeliver it.
     *
     * @return true if this call settled the message
     */
    public boolean ack() {
        return session.settle(lease, LeaseState.ACKED);
    }

    /**
     * Returns the message for redelivery.
     *
     * @return true if this call settled the message
     */
    public boolean nack() {
        return session.settle(lease, LeaseState.NACKED);
    }

    public String ackId() {
        return lease.ackId();
    }

    public int deliveryAttempt() {
        return lease.received().deliveryAttempt();
    }

    public LeaseState state() {
        return lease.state();
    }
}
