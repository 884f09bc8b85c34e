package io.clype.reactorpubsub.subscriber;

/**
 * Lifecycle of a {@link SubscriptionSession}: {@code IDLE -> RUNNING -> DRAINING -> STOPPED}.
 */
public enum SessionState {
    IDLE,
    RUNNING,
    /** No new messages are pulled; existing leases are still renewed and may be settled. */
    DRAINING,
    STOPPED
}
