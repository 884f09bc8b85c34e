package io.clype.reactorpubsub.subscriber;

/**
 * Status information about a subscription session.
 *
 * @param state               lifecycle state
 * @param activeLeases        received messages not yet settled or expired
 * @param outstandingBytes    bytes reserved in delivery flow control
 * @param outstandingMessages messages reserved in delivery flow control
 */
public record SessionStatus(
    SessionState state,
    int activeLeases,
    long outstandingBytes,
    long outstandingMessages
) {}
