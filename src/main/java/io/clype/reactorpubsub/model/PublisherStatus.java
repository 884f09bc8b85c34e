package io.clype.reactorpubsub.model;

/**
 * Status information about a publisher.
 *
 * <p>This record provides introspection into the publisher's current state,
 * useful for monitoring and health checks.</p>
 *
 * @param pendingMessages     messages whose publish handle has not resolved yet
 * @param outstandingBytes    bytes currently reserved in publish flow control
 * @param outstandingMessages messages currently reserved in publish flow control
 * @param orderingLanes       number of ordering keys seen so far
 * @param haltedLanes         number of ordering keys currently halted
 */
public record PublisherStatus(
    int pendingMessages,
    long outstandingBytes,
    long outstandingMessages,
    int orderingLanes,
    int haltedLanes
) {}
