package io.clype.reactorpubsub.subscriber;

import java.time.Duration;
import java.util.Objects;

/**
 * Dispatch and lease settings of a subscription session.
 *
 * @param maxConcurrency    handlers that may hold an unsettled message at once
 * @param ackDeadline       deadline requested on each extension; renewal fires at two thirds of it
 * @param maxLeaseExtension how long after receipt a message's lease is still extended
 */
public record SubscriberSettings(
    int maxConcurrency,
    Duration ackDeadline,
    Duration maxLeaseExtension
) {
    public static final Duration DEFAULT_ACK_DEADLINE = Duration.ofSeconds(10);
    public static final Duration DEFAULT_MAX_LEASE_EXTENSION = Duration.ofMinutes(10);

    public SubscriberSettings {
        Objects.requireNonNull(ackDeadline, "ackDeadline cannot be null");
        Objects.requireNonNull(maxLeaseExtension, "maxLeaseExtension cannot be null");
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive, got: " + maxConcurrency);
        }
        if (ackDeadline.isNegative() || ackDeadline.isZero()) {
            throw new IllegalArgumentException("ackDeadline must be positive, got: " + ackDeadline);
        }
        if (maxLeaseExtension.isNegative()) {
            throw new IllegalArgumentException("maxLeaseExtension cannot be negative, got: " + maxLeaseExtension);
        }
    }

    public static SubscriberSettings defaults() {
        return new SubscriberSettings(Runtime.getRuntime().availableProcessors(),
                DEFAULT_ACK_DEADLINE, DEFAULT_MAX_LEASE_EXTENSION);
    }

    /**
     * Delay between a lease's deadline being set and its renewal: two thirds of the deadline.
     *
     * @return the renewal delay, at least one millisecond
     */
    public Duration renewalDelay() {
        return Duration.ofMillis(Math.max(1, ackDeadline.toMillis() * 2 / 3));
    }
}
