package io.clype.reactorpubsub.publisher;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits that close a batch: whichever is reached first.
 *
 * @param maxMessages messages per batch
 * @param maxBytes    accumulated message bytes per batch
 * @param maxLinger   time a non-empty batch may wait for more messages; zero sends every
 *                    message on its own
 */
public record BatchingSettings(
    int maxMessages,
    long maxBytes,
    Duration maxLinger
) {
    public static final int DEFAULT_MAX_MESSAGES = 100;
    public static final long DEFAULT_MAX_BYTES = 1024 * 1024;
    public static final Duration DEFAULT_MAX_LINGER = Duration.ofMillis(10);

    public BatchingSettings {
        Objects.requireNonNull(maxLinger, "maxLinger cannot be null");
        if (maxMessages <= 0) {
            throw new IllegalArgumentException("maxMessages must be positive, got: " + maxMessages);
        }
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive, got: " + maxBytes);
        }
        if (maxLinger.isNegative()) {
            throw new IllegalArgumentException("maxLinger cannot be negative, got: " + maxLinger);
        }
    }

    public static BatchingSettings defaults() {
        return new BatchingSettings(DEFAULT_MAX_MESSAGES, DEFAULT_MAX_BYTES, DEFAULT_MAX_LINGER);
    }
}
