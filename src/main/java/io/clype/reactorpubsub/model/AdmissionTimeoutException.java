package io.clype.reactorpubsub.model;

import java.time.Duration;

/**
 * Thrown when flow-control admission does not succeed within a caller-imposed timeout.
 *
 * <p>Recoverable: nothing was reserved, the caller may retry or back off.</p>
 */
public class AdmissionTimeoutException extends PubsubException {

    private final long bytes;
    private final long messages;
    private final Duration timeout;

    public AdmissionTimeoutException(String direction, long bytes, long messages, Duration timeout) {
        super("Timed out after " + timeout.toMillis() + "ms waiting for " + direction
                + " flow control to admit " + messages + " message(s) / " + bytes + " bytes");
        this.bytes = bytes;
        this.messages = messages;
        this.timeout = timeout;
    }

    public long getBytes() {
        return bytes;
    }

    public long getMessages() {
        return messages;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
