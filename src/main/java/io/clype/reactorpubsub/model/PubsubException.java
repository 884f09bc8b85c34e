package io.clype.reactorpubsub.model;

/**
 * Base class for the failures this library resolves onto publish handles or reports to callers.
 */
public class PubsubException extends RuntimeException {

    public PubsubException(String message) {
        super(message);
    }

    public PubsubException(String message, Throwable cause) {
        super(message, cause);
    }
}
