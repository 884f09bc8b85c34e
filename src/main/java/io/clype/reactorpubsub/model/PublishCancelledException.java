package io.clype.reactorpubsub.model;

/**
 * Resolves a publish handle that was cancelled before its batch closed.
 */
public class PublishCancelledException extends PubsubException {

    public PublishCancelledException() {
        super("Publish was cancelled before its batch was sent");
    }
}
