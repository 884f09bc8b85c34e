package io.clype.reactorpubsub.publisher;

/**
 * Lifecycle of a published message's outcome.
 */
public enum CompletionState {
    PENDING,
    SUCCEEDED,
    FAILED
}
