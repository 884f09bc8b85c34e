package io.clype.reactorpubsub.publisher;

/**
 * What a shutting-down publisher does with batches that are still open.
 */
public enum DrainPolicy {

    /** Close and send every open batch as soon as shutdown starts. */
    FLUSH_IMMEDIATELY,

    /** Leave open batches to close on their own count, size or linger threshold. */
    AWAIT_LINGER
}
