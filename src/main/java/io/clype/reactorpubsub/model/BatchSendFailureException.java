package io.clype.reactorpubsub.model;

/**
 * Thrown when the transport reports that a batch could not be sent.
 *
 * <p>Every message in the batch is failed with the same exception. The engine does not retry;
 * retry policy belongs to the transport.</p>
 */
public class BatchSendFailureException extends PubsubException {

    private final TopicName topic;
    private final int batchSize;

    public BatchSendFailureException(TopicName topic, int batchSize, Throwable cause) {
        super("Failed to send batch of " + batchSize + " messages to " + topic
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.topic = topic;
        this.batchSize = batchSize;
    }

    public BatchSendFailureException(TopicName topic, int batchSize, String reason) {
        super("Failed to send batch of " + batchSize + " messages to " + topic + ": " + reason);
        this.topic = topic;
        this.batchSize = batchSize;
    }

    public TopicName getTopic() {
        return topic;
    }

    /**
     * Returns the number of messages in the failed batch.
     *
     * @return batch size
     */
    public int getBatchSize() {
        return batchSize;
    }
}
