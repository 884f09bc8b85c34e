package io.clype.reactorpubsub.model;

/**
 * Thrown for messages on an ordering key whose lane has halted after a failed batch.
 *
 * <p>Publishing on the key keeps failing with this exception until the lane is resumed. The
 * cause is the failure that halted the lane.</p>
 */
public class LaneHaltedException extends PubsubException {

    private static final int MAX_KEY_LENGTH_IN_MESSAGE = 20;

    private final String orderingKey;

    public LaneHaltedException(String orderingKey, Throwable cause) {
        super(String.format(
                "Publishing on ordering key '%s' is halted after a failed batch; resume the key to continue",
                truncateForMessage(orderingKey)), cause);
        this.orderingKey = orderingKey;
    }

    private static String truncateForMessage(String key) {
        if (key == null) {
            return "null";
        }
        if (key.length() <= MAX_KEY_LENGTH_IN_MESSAGE) {
            return key;
        }
        return key.substring(0, MAX_KEY_LENGTH_IN_MESSAGE) + "...";
    }

    public String getOrderingKey() {
        return orderingKey;
    }
}
