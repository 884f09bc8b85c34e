package io.clype.reactorpubsub.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A message published to, or received from, a topic.
 *
 * <p>Instances are immutable: the payload is copied on the way in and on the way out, and the
 * attribute map is an unmodifiable copy. The message id is assigned by the service and is absent
 * until the service has acknowledged the message.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * PubsubMessage message = PubsubMessage.builder()
 *     .data("{\"status\": \"shipped\"}")
 *     .attribute("source", "orders")
 *     .orderingKey("order-123")      // optional; messages with the same key keep their order
 *     .build();
 * }</pre>
 */
public final class PubsubMessage {

    private final byte[] data;
    private final Map<String, String> attributes;
    private final String orderingKey;
    private final String messageId;

    private PubsubMessage(byte[] data, Map<String, String> attributes, String orderingKey, String messageId) {
        this.data = data;
        this.attributes = attributes;
        this.orderingKey = orderingKey;
        this.messageId = messageId;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy of the payload.
     *
     * @return the payload bytes
     */
    public byte[] getData() {
        return data.clone();
    }

    public String getDataAsUtf8() {
        return new String(data, StandardCharsets.UTF_8);
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    /**
     * Returns the ordering key, or an empty string when the message is unordered.
     *
     * @return the ordering key, never null
     */
    public String getOrderingKey() {
        return orderingKey;
    }

    public boolean hasOrderingKey() {
        return !orderingKey.isEmpty();
    }

    public Optional<String> getMessageId() {
        return Optional.ofNullable(messageId);
    }

    /**
     * Returns a copy of this message carrying the given service-assigned id.
     *
     * @param messageId the id assigned by the service
     * @return the new message
     */
    public PubsubMessage withMessageId(String messageId) {
        Objects.requireNonNull(messageId, "messageId cannot be null");
        return new PubsubMessage(data, attributes, orderingKey, messageId);
    }

    /**
     * Size of the message as counted by batching and flow control: payload bytes plus the UTF-8
     * length of every attribute key and value and of the ordering key.
     *
     * @return the size in bytes
     */
    public long sizeInBytes() {
        long size = data.length;
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            size += utf8Length(entry.getKey()) + utf8Length(entry.getValue());
        }
        return size + utf8Length(orderingKey);
    }

    private static int utf8Length(String str) {
        int len = str.length();
        int size = 0;
        for (int i = 0; i < len; i++) {
            char c = str.charAt(i);
            if (c < 0x80) {
                size += 1;
            } else if (c < 0x800) {
                size += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < len && Character.isLowSurrogate(str.charAt(i + 1))) {
                size += 4;
                i++;
            } else {
                size += 3;
            }
        }
        return size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PubsubMessage other)) {
            return false;
        }
        return Arrays.equals(data, other.data)
                && attributes.equals(other.attributes)
                && orderingKey.equals(other.orderingKey)
                && Objects.equals(messageId, other.messageId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(data), attributes, orderingKey, messageId);
    }

    @Override
    public String toString() {
        return "PubsubMessage{dataSize=" + data.length
                + ", attributes=" + attributes.keySet()
                + ", orderingKey='" + orderingKey + '\''
                + ", messageId=" + messageId + '}';
    }

    /** Builder for {@link PubsubMessage}. */
    public static final class Builder {
        private byte[] data = new byte[0];
        private final Map<String, String> attributes = new HashMap<>();
        private String orderingKey = "";
        private String messageId;

        private Builder() {
        }

        public Builder data(byte[] data) {
            this.data = Objects.requireNonNull(data, "data cannot be null").clone();
            return this;
        }

        public Builder data(String utf8) {
            this.data = Objects.requireNonNull(utf8, "data cannot be null").getBytes(StandardCharsets.UTF_8);
            return this;
        }

        /**
         * Adds an attribute; a later call with the same key replaces the earlier value.
         */
        public Builder attribute(String key, String value) {
            Objects.requireNonNull(key, "attribute key cannot be null");
            Objects.requireNonNull(value, "attribute value cannot be null");
            if (key.isEmpty()) {
                throw new IllegalArgumentException("attribute key cannot be empty");
            }
            attributes.put(key, value);
            return this;
        }

        public Builder attributes(Map<String, String> attributes) {
            Objects.requireNonNull(attributes, "attributes cannot be null");
            attributes.forEach(this::attribute);
            return this;
        }

        public Builder orderingKey(String orderingKey) {
            this.orderingKey = orderingKey == null ? "" : orderingKey;
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public PubsubMessage build() {
            return new PubsubMessage(data, Map.copyOf(attributes), orderingKey, messageId);
        }
    }
}
