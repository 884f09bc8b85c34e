package io.clype.reactorpubsub.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResourceNameTest {

    @Test
    void testParseTopicName() {
        TopicName topic = TopicName.parse("projects/my-project/topics/orders");

        assertEquals("my-project", topic.project());
        assertEquals("orders", topic.topic());
        assertEquals("projects/my-project/topics/orders", topic.toString());
    }

    @Test
    void testParseSubscriptionName() {
        SubscriptionName subscription = SubscriptionName.parse("projects/my-project/subscriptions/orders-worker");

        assertEquals("my-project", subscription.project());
        assertEquals("orders-worker", subscription.subscription());
        assertEquals("projects/my-project/subscriptions/orders-worker", subscription.fullName());
    }

    @Test
    void testMalformedTopicNameThrows() {
        assertThrows(IllegalArgumentException.class, () -> TopicName.parse("my-project/orders"));
        assertThrows(IllegalArgumentException.class, () -> TopicName.parse("projects/p/subscriptions/orders"));
    }

    @Test
    void testTopicIdMustStartWithLetter() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new TopicName("p", "1orders"));
        assertTrue(ex.getMessage().contains("1orders"));
    }

    @Test
    void testTopicIdTooShortThrows() {
        assertThrows(IllegalArgumentException.class, () -> new TopicName("p", "ab"));
    }

    @Test
    void testSubscriptionIdTooLongThrows() {
        assertThrows(IllegalArgumentException.class, () -> new SubscriptionName("p", "s" + "a".repeat(255)));
    }

    @Test
    void testLaneHaltedMessageTruncatesLongKey() {
        LaneHaltedException ex = new LaneHaltedException("k".repeat(50), new RuntimeException("boom"));

        assertTrue(ex.getMessage().contains("k".repeat(20) + "..."));
        assertEquals("k".repeat(50), ex.getOrderingKey());
    }
}
