package io.clype.reactorpubsub.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class SubscriberMetricsTest {

    private SimpleMeterRegistry registry;
    private SubscriberMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SubscriberMetrics(registry, "orders-worker");
    }

    private double count(String name) {
        return registry.counter(name, "subscription", "orders-worker").count();
    }

    @Test
    void shouldCountSettlementOutcomes() {
        metrics.recordReceived();
        metrics.recordReceived();
        metrics.recordReceived();
        metrics.recordAcked();
        metrics.recordNacked();
        metrics.recordExpired();

        assertEquals(3.0, count("pubsub.subscriber.messages.received"));
        assertEquals(1.0, count("pubsub.subscriber.messages.acked"));
        assertEquals(1.0, count("pubsub.subscriber.messages.nacked"));
        assertEquals(1.0, count("pubsub.subscriber.leases.expired"));
    }

    @Test
    void shouldCountExtensionsAndHandlerFailures() {
        metrics.recordExtended();
        metrics.recordExtended();
        metrics.recordHandlerFailure();

        assertEquals(2.0, count("pubsub.subscriber.leases.extended"));
        assertEquals(1.0, count("pubsub.subscriber.handler.failures"));
    }

    @Test
    void shouldReadActiveLeasesFromSupplier() {
        AtomicInteger active = new AtomicInteger(3);
        metrics.bindActiveLeases(active::get);

        assertEquals(3.0, registry.get("pubsub.subscriber.leases.active").gauge().value());
        active.set(1);
        assertEquals(1.0, registry.get("pubsub.subscriber.leases.active").gauge().value());
    }

    @Test
    void shouldTagUnknownSubscriptionWhenEmpty() {
        new SubscriberMetrics(registry, "").recordAcked();

        assertEquals(1.0, registry.counter("pubsub.subscriber.messages.acked", "subscription", "unknown").count());
    }
}
