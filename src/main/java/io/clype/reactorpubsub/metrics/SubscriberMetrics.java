package io.clype.reactorpubsub.metrics;

import java.util.function.Supplier;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

/**
 * Collects and exposes metrics for a subscription session.
 *
 * <p><b>Available Metrics:</b></p>
 * <ul>
 *   <li>{@code pubsub.subscriber.messages.received} - Counter of messages admitted from the delivery stream</li>
 *   <li>{@code pubsub.subscriber.messages.acked} - Counter of messages acknowledged</li>
 *   <li>{@code pubsub.subscriber.messages.nacked} - Counter of messages returned for redelivery</li>
 *   <li>{@code pubsub.subscriber.leases.expired} - Counter of leases whose deadline passed unsettled</li>
 *   <li>{@code pubsub.subscriber.leases.extended} - Counter of accepted deadline extensions</li>
 *   <li>{@code pubsub.subscriber.handler.failures} - Counter of handler invocations that threw</li>
 *   <li>{@code pubsub.subscriber.leases.active} - Gauge of unsettled leases</li>
 * </ul>
 *
 * <p>All metrics are tagged with the subscription id.</p>
 */
public class SubscriberMetrics {

    private static final String METRIC_PREFIX = "pubsub.subscriber";

    private final MeterRegistry registry;
    private final Tags tags;
    private final Counter received;
    private final Counter acked;
    private final Counter nacked;
    private final Counter expired;
    private final Counter extended;
    private final Counter handlerFailures;

    /**
     * @param registry       the Micrometer registry to register metrics with
     * @param subscriptionId the subscription id used for tagging
     */
    public SubscriberMetrics(MeterRegistry registry, String subscriptionId) {
        this.registry = registry;
        this.tags = Tags.of("subscription",
                subscriptionId == null || subscriptionId.isEmpty() ? "unknown" : subscriptionId);

        this.received = counter("messages.received", "Number of messages admitted from the delivery stream");
        this.acked = counter("messages.acked", "Number of messages acknowledged");
        this.nacked = counter("messages.nacked", "Number of messages returned for redelivery");
        this.expired = counter("leases.expired", "Number of leases whose deadline passed without settlement");
        this.extended = counter("leases.extended", "Number of accepted ack deadline extensions");
        this.handlerFailures = counter("handler.failures", "Number of handler invocations that threw");
    }

    private Counter counter(String name, String description) {
        return Counter.builder(METRIC_PREFIX + "." + name)
                .description(description)
                .tags(tags)
                .register(registry);
    }

    /**
     * Registers the active-leases gauge. The session calls this once it owns a lease table.
     *
     * @param activeLeases supplies the current number of unsettled leases
     */
    public void bindActiveLeases(Supplier<Number> activeLeases) {
        Gauge.builder(METRIC_PREFIX + ".leases.active", activeLeases)
                .description("Number of received messages not yet settled")
                .tags(tags)
                .register(registry);
    }

    public void recordReceived() {
        received.increment();
    }

    public void recordAcked() {
        acked.increment();
    }

    public void recordNacked() {
        nacked.increment();
    }

    public void recordExpired() {
        expired.increment();
    }

    public void recordExtended() {
        extended.increment();
    }

    public void recordHandlerFailure() {
        handlerFailures.increment();
    }
}
