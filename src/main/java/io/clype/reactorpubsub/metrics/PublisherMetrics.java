package io.clype.reactorpubsub.metrics;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer meters for the publisher of one topic, all tagged {@code topic}.
 *
 * <p><b>Batch sends</b> are followed from {@link #batchSendStarted()} to exactly one of
 * {@link #batchSendSucceeded} or {@link #batchSendFailed}:</p>
 * <ul>
 *   <li>{@code pubsub.publisher.requests.active} - gauge of transport calls awaiting an answer</li>
 *   <li>{@code pubsub.publisher.batches.completed} / {@code batches.failed} - counters per outcome</li>
 *   <li>{@code pubsub.publisher.publish.latency} - timer from call to accepted ids (p50, p95, p99)</li>
 *   <li>{@code pubsub.publisher.batch.size} - summary of messages per transport call</li>
 * </ul>
 *
 * <p><b>Publish handles</b> are counted by how they resolved:</p>
 * <ul>
 *   <li>{@code pubsub.publisher.messages.published} - resolved with a message id</li>
 *   <li>{@code pubsub.publisher.messages.failed} - resolved with an error, whether their batch was
 *       sent or they never left the publisher (cancelled, halted key, publisher closed)</li>
 *   <li>{@code pubsub.publisher.lanes.halted} - ordering keys stopped by a failed batch</li>
 * </ul>
 */
public class PublisherMetrics {

    private static final String METRIC_PREFIX = "pubsub.publisher.";
    private static final double[] LATENCY_PERCENTILES = {0.5, 0.95, 0.99};

    private final MeterRegistry registry;
    private final Tags tags;
    private final Counter batchesCompleted;
    private final Counter batchesFailed;
    private final Counter messagesPublished;
    private final Counter messagesFailed;
    private final Counter lanesHalted;
    private final Timer sendLatency;
    private final DistributionSummary batchSize;
    private final AtomicInteger sendsInFlight = new AtomicInteger();

    /**
     * @param registry the Micrometer registry to register metrics with
     * @param topicId  the topic id used for tagging; {@code unknown} when null or empty
     */
    public PublisherMetrics(MeterRegistry registry, String topicId) {
        this.registry = registry;
        this.tags = Tags.of("topic", topicId == null || topicId.isEmpty() ? "unknown" : topicId);

        this.batchesCompleted = counter("batches.completed", "Transport calls answered with one id per message");
        this.batchesFailed = counter("batches.failed", "Transport calls that failed or returned the wrong id count");
        this.messagesPublished = counter("messages.published", "Publish handles resolved with a message id");
        this.messagesFailed = counter("messages.failed", "Publish handles resolved with an error");
        this.lanesHalted = counter("lanes.halted", "Ordering keys halted by a failed batch");

        this.sendLatency = Timer.builder(METRIC_PREFIX + "publish.latency")
                .description("Time from handing a batch to the transport until its ids arrive")
                .tags(tags)
                .publishPercentiles(LATENCY_PERCENTILES)
                .register(registry);
        this.batchSize = DistributionSummary.builder(METRIC_PREFIX + "batch.size")
                .description("Messages per transport call")
                .tags(tags)
                .register(registry);
        Gauge.builder(METRIC_PREFIX + "requests.active", sendsInFlight, AtomicInteger::get)
                .description("Transport calls awaiting an answer")
                .tags(tags)
                .register(registry);
    }

    private Counter counter(String name, String description) {
        return Counter.builder(METRIC_PREFIX + name)
                .description(description)
                .tags(tags)
                .register(registry);
    }

    /**
     * Marks a batch as handed to the transport.
     *
     * @return the start time to pass back with the outcome
     */
    public long batchSendStarted() {
        sendsInFlight.incrementAndGet();
        return System.nanoTime();
    }

    public void batchSendSucceeded(long startedAtNanos, int messageCount) {
        sendsInFlight.decrementAndGet();
        batchesCompleted.increment();
        messagesPublished.increment(messageCount);
        batchSize.record(messageCount);
        sendLatency.record(System.nanoTime() - startedAtNanos, TimeUnit.NANOSECONDS);
    }

    public void batchSendFailed(long startedAtNanos, int messageCount) {
        sendsInFlight.decrementAndGet();
        batchesFailed.increment();
        messagesFailed.increment(messageCount);
        batchSize.record(messageCount);
    }

    /** Counts handles failed before their message reached the transport. */
    public void messagesFailedUnsent(int messageCount) {
        messagesFailed.increment(messageCount);
    }

    public void laneHalted() {
        lanesHalted.increment();
    }

    public int sendsInFlight() {
        return sendsInFlight.get();
    }
}
