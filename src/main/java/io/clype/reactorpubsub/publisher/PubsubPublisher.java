package io.clype.reactorpubsub.publisher;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import io.clype.reactorpubsub.flowcontrol.FlowController;
import io.clype.reactorpubsub.flowcontrol.FlowDirection;
import io.clype.reactorpubsub.metrics.PublisherMetrics;
import io.clype.reactorpubsub.model.PublisherClosedException;
import io.clype.reactorpubsub.model.PublisherStatus;
import io.clype.reactorpubsub.model.PubsubMessage;
import io.clype.reactorpubsub.model.TopicName;
import io.clype.reactorpubsub.transport.PublisherTransport;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Asynchronous, batching publisher for one topic.
 *
 * <p>This publisher provides the following guarantees and features:</p>
 * <ul>
 *   <li><b>Batching:</b> Messages are grouped into batches bounded by message count, bytes and
 *       linger time before being handed to the transport.</li>
 *   <li><b>Ordering:</b> Messages with the same ordering key reach the transport in the order
 *       they were published. Messages without a key are not ordered.</li>
 *   <li><b>Backpressure:</b> Publish flow control bounds outstanding messages and bytes;
 *       {@link #publish} blocks while the budget is exhausted.</li>
 *   <li><b>At-most-one attempt:</b> A failed batch fails all its messages. Retrying is the
 *       transport's business.</li>
 * </ul>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * PubsubPublisher publisher = new PubsubPublisher(
 *     TopicName.parse("projects/my-project/topics/orders"),
 *     transport,
 *     BatchingSettings.defaults(),
 *     new FlowController(FlowControlSettings.of(10 * 1024 * 1024, 1000), FlowControlSettings.disabled()));
 *
 * publisher.publish(PubsubMessage.builder().data("{\"action\":\"created\"}").orderingKey("order-123").build())
 *     .result()
 *     .subscribe(
 *         id -> log.info("Published {}", id),
 *         error -> log.error("Failed to publish", error));
 * }</pre>
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. Multiple threads can call
 * {@link #publish(PubsubMessage)} concurrently.</p>
 *
 * <p><b>Resource Management:</b> This class implements {@link DisposableBean}; when the Spring
 * context is destroyed it drains according to its {@link DrainPolicy} and disposes the timer
 * scheduler it created.</p>
 *
 * @see PubsubMessage
 * @see io.clype.reactorpubsub.config.PubsubPublisherAutoConfiguration
 */
public class PubsubPublisher implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(PubsubPublisher.class);

    /** How long {@link #destroy()} waits for pending messages to resolve. */
    private static final Duration DESTROY_DRAIN_TIMEOUT = Duration.ofSeconds(30);

    private final TopicName topic;
    private final FlowController flowController;
    private final CompletionRegistry registry;
    private final BatchingPublisher batchingPublisher;
    private final OrderingKeySequencer sequencer;
    private final DrainPolicy drainPolicy;
    private final Scheduler timerScheduler;
    private final boolean ownsTimerScheduler;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    /**
     * Creates a publisher with its own timer scheduler, no metrics, no admission timeout and
     * {@link DrainPolicy#FLUSH_IMMEDIATELY}.
     *
     * @param topic          the destination topic
     * @param transport      sends closed batches
     * @param batching       batch limits
     * @param flowController budget shared with whatever else the caller passes it to
     */
    public PubsubPublisher(TopicName topic, PublisherTransport transport, BatchingSettings batching,
                           FlowController flowController) {
        this(topic, transport, batching, flowController, null, null, DrainPolicy.FLUSH_IMMEDIATELY, null);
    }

    /**
     * Creates a publisher with full configuration options.
     *
     * @param topic            the destination topic
     * @param transport        sends closed batches
     * @param batching         batch limits
     * @param flowController   budget shared with whatever else the caller passes it to
     * @param timerScheduler   runs linger timers; null to create (and own) a single-threaded one
     * @param metrics          optional metrics collector (may be null)
     * @param drainPolicy      what shutdown does with open batches
     * @param admissionTimeout how long {@link #publish} may block on flow control; null to wait
     *                         indefinitely
     * @throws NullPointerException if topic, transport, batching, flowController or drainPolicy is null
     */
    public PubsubPublisher(TopicName topic, PublisherTransport transport, BatchingSettings batching,
                           FlowController flowController, Scheduler timerScheduler,
                           PublisherMetrics metrics, DrainPolicy drainPolicy, Duration admissionTimeout) {
        this.topic = Objects.requireNonNull(topic, "topic cannot be null");
        Objects.requireNonNull(transport, "transport cannot be null");
        Objects.requireNonNull(batching, "batching cannot be null");
        this.flowController = Objects.requireNonNull(flowController, "flowController cannot be null");
        this.drainPolicy = Objects.requireNonNull(drainPolicy, "drainPolicy cannot be null");
        if (admissionTimeout != null && (admissionTimeout.isNegative() || admissionTimeout.isZero())) {
            throw new IllegalArgumentException("admissionTimeout must be positive");
        }

        this.ownsTimerScheduler = timerScheduler == null;
        this.timerScheduler = ownsTimerScheduler ? Schedulers.newSingle("pubsub-publisher-timer") : timerScheduler;
        this.registry = new CompletionRegistry();

        BatchSender sender = new BatchSender(topic, transport, registry, flowController, metrics);
        this.batchingPublisher = new BatchingPublisher(sender, batching, flowController, registry,
                this.timerScheduler, admissionTimeout);
        this.sequencer = new OrderingKeySequencer(sender, batching, flowController, registry,
                this.timerScheduler, admissionTimeout, metrics);
    }

    // ==========================================================================
    // Public API
    // ==========================================================================

    /**
     * Publishes one message.
     *
     * <p>Messages with an ordering key go through that key's lane; others go to the shared
     * batch. Returns as soon as the message is enqueued. A call still blocked on flow control
     * when {@link #shutdown()} starts returns a handle failed with
     * {@link PublisherClosedException}.</p>
     *
     * @param message the message to publish
     * @return the handle resolving to the service-assigned message id
     * @throws PublisherClosedException if {@link #shutdown()} has been called
     * @throws io.clype.reactorpubsub.model.AdmissionTimeoutException if flow control did not
     *         admit the message within the configured admission timeout
     */
    public PublishHandle publish(PubsubMessage message) {
        Objects.requireNonNull(message, "message cannot be null");
        if (shutdown.get()) {
            throw new PublisherClosedException(topic);
        }
        return message.hasOrderingKey() ? sequencer.publish(message) : batchingPublisher.publish(message);
    }

    /**
     * Publishes a stream of messages and emits their ids in publish order.
     *
     * <p>Publishing runs on the bounded-elastic scheduler because flow control may block. The
     * returned Flux fails with the first message failure in publish order.</p>
     *
     * @param messages the messages to publish
     * @return a Flux of message ids
     */
    public Flux<String> publishAll(Flux<PubsubMessage> messages) {
        Objects.requireNonNull(messages, "messages cannot be null");
        return messages
                .publishOn(Schedulers.boundedElastic())
                .map(this::publish)
                .flatMapSequential(PublishHandle::result);
    }

    /**
     * Clears a halted ordering key so that publishing on it can continue.
     *
     * @param orderingKey the key to resume
     * @return true if the key was halted
     */
    public boolean resumePublish(String orderingKey) {
        Objects.requireNonNull(orderingKey, "orderingKey cannot be null");
        return sequencer.resume(orderingKey);
    }

    /**
     * Sends every open batch now instead of waiting for its limits.
     */
    public void flush() {
        batchingPublisher.flush();
        sequencer.flush();
    }

    /**
     * Stops accepting messages and drains.
     *
     * <p>With {@link DrainPolicy#FLUSH_IMMEDIATELY} open batches are sent right away; with
     * {@link DrainPolicy#AWAIT_LINGER} they close on their own limits.</p>
     *
     * @return a Mono completing when every message published before shutdown has resolved
     */
    public Mono<Void> shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            log.info("Shutting down publisher for {} ({} pending, drain policy {})",
                    topic, registry.pendingCount(), drainPolicy);
            batchingPublisher.close();
            sequencer.close();
            if (drainPolicy == DrainPolicy.FLUSH_IMMEDIATELY) {
                flush();
            }
        }
        return registry.whenAllResolved();
    }

    public PublisherStatus status() {
        return new PublisherStatus(
                registry.pendingCount(),
                flowController.outstandingBytes(FlowDirection.PUBLISH),
                flowController.outstandingMessages(FlowDirection.PUBLISH),
                sequencer.laneCount(),
                sequencer.haltedLaneCount());
    }

    public TopicName topic() {
        return topic;
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    // ==========================================================================
    // Lifecycle
    // ==========================================================================

    /**
     * Drains pending messages, then disposes the timer scheduler if this publisher created it.
     * Called automatically by Spring's lifecycle management.
     */
    @Override
    public void destroy() {
        try {
            shutdown().block(DESTROY_DRAIN_TIMEOUT);
        } catch (IllegalStateException e) {
            log.warn("Publisher for {} did not drain within {}s; {} message(s) still pending",
                    topic, DESTROY_DRAIN_TIMEOUT.toSeconds(), registry.pendingCount());
        } finally {
            if (ownsTimerScheduler) {
                timerScheduler.dispose();
            }
        }
    }
}
