package io.clype.reactorpubsub.publisher;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.reactorpubsub.flowcontrol.FlowController;
import io.clype.reactorpubsub.flowcontrol.FlowDirection;
import io.clype.reactorpubsub.flowcontrol.FlowPermit;
import io.clype.reactorpubsub.metrics.PublisherMetrics;
import io.clype.reactorpubsub.model.LaneHaltedException;
import io.clype.reactorpubsub.model.PublishCancelledException;
import io.clype.reactorpubsub.model.PublisherClosedException;
import io.clype.reactorpubsub.model.PubsubMessage;
import io.clype.reactorpubsub.util.LogSanitizer;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Publishes messages that carry an ordering key, one lane per key.
 *
 * <p><b>Ordering Guarantee:</b> within a lane at most one batch is in flight. Messages published
 * while a batch is in flight queue behind it and form the next batch once it resolves, so the
 * transport sees a key's messages in publish order, and a failure is known before any later
 * message on the key is sent.</p>
 *
 * <p><b>Halting:</b> when a lane's batch fails the lane halts. Every message queued on it fails
 * with {@link LaneHaltedException}, and so does every later publish on the key, until
 * {@link #resume(String)} is called.</p>
 *
 * <p>Lanes are created on first use and kept for the publisher's lifetime. They are looked up
 * by key; batches carry no reference back to their lane.</p>
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. Each lane is guarded by its own lock and
 * the transport is never called while a lock is held.</p>
 */
public class OrderingKeySequencer {

    private static final Logger log = LoggerFactory.getLogger(OrderingKeySequencer.class);

    private final Map<String, OrderingLane> lanes = new ConcurrentHashMap<>();
    private final BatchSender sender;
    private final BatchingSettings settings;
    private final FlowController flowController;
    private final CompletionRegistry registry;
    private final Scheduler timerScheduler;
    private final Duration admissionTimeout;
    private final PublisherMetrics metrics;
    private volatile boolean closed;

    OrderingKeySequencer(BatchSender sender, BatchingSettings settings, FlowController flowController,
                         CompletionRegistry registry, Scheduler timerScheduler, Duration admissionTimeout,
                         PublisherMetrics metrics) {
        this.sender = Objects.requireNonNull(sender, "sender cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.flowController = Objects.requireNonNull(flowController, "flowController cannot be null");
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.timerScheduler = Objects.requireNonNull(timerScheduler, "timerScheduler cannot be null");
        this.admissionTimeout = admissionTimeout;
        this.metrics = metrics;
    }

    /**
     * Queues a message on its key's lane.
     *
     * <p>On a halted key the returned handle is already failed with {@link LaneHaltedException}
     * and no flow-control budget is taken.</p>
     *
     * @param message a message with a non-empty ordering key
     * @return the handle resolving to the message id
     * @throws IllegalArgumentException if the message has no ordering key
     */
    public PublishHandle publish(PubsubMessage message) {
        Objects.requireNonNull(message, "message cannot be null");
        if (!message.hasOrderingKey()) {
            throw new IllegalArgumentException("message has no ordering key");
        }
        String key = message.getOrderingKey();
        OrderingLane lane = lanes.computeIfAbsent(key, OrderingLane::new);

        Throwable haltCause = haltCause(lane);
        if (haltCause != null) {
            return rejected(message, key, haltCause);
        }

        FlowPermit permit = flowController.acquireBlocking(
                FlowDirection.PUBLISH, message.sizeInBytes(), 1, admissionTimeout);
        PendingMessage pending = new PendingMessage(message, registry.register(message), permit);

        Batch ready;
        boolean rejectedAsClosed = false;
        synchronized (lane) {
            if (closed) {
                rejectedAsClosed = true;
                ready = null;
            } else if (lane.halted) {
                haltCause = lane.haltCause;
                ready = null;
            } else {
                lane.enqueue(pending);
                pending.handle().cancelWith(() -> cancel(key, pending));
                ready = nextBatchLocked(lane, false);
            }
        }
        if (rejectedAsClosed) {
            sender.failUnsent(pending, new PublisherClosedException(sender.topic()));
            return pending.handle();
        }
        if (haltCause != null) {
            sender.failUnsent(pending, new LaneHaltedException(key, haltCause));
            return pending.handle();
        }
        if (ready != null) {
            send(key, ready);
        }
        return pending.handle();
    }

    /**
     * Clears a halted key so that publishing on it can continue.
     *
     * @param orderingKey the key to resume
     * @return true if the key was halted
     */
    public boolean resume(String orderingKey) {
        OrderingLane lane = lanes.get(orderingKey);
        if (lane == null) {
            return false;
        }
        synchronized (lane) {
            if (!lane.halted) {
                return false;
            }
            lane.halted = false;
            lane.haltCause = null;
        }
        log.info("Resumed publishing on ordering key '{}'", LogSanitizer.sanitize(orderingKey));
        return true;
    }

    public boolean isHalted(String orderingKey) {
        OrderingLane lane = lanes.get(orderingKey);
        return lane != null && haltCause(lane) != null;
    }

    /**
     * Starts a batch on every idle lane with queued messages. Lanes with a batch in flight send
     * their queue as soon as that batch resolves.
     */
    public void flush() {
        for (Map.Entry<String, OrderingLane> entry : lanes.entrySet()) {
            OrderingLane lane = entry.getValue();
            Batch ready;
            synchronized (lane) {
                ready = nextBatchLocked(lane, true);
            }
            if (ready != null) {
                send(entry.getKey(), ready);
            }
        }
    }

    /**
     * Stops accepting messages. A publish that was blocked on flow control when this is called
     * resolves with {@link PublisherClosedException} once admitted; queued messages still go out.
     */
    public void close() {
        closed = true;
    }

    public int laneCount() {
        return lanes.size();
    }

    public int haltedLaneCount() {
        int halted = 0;
        for (OrderingLane lane : lanes.values()) {
            if (haltCause(lane) != null) {
                halted++;
            }
        }
        return halted;
    }

    /**
     * Returns the next batch to send, or null if the lane must wait. Without {@code force}, a
     * batch starts only once the queue reaches a count or byte limit; otherwise the linger
     * timer is armed.
     */
    private Batch nextBatchLocked(OrderingLane lane, boolean force) {
        if (lane.inFlight != null || lane.halted || lane.queue.isEmpty()) {
            return null;
        }
        boolean full = lane.queue.size() >= settings.maxMessages() || lane.queuedBytes >= settings.maxBytes();
        if (!force && !full && !settings.maxLinger().isZero()) {
            if (lane.lingerTimer == null) {
                String key = lane.orderingKey;
                lane.lingerTimer = timerScheduler.schedule(() -> onLingerElapsed(key),
                        settings.maxLinger().toNanos(), TimeUnit.NANOSECONDS);
            }
            return null;
        }
        lane.cancelLingerTimer();
        Batch batch = lane.takeBatch(settings);
        lane.inFlight = batch;
        return batch;
    }

    private void onLingerElapsed(String key) {
        OrderingLane lane = lanes.get(key);
        Batch ready;
        synchronized (lane) {
            lane.lingerTimer = null;
            ready = nextBatchLocked(lane, true);
        }
        if (ready != null) {
            send(key, ready);
        }
    }

    private void send(String key, Batch batch) {
        log.debug("Sending batch of {} messages for ordering key '{}'", batch.size(), LogSanitizer.sanitize(key));
        sender.send(batch)
                .doOnSuccess(ignored -> onBatchResolved(key, batch, null))
                .onErrorResume(e -> {
                    onBatchResolved(key, batch, e);
                    return Mono.empty();
                })
                .subscribe();
    }

    private void onBatchResolved(String key, Batch batch, Throwable failure) {
        OrderingLane lane = lanes.get(key);
        List<PendingMessage> rejected = List.of();
        Batch ready = null;
        synchronized (lane) {
            if (lane.inFlight == batch) {
                lane.inFlight = null;
            }
            if (failure != null) {
                lane.halted = true;
                lane.haltCause = failure;
                lane.cancelLingerTimer();
                rejected = lane.drainQueue();
            } else {
                ready = nextBatchLocked(lane, true);
            }
        }
        if (failure != null) {
            log.warn("Halted ordering key '{}' after failed batch; failing {} queued message(s): {}",
                    LogSanitizer.sanitize(key), rejected.size(), LogSanitizer.sanitize(failure.getMessage()));
            if (metrics != null) {
                metrics.laneHalted();
            }
            LaneHaltedException halted = new LaneHaltedException(key, failure);
            for (PendingMessage pending : rejected) {
                sender.failUnsent(pending, halted);
            }
        }
        if (ready != null) {
            send(key, ready);
        }
    }

    private boolean cancel(String key, PendingMessage pending) {
        OrderingLane lane = lanes.get(key);
        synchronized (lane) {
            if (!lane.removeQueued(pending)) {
                return false;
            }
            if (lane.queue.isEmpty()) {
                lane.cancelLingerTimer();
            }
        }
        sender.failUnsent(pending, new PublishCancelledException());
        return true;
    }

    private PublishHandle rejected(PubsubMessage message, String key, Throwable haltCause) {
        PublishHandle handle = registry.register(message);
        registry.fail(handle, new LaneHaltedException(key, haltCause));
        if (metrics != null) {
            metrics.messagesFailedUnsent(1);
        }
        return handle;
    }

    private static Throwable haltCause(OrderingLane lane) {
        synchronized (lane) {
            return lane.halted ? lane.haltCause : null;
        }
    }
}
