package io.clype.reactorpubsub.publisher;

import java.time.Duration;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.reactorpubsub.flowcontrol.FlowController;
import io.clype.reactorpubsub.flowcontrol.FlowDirection;
import io.clype.reactorpubsub.flowcontrol.FlowPermit;
import io.clype.reactorpubsub.model.PublishCancelledException;
import io.clype.reactorpubsub.model.PublisherClosedException;
import io.clype.reactorpubsub.model.PubsubMessage;

import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

/**
 * Accumulates messages for one topic into batches and sends them without waiting for each
 * other.
 *
 * <p>A batch closes when the first of these happens:</p>
 * <ul>
 *   <li>it holds {@link BatchingSettings#maxMessages()} messages,</li>
 *   <li>its messages add up to {@link BatchingSettings#maxBytes()} bytes (a message that would
 *       overflow the open batch closes it first and starts the next one),</li>
 *   <li>{@link BatchingSettings#maxLinger()} has elapsed since it received its first message.</li>
 * </ul>
 *
 * <p>Closed batches are handed to the transport in the order they closed. Several batches may
 * be in flight at once; there is no ordering between their outcomes.</p>
 *
 * <p><b>Backpressure:</b> {@link #publish} reserves publish-direction flow-control budget
 * before enqueueing and blocks the calling thread while the budget is exhausted.</p>
 *
 * <p><b>Thread Safety:</b> This class is thread-safe.</p>
 */
public class BatchingPublisher {

    private static final Logger log = LoggerFactory.getLogger(BatchingPublisher.class);

    private final BatchSender sender;
    private final BatchingSettings settings;
    private final FlowController flowController;
    private final CompletionRegistry registry;
    private final Scheduler timerScheduler;
    private final Duration admissionTimeout;

    private final Object lock = new Object();
    private Batch openBatch = new Batch();
    private Disposable lingerTimer;
    private boolean closed;

    private final Queue<Batch> closedBatches = new ConcurrentLinkedQueue<>();
    private final AtomicInteger drainWip = new AtomicInteger();

    BatchingPublisher(BatchSender sender, BatchingSettings settings, FlowController flowController,
                      CompletionRegistry registry, Scheduler timerScheduler, Duration admissionTimeout) {
        this.sender = Objects.requireNonNull(sender, "sender cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.flowController = Objects.requireNonNull(flowController, "flowController cannot be null");
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.timerScheduler = Objects.requireNonNull(timerScheduler, "timerScheduler cannot be null");
        this.admissionTimeout = admissionTimeout;
    }

    /**
     * Enqueues a message into the open batch.
     *
     * <p>Returns once the message is enqueued, without waiting for the service. Blocks while
     * publish flow control is saturated.</p>
     *
     * @param message the message to publish
     * @return the handle resolving to the message id
     * @throws io.clype.reactorpubsub.model.AdmissionTimeoutException if an admission timeout is
     *         configured and elapsed first
     */
    public PublishHandle publish(PubsubMessage message) {
        Objects.requireNonNull(message, "message cannot be null");
        FlowPermit permit = flowController.acquireBlocking(
                FlowDirection.PUBLISH, message.sizeInBytes(), 1, admissionTimeout);
        PendingMessage pending = new PendingMessage(message, registry.register(message), permit);

        boolean rejected;
        synchronized (lock) {
            // Admission may have blocked across close().
            rejected = closed;
            if (!rejected) {
                if (!openBatch.isEmpty() && openBatch.bytes() + pending.sizeInBytes() > settings.maxBytes()) {
                    closeOpenBatchLocked();
                }
                openBatch.add(pending);
                pending.handle().cancelWith(() -> cancel(pending));
                if (openBatch.size() >= settings.maxMessages() || openBatch.bytes() >= settings.maxBytes()
                        || settings.maxLinger().isZero()) {
                    closeOpenBatchLocked();
                } else if (openBatch.size() == 1) {
                    startLingerTimerLocked(openBatch);
                }
            }
        }
        if (rejected) {
            sender.failUnsent(pending, new PublisherClosedException(sender.topic()));
            return pending.handle();
        }
        drainClosedBatches();
        return pending.handle();
    }

    /**
     * Stops accepting messages. Publishes still waiting for flow control when this is called
     * resolve with {@link PublisherClosedException} once admitted.
     */
    public void close() {
        synchronized (lock) {
            closed = true;
        }
    }

    /**
     * Closes the open batch now, if it holds anything.
     */
    public void flush() {
        synchronized (lock) {
            closeOpenBatchLocked();
        }
        drainClosedBatches();
    }

    /**
     * Returns the number of messages in the open batch.
     *
     * @return open batch size
     */
    public int openBatchSize() {
        synchronized (lock) {
            return openBatch.size();
        }
    }

    private boolean cancel(PendingMessage pending) {
        synchronized (lock) {
            if (!openBatch.remove(pending)) {
                return false;
            }
            if (openBatch.isEmpty()) {
                cancelLingerTimerLocked();
            }
        }
        sender.failUnsent(pending, new PublishCancelledException());
        log.debug("Cancelled message before its batch closed");
        return true;
    }

    private void startLingerTimerLocked(Batch batch) {
        cancelLingerTimerLocked();
        lingerTimer = timerScheduler.schedule(() -> onLingerElapsed(batch),
                settings.maxLinger().toNanos(), TimeUnit.NANOSECONDS);
    }

    private void onLingerElapsed(Batch batch) {
        synchronized (lock) {
            if (openBatch != batch) {
                return;
            }
            lingerTimer = null;
            closeOpenBatchLocked();
        }
        drainClosedBatches();
    }

    private void cancelLingerTimerLocked() {
        if (lingerTimer != null) {
            lingerTimer.dispose();
            lingerTimer = null;
        }
    }

    private void closeOpenBatchLocked() {
        cancelLingerTimerLocked();
        if (openBatch.isEmpty()) {
            return;
        }
        openBatch.close();
        closedBatches.offer(openBatch);
        openBatch = new Batch();
    }

    /**
     * Sends closed batches in close order. Runs outside {@link #lock}; only one thread drains at
     * a time and the others leave their batches to it.
     */
    private void drainClosedBatches() {
        if (drainWip.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        do {
            Batch batch;
            while ((batch = closedBatches.poll()) != null) {
                sender.send(batch).subscribe(
                        null,
                        e -> log.debug("Batch resolved with failure: {}", e.getClass().getSimpleName()));
            }
            missed = drainWip.addAndGet(-missed);
        } while (missed != 0);
    }
}
