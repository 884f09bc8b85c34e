package io.clype.reactorpubsub.flowcontrol;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.reactorpubsub.model.AdmissionTimeoutException;

import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

/**
 * Watermark-based admission control bounding outstanding bytes and messages.
 *
 * <p>Keeps two independent budgets, one per {@link FlowDirection}. Each budget enforces:</p>
 * <ul>
 *   <li><b>High watermark:</b> a request that would push outstanding bytes or messages above
 *       the configured maximum waits, and the budget becomes <i>saturated</i>.</li>
 *   <li><b>Low watermark:</b> a saturated budget admits nothing until releases bring outstanding
 *       work down to the resume thresholds.</li>
 *   <li><b>FIFO fairness:</b> waiters are admitted in arrival order; a new request never
 *       overtakes a queued one.</li>
 *   <li><b>Oversized items:</b> a request larger than the high watermark is admitted alone once
 *       nothing else is outstanding, and counts until released.</li>
 * </ul>
 *
 * <p>Waiting never blocks a thread: {@link #acquire} returns a {@link Mono} that completes when
 * the request is admitted. Cancelling the subscription withdraws the request.</p>
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. Each direction mutates its counters and
 * waiter queue under its own lock; subscribers are signalled after the lock is released.</p>
 *
 * <p>Instances are owned by the components they are passed to, so independent publishers and
 * sessions in one process do not share budgets unless given the same controller.</p>
 */
public class FlowController {

    private static final Logger log = LoggerFactory.getLogger(FlowController.class);

    private final Map<FlowDirection, Budget> budgets = new EnumMap<>(FlowDirection.class);

    /**
     * Creates a controller with independent publish and delivery limits.
     *
     * @param publish  limits for outgoing publishes
     * @param delivery limits for incoming deliveries
     */
    public FlowController(FlowControlSettings publish, FlowControlSettings delivery) {
        budgets.put(FlowDirection.PUBLISH,
                new Budget(FlowDirection.PUBLISH, Objects.requireNonNull(publish, "publish cannot be null")));
        budgets.put(FlowDirection.DELIVERY,
                new Budget(FlowDirection.DELIVERY, Objects.requireNonNull(delivery, "delivery cannot be null")));
    }

    /**
     * Creates a controller that admits everything immediately in both directions.
     *
     * @return a pass-through controller
     */
    public static FlowController disabled() {
        return new FlowController(FlowControlSettings.disabled(), FlowControlSettings.disabled());
    }

    /**
     * Requests admission for {@code messages} messages totalling {@code bytes} bytes.
     *
     * @param direction the budget to draw from
     * @param bytes     bytes to reserve
     * @param messages  messages to reserve
     * @return a Mono emitting the permit once admitted; cancel it to withdraw the request
     */
    public Mono<FlowPermit> acquire(FlowDirection direction, long bytes, long messages) {
        Objects.requireNonNull(direction, "direction cannot be null");
        if (bytes < 0 || messages < 0) {
            throw new IllegalArgumentException("bytes and messages cannot be negative");
        }
        Budget budget = budgets.get(direction);
        return Mono.create(sink -> budget.enqueue(new FlowPermit(this, direction, bytes, messages), sink));
    }

    /**
     * Same as {@link #acquire(FlowDirection, long, long)}, failing with
     * {@link AdmissionTimeoutException} if not admitted within {@code timeout}.
     *
     * @param direction the budget to draw from
     * @param bytes     bytes to reserve
     * @param messages  messages to reserve
     * @param timeout   how long to wait for admission
     * @return a Mono emitting the permit once admitted
     */
    public Mono<FlowPermit> acquire(FlowDirection direction, long bytes, long messages, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        return acquire(direction, bytes, messages)
                .timeout(timeout)
                .onErrorMap(TimeoutException.class,
                        e -> new AdmissionTimeoutException(direction.label(), bytes, messages, timeout));
    }

    /**
     * Blocks the calling thread until admitted.
     *
     * @param direction the budget to draw from
     * @param bytes     bytes to reserve
     * @param messages  messages to reserve
     * @param timeout   how long to wait, or null to wait indefinitely
     * @return the permit
     * @throws AdmissionTimeoutException if the timeout elapsed first
     */
    public FlowPermit acquireBlocking(FlowDirection direction, long bytes, long messages, Duration timeout) {
        Mono<FlowPermit> admission = timeout == null
                ? acquire(direction, bytes, messages)
                : acquire(direction, bytes, messages, timeout);
        return admission.block();
    }

    /**
     * Returns a permit's reservation to its budget and admits waiters that now fit.
     *
     * @param permit the permit to release
     * @return true if the permit was released by this call, false if it had already been released
     * @throws IllegalArgumentException if the permit was issued by another controller
     */
    public boolean release(FlowPermit permit) {
        Objects.requireNonNull(permit, "permit cannot be null");
        if (permit.owner() != this) {
            throw new IllegalArgumentException("permit was not issued by this flow controller");
        }
        if (!permit.markReleased()) {
            log.debug("Ignoring duplicate release of {}", permit);
            return false;
        }
        budgets.get(permit.direction()).release(permit);
        return true;
    }

    public long outstandingBytes(FlowDirection direction) {
        return budgets.get(direction).outstandingBytes();
    }

    public long outstandingMessages(FlowDirection direction) {
        return budgets.get(direction).outstandingMessages();
    }

    /**
     * Returns the number of requests waiting for admission.
     *
     * @param direction the budget to inspect
     * @return queued request count
     */
    public int waiterCount(FlowDirection direction) {
        return budgets.get(direction).waiterCount();
    }

    public FlowControlSettings settings(FlowDirection direction) {
        return budgets.get(direction).settings;
    }

    private static final class Waiter {
        final FlowPermit permit;
        final MonoSink<FlowPermit> sink;
        boolean admitted;

        Waiter(FlowPermit permit, MonoSink<FlowPermit> sink) {
            this.permit = permit;
            this.sink = sink;
        }
    }

    /**
     * Counters and waiters for one direction. All fields are guarded by {@code this}.
     */
    private final class Budget {

        private final FlowDirection direction;
        private final FlowControlSettings settings;
        private final ArrayDeque<Waiter> waiters = new ArrayDeque<>();
        private long bytes;
        private long messages;
        private boolean saturated;

        Budget(FlowDirection direction, FlowControlSettings settings) {
            this.direction = direction;
            this.settings = settings;
        }

        void enqueue(FlowPermit permit, MonoSink<FlowPermit> sink) {
            Waiter waiter = new Waiter(permit, sink);
            boolean admittedNow;
            synchronized (this) {
                if (waiters.isEmpty() && !saturated && fits(permit)) {
                    reserve(waiter);
                    admittedNow = true;
                } else {
                    if (!saturated) {
                        log.debug("{} flow control saturated: outstanding {} bytes / {} messages",
                                direction.label(), bytes, messages);
                    }
                    saturated = true;
                    waiters.addLast(waiter);
                    admittedNow = false;
                }
            }
            // Also covers a permit admitted here but cancelled before it was requested.
            sink.onCancel(() -> withdraw(waiter));
            if (admittedNow) {
                sink.success(permit);
            }
        }

        void release(FlowPermit permit) {
            List<Waiter> admitted = new ArrayList<>();
            synchronized (this) {
                bytes -= permit.bytes();
                messages -= permit.messages();
                if (bytes < 0 || messages < 0) {
                    log.error("{} flow control counters went negative (bytes={}, messages={})",
                            direction.label(), bytes, messages);
                    bytes = Math.max(bytes, 0);
                    messages = Math.max(messages, 0);
                }
                admitWaiters(admitted);
            }
            signal(admitted);
        }

        private void withdraw(Waiter waiter) {
            boolean releaseAdmitted;
            List<Waiter> admitted = new ArrayList<>();
            synchronized (this) {
                if (waiters.remove(waiter)) {
                    releaseAdmitted = false;
                    admitWaiters(admitted);
                } else {
                    releaseAdmitted = waiter.admitted;
                }
            }
            signal(admitted);
            if (releaseAdmitted) {
                // Admitted while the subscriber was cancelling: the permit is unreachable.
                FlowController.this.release(waiter.permit);
            }
        }

        private void admitWaiters(List<Waiter> admitted) {
            if (saturated && belowResumeWatermarks()) {
                saturated = false;
            }
            if (saturated) {
                return;
            }
            while (!waiters.isEmpty()) {
                Waiter head = waiters.peekFirst();
                if (!fits(head.permit)) {
                    saturated = true;
                    return;
                }
                waiters.pollFirst();
                reserve(head);
                admitted.add(head);
            }
        }

        private void signal(List<Waiter> admitted) {
            for (Waiter waiter : admitted) {
                waiter.sink.success(waiter.permit);
            }
        }

        private void reserve(Waiter waiter) {
            bytes += waiter.permit.bytes();
            messages += waiter.permit.messages();
            waiter.admitted = true;
        }

        private boolean fits(FlowPermit permit) {
            if (bytes == 0 && messages == 0) {
                return true;
            }
            boolean bytesFit = settings.maxOutstandingBytes() <= 0
                    || bytes + permit.bytes() <= settings.maxOutstandingBytes();
            boolean messagesFit = settings.maxOutstandingMessages() <= 0
                    || messages + permit.messages() <= settings.maxOutstandingMessages();
            return bytesFit && messagesFit;
        }

        private boolean belowResumeWatermarks() {
            boolean bytesBelow = settings.maxOutstandingBytes() <= 0 || bytes <= settings.resumeBytes();
            boolean messagesBelow = settings.maxOutstandingMessages() <= 0 || messages <= settings.resumeMessages();
            return bytesBelow && messagesBelow;
        }

        synchronized long outstandingBytes() {
            return bytes;
        }

        synchronized long outstandingMessages() {
            return messages;
        }

        synchronized int waiterCount() {
            return waiters.size();
        }
    }
}
