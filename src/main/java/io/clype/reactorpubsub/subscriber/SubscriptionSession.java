package io.clype.reactorpubsub.subscriber;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import io.clype.reactorpubsub.flowcontrol.FlowController;
import io.clype.reactorpubsub.flowcontrol.FlowDirection;
import io.clype.reactorpubsub.flowcontrol.FlowPermit;
import io.clype.reactorpubsub.metrics.SubscriberMetrics;
import io.clype.reactorpubsub.model.ReceivedMessage;
import io.clype.reactorpubsub.model.SubscriptionName;
import io.clype.reactorpubsub.transport.SubscriberTransport;
import io.clype.reactorpubsub.util.LogSanitizer;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Pulls messages from one subscription, dispatches them to a {@link MessageHandler} and keeps
 * their leases alive until they are settled.
 *
 * <p><b>Pipeline:</b></p>
 * <ol>
 *   <li>The delivery stream is read one message at a time. Each message reserves
 *       delivery-direction flow-control budget before it is admitted; while the budget is
 *       exhausted nothing more is read.</li>
 *   <li>An admitted message gets a lease with a deadline of {@code ackDeadline} from now.
 *       At two thirds of the deadline the lease asks the service for another {@code ackDeadline},
 *       until {@code maxLeaseExtension} has passed since receipt. The deadline only moves once
 *       the service accepted the extension.</li>
 *   <li>At most {@code maxConcurrency} messages are handed to the handler and left unsettled at
 *       a time. Further admitted messages are leased as soon as they are admitted and wait in
 *       a buffer for a slot, their leases renewed meanwhile.</li>
 *   <li>Ack, nack and expiry each remove the lease and release its budget. A lease whose
 *       deadline passes unsettled expires locally without notifying the service.</li>
 * </ol>
 *
 * <p><b>Failures:</b> a handler that throws nacks its message; the session carries on. A
 * delivery stream that errors makes the session drain; the error is kept as
 * {@link #terminationCause()}. Failed acks, nacks and deadline changes are logged and
 * otherwise ignored.</p>
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. {@link AckHandler}s may be used from any
 * thread.</p>
 */
public class SubscriptionSession implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionSession.class);

    /** How long {@link #destroy()} waits for outstanding messages before expiring them. */
    private static final Duration DESTROY_DRAIN_TIMEOUT = Duration.ofSeconds(30);

    private final SubscriptionName subscription;
    private final SubscriberTransport transport;
    private final MessageHandler handler;
    private final SubscriberSettings settings;
    private final FlowController flowController;
    private final Scheduler timerScheduler;
    private final Scheduler handlerScheduler;
    private final boolean ownsTimerScheduler;
    private final boolean ownsHandlerScheduler;
    private final SubscriberMetrics metrics;

    private final LeaseTable leaseTable = new LeaseTable();
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.IDLE);
    private final Sinks.One<Boolean> drainSignal = Sinks.one();
    private final Sinks.Empty<Void> stopped = Sinks.empty();
    private final long ackDeadlineMillis;
    private final long renewalDelayMillis;

    private volatile Disposable pipeline;
    private volatile Throwable terminationCause;

    /**
     * Creates a session with its own schedulers and no metrics.
     *
     * @param subscription   the subscription to pull from
     * @param transport      delivery stream and ack/nack/deadline calls
     * @param handler        receives every admitted message
     * @param settings       concurrency and lease settings
     * @param flowController delivery budget
     */
    public SubscriptionSession(SubscriptionName subscription, SubscriberTransport transport,
                               MessageHandler handler, SubscriberSettings settings,
                               FlowController flowController) {
        this(subscription, transport, handler, settings, flowController, null, null, null);
    }

    /**
     * Creates a session with full configuration options.
     *
     * @param subscription     the subscription to pull from
     * @param transport        delivery stream and ack/nack/deadline calls
     * @param handler          receives every admitted message
     * @param settings         concurrency and lease settings
     * @param flowController   delivery budget
     * @param timerScheduler   clock and lease timers; null to create (and own) a single-threaded one
     * @param handlerScheduler runs the handler; null to create (and own) a bounded elastic one
     *                         with {@code maxConcurrency} threads
     * @param metrics          optional metrics collector (may be null)
     */
    public SubscriptionSession(SubscriptionName subscription, SubscriberTransport transport,
                               MessageHandler handler, SubscriberSettings settings,
                               FlowController flowController, Scheduler timerScheduler,
                               Scheduler handlerScheduler, SubscriberMetrics metrics) {
        this.subscription = Objects.requireNonNull(subscription, "subscription cannot be null");
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.handler = Objects.requireNonNull(handler, "handler cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.flowController = Objects.requireNonNull(flowController, "flowController cannot be null");

        this.ownsTimerScheduler = timerScheduler == null;
        this.timerScheduler = ownsTimerScheduler ? Schedulers.newSingle("pubsub-lease-timer") : timerScheduler;
        this.ownsHandlerScheduler = handlerScheduler == null;
        this.handlerScheduler = ownsHandlerScheduler
                ? Schedulers.newBoundedElastic(settings.maxConcurrency(), settings.maxConcurrency() * 2,
                        "pubsub-handler")
                : handlerScheduler;

        this.ackDeadlineMillis = settings.ackDeadline().toMillis();
        this.renewalDelayMillis = settings.renewalDelay().toMillis();
        this.metrics = metrics;
        if (metrics != null) {
            metrics.bindActiveLeases(leaseTable::size);
        }
    }

    // ==========================================================================
    // Lifecycle
    // ==========================================================================

    /**
     * Opens the delivery stream and starts dispatching.
     *
     * @throws IllegalStateException if the session was started or drained before
     */
    public void start() {
        if (!state.compareAndSet(SessionState.IDLE, SessionState.RUNNING)) {
            throw new IllegalStateException("Session for " + subscription + " is " + state.get()
                    + "; it can only be started once");
        }
        log.info("Starting subscription session for {} (max concurrency {}, ack deadline {}ms)",
                subscription, settings.maxConcurrency(), ackDeadlineMillis);

        pipeline = Flux.defer(() -> transport.openDeliveryStream(subscription))
                .takeUntilOther(drainSignal.asMono())
                .onErrorResume(this::onDeliveryStreamError)
                .doOnComplete(() -> beginDraining("delivery stream ended"))
                .concatMap(this::admit, 1)
                // Leased messages wait here for a handler slot; the delivery budget bounds them.
                .onBackpressureBuffer()
                .flatMap(this::dispatch, settings.maxConcurrency())
                .doFinally(this::onTerminated)
                .subscribe(
                        null,
                        e -> log.error("Subscription session for {} failed: {}",
                                subscription, LogSanitizer.sanitize(e.getMessage()), e));
    }

    /**
     * Stops pulling new messages. Leases already admitted are still renewed and may be settled.
     *
     * @return a Mono completing once every admitted message is settled or expired
     */
    public Mono<Void> drain() {
        if (state.compareAndSet(SessionState.IDLE, SessionState.STOPPED)) {
            stopped.tryEmitEmpty();
        } else {
            beginDraining("drain requested");
        }
        return stopped.asMono();
    }

    /**
     * Drains, and expires whatever is still unsettled after {@code timeout}.
     *
     * @param timeout how long to wait for handlers to settle their messages
     * @return a Mono completing once the session is stopped
     */
    public Mono<Void> stop(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        return drain().timeout(timeout, Mono.defer(() -> {
            log.warn("Subscription session for {} did not drain within {}ms; expiring {} lease(s)",
                    subscription, timeout.toMillis(), leaseTable.size());
            Disposable running = pipeline;
            if (running != null) {
                running.dispose();
            }
            return stopped.asMono();
        }), timerScheduler);
    }

    /**
     * Stops the session, then disposes the schedulers it created.
     * Called automatically by Spring's lifecycle management.
     */
    @Override
    public void destroy() {
        try {
            stop(DESTROY_DRAIN_TIMEOUT).block();
        } finally {
            if (ownsTimerScheduler) {
                timerScheduler.dispose();
            }
            if (ownsHandlerScheduler) {
                handlerScheduler.dispose();
            }
        }
    }

    public SessionState state() {
        return state.get();
    }

    public SessionStatus status() {
        return new SessionStatus(
                state.get(),
                leaseTable.size(),
                flowController.outstandingBytes(FlowDirection.DELIVERY),
                flowController.outstandingMessages(FlowDirection.DELIVERY));
    }

    /**
     * @return the delivery stream error that ended the session, if any
     */
    public Optional<Throwable> terminationCause() {
        return Optional.ofNullable(terminationCause);
    }

    public SubscriptionName subscription() {
        return subscription;
    }

    private void beginDraining(String reason) {
        if (state.compareAndSet(SessionState.RUNNING, SessionState.DRAINING)) {
            log.info("Draining subscription session for {} ({}); {} lease(s) outstanding",
                    subscription, reason, leaseTable.size());
        }
        drainSignal.tryEmitValue(Boolean.TRUE);
    }

    private Flux<ReceivedMessage> onDeliveryStreamError(Throwable error) {
        terminationCause = error;
        log.warn("Delivery stream for {} failed: {}", subscription, LogSanitizer.sanitize(error.getMessage()));
        beginDraining("delivery stream failed");
        return Flux.empty();
    }

    private void onTerminated(SignalType signal) {
        for (Lease lease : leaseTable.snapshot()) {
            settle(lease, LeaseState.EXPIRED);
        }
        state.set(SessionState.STOPPED);
        log.info("Subscription session for {} stopped ({})", subscription, signal);
        stopped.tryEmitEmpty();
    }

    // ==========================================================================
    // Admission and dispatch
    // ==========================================================================

    private Mono<Lease> admit(ReceivedMessage received) {
        return flowController.acquire(FlowDirection.DELIVERY, received.message().sizeInBytes(), 1)
                .flatMap(permit -> Mono.justOrEmpty(track(received, permit)));
    }

    private Lease track(ReceivedMessage received, FlowPermit permit) {
        long now = now();
        Lease lease = new Lease(received, permit, now, now + ackDeadlineMillis);
        if (!leaseTable.insert(lease)) {
            log.warn("Ignoring second delivery of ack id {} on {}",
                    LogSanitizer.sanitize(received.ackId()), subscription);
            flowController.release(permit);
            return null;
        }
        if (metrics != null) {
            metrics.recordReceived();
        }
        scheduleRenewal(lease, renewalDelayMillis);
        return lease;
    }

    private Mono<Void> dispatch(Lease lease) {
        return Mono.<Void>fromRunnable(() -> invokeHandler(lease))
                .subscribeOn(handlerScheduler)
                .onErrorResume(e -> {
                    onHandlerFailure(lease, e);
                    return Mono.empty();
                })
                .then(lease.whenSettled());
    }

    private void invokeHandler(Lease lease) {
        if (lease.isSettled()) {
            return;
        }
        try {
            handler.handle(lease.received().message(), new AckHandler(this, lease));
        } catch (Exception e) {
            onHandlerFailure(lease, e);
        }
    }

    private void onHandlerFailure(Lease lease, Throwable error) {
        log.warn("Handler failed for message {} on {}; nacking: {}",
                LogSanitizer.sanitize(lease.ackId()), subscription, LogSanitizer.sanitize(error.getMessage()));
        if (metrics != null) {
            metrics.recordHandlerFailure();
        }
        settle(lease, LeaseState.NACKED);
    }

    // ==========================================================================
    // Lease renewal and settlement
    // ==========================================================================

    private void scheduleRenewal(Lease lease, long delayMillis) {
        lease.renewWith(timerScheduler.schedule(() -> renew(lease), Math.max(0, delayMillis),
                TimeUnit.MILLISECONDS));
    }

    private void renew(Lease lease) {
        if (lease.isSettled()) {
            return;
        }
        long now = now();
        if (now >= lease.deadlineMillis()) {
            log.warn("Lease for message {} on {} expired", LogSanitizer.sanitize(lease.ackId()), subscription);
            settle(lease, LeaseState.EXPIRED);
            return;
        }
        // Checks the deadline again unless an accepted extension reschedules first.
        scheduleRenewal(lease, lease.deadlineMillis() - now);

        long extensionLimit = lease.receivedAtMillis() + settings.maxLeaseExtension().toMillis();
        long extensionMillis = Math.min(ackDeadlineMillis, extensionLimit - now);
        if (extensionMillis <= 0 || !lease.beginExtension()) {
            return;
        }
        Mono.fromFuture(() -> transport.modifyAckDeadline(lease.ackId(), Duration.ofMillis(extensionMillis)))
                .subscribe(
                        ignored -> { },
                        e -> {
                            lease.endExtension(0, false);
                            log.warn("Failed to extend deadline of message {} on {}: {}",
                                    LogSanitizer.sanitize(lease.ackId()), subscription,
                                    LogSanitizer.sanitize(e.getMessage()));
                        },
                        () -> onExtensionAccepted(lease, now + extensionMillis));
    }

    private void onExtensionAccepted(Lease lease, long newDeadlineMillis) {
        lease.endExtension(newDeadlineMillis, true);
        if (lease.isSettled()) {
            return;
        }
        if (metrics != null) {
            metrics.recordExtended();
        }
        log.debug("Extended deadline of message {} on {}", LogSanitizer.sanitize(lease.ackId()), subscription);
        scheduleRenewal(lease, Math.min(renewalDelayMillis, lease.deadlineMillis() - now()));
    }

    /**
     * Settles a lease: removes it, releases its budget and tells the service about acks and
     * nacks. Only the first settlement of a lease has an effect.
     *
     * @return true if this call settled the lease
     */
    boolean settle(Lease lease, LeaseState outcome) {
        if (!lease.settle(outcome)) {
            log.debug("Ignoring {} for already settled message {}", outcome, LogSanitizer.sanitize(lease.ackId()));
            return false;
        }
        leaseTable.remove(lease);
        flowController.release(lease.permit());

        if (outcome == LeaseState.ACKED) {
            notifyService("ack", lease, () -> transport.ack(lease.ackId()));
            if (metrics != null) {
                metrics.recordAcked();
            }
        } else if (outcome == LeaseState.NACKED) {
            notifyService("nack", lease, () -> transport.nack(lease.ackId()));
            if (metrics != null) {
                metrics.recordNacked();
            }
        } else if (metrics != null) {
            metrics.recordExpired();
        }
        lease.signalSettled();
        return true;
    }

    private void notifyService(String action, Lease lease, Supplier<CompletableFuture<Void>> call) {
        Mono.fromFuture(call).subscribe(
                null,
                e -> log.warn("Failed to {} message {} on {}: {}", action,
                        LogSanitizer.sanitize(lease.ackId()), subscription, LogSanitizer.sanitize(e.getMessage())));
    }

    private long now() {
        return timerScheduler.now(TimeUnit.MILLISECONDS);
    }
}
