package io.clype.reactorpubsub.subscriber;

import java.util.concurrent.atomic.AtomicReference;

import io.clype.reactorpubsub.flowcontrol.FlowPermit;
import io.clype.reactorpubsub.model.ReceivedMessage;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Tracks one received message from admission until it is acked, nacked or expires.
 *
 * <p>Times are milliseconds on the session's scheduler clock. A lease settles exactly once;
 * {@link #settle(LeaseState)} loses against an earlier settlement.</p>
 */
final class Lease {

    private final ReceivedMessage received;
    private final FlowPermit permit;
    private final long receivedAtMillis;
    private final AtomicReference<LeaseState> state = new AtomicReference<>(LeaseState.DELIVERED);
    private final Sinks.Empty<Void> settled = Sinks.empty();

    private volatile long deadlineMillis;
    private volatile Disposable renewalTask;

    Lease(ReceivedMessage received, FlowPermit permit, long receivedAtMillis, long deadlineMillis) {
        this.received = received;
        this.permit = permit;
        this.receivedAtMillis = receivedAtMillis;
        this.deadlineMillis = deadlineMillis;
    }

    String ackId() {
        return received.ackId();
    }

    ReceivedMessage received() {
        return received;
    }

    FlowPermit permit() {
        return permit;
    }

    long receivedAtMillis() {
        return receivedAtMillis;
    }

    long deadlineMillis() {
        return deadlineMillis;
    }

    LeaseState state() {
        return state.get();
    }

    boolean isSettled() {
        return state.get().isTerminal();
    }

    /**
     * Marks an extension request as outstanding. Fails if one already is or the lease settled.
     */
    boolean beginExtension() {
        return state.compareAndSet(LeaseState.DELIVERED, LeaseState.EXTENDING);
    }

    /**
     * Ends an outstanding extension, moving the deadline to {@code newDeadlineMillis} when the
     * service accepted it. Has no effect once the lease settled.
     */
    void endExtension(long newDeadlineMillis, boolean accepted) {
        if (state.compareAndSet(LeaseState.EXTENDING, LeaseState.DELIVERED) && accepted) {
            deadlineMillis = Math.max(deadlineMillis, newDeadlineMillis);
        }
    }

    boolean settle(LeaseState outcome) {
        LeaseState current = state.get();
        while (!current.isTerminal()) {
            if (state.compareAndSet(current, outcome)) {
                cancelRenewal();
                return true;
            }
            current = state.get();
        }
        return false;
    }

    /**
     * Completes {@link #whenSettled()}. Called by the session once the lease's budget is back.
     */
    void signalSettled() {
        settled.tryEmitEmpty();
    }

    /**
     * @return a Mono completing when the lease settles, whatever the outcome
     */
    Mono<Void> whenSettled() {
        return settled.asMono();
    }

    void renewWith(Disposable task) {
        Disposable previous = renewalTask;
        renewalTask = task;
        if (previous != null && previous != task) {
            previous.dispose();
        }
        if (isSettled()) {
            task.dispose();
        }
    }

    private void cancelRenewal() {
        Disposable task = renewalTask;
        if (task != null) {
            task.dispose();
        }
    }
}
