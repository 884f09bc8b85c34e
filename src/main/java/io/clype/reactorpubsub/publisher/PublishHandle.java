package io.clype.reactorpubsub.publisher;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import io.clype.reactorpubsub.model.PubsubMessage;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Caller-side view of one published message's outcome.
 *
 * <p>The outcome resolves exactly once, to the service-assigned message id or to a failure.
 * Any number of observers may subscribe to {@link #result()}; all of them see the same
 * outcome, including observers that subscribe after resolution.</p>
 *
 * <p>Resolution is owned by the {@link CompletionRegistry} that created the handle.</p>
 */
public final class PublishHandle {

    private final long sequence;
    private final PubsubMessage message;
    private final AtomicReference<CompletionState> state = new AtomicReference<>(CompletionState.PENDING);
    private final Sinks.One<String> outcome = Sinks.one();
    private volatile String messageId;
    private volatile Throwable error;
    private volatile BooleanSupplier canceller;

    PublishHandle(long sequence, PubsubMessage message) {
        this.sequence = sequence;
        this.message = message;
    }

    /**
     * Returns a Mono emitting the message id once the service accepted the message, or the
     * failure that resolved it.
     *
     * @return the broadcast outcome
     */
    public Mono<String> result() {
        return outcome.asMono();
    }

    /**
     * Blocks until the outcome is known.
     *
     * @return the message id
     * @throws RuntimeException the failure the message resolved to
     */
    public String await() {
        return result().block();
    }

    public String await(Duration timeout) {
        return result().block(timeout);
    }

    /**
     * Completes when the handle resolves, whatever the outcome.
     *
     * @return a Mono that never errors
     */
    public Mono<Void> whenResolved() {
        return result().then().onErrorComplete();
    }

    /**
     * Withdraws the message if its batch has not closed yet.
     *
     * <p>A withdrawn message resolves to {@link io.clype.reactorpubsub.model.PublishCancelledException}
     * and its flow-control reservation is released. Once the batch has been handed to the
     * transport, cancelling has no effect.</p>
     *
     * @return true if the message was withdrawn
     */
    public boolean cancel() {
        BooleanSupplier current = canceller;
        if (current == null || isDone()) {
            return false;
        }
        return current.getAsBoolean();
    }

    public CompletionState state() {
        return state.get();
    }

    public boolean isDone() {
        return state.get() != CompletionState.PENDING;
    }

    public Optional<String> messageId() {
        return Optional.ofNullable(messageId);
    }

    public Optional<Throwable> error() {
        return Optional.ofNullable(error);
    }

    public PubsubMessage message() {
        return message;
    }

    long sequence() {
        return sequence;
    }

    void cancelWith(BooleanSupplier canceller) {
        this.canceller = canceller;
    }

    boolean succeed(String id) {
        if (!state.compareAndSet(CompletionState.PENDING, CompletionState.SUCCEEDED)) {
            return false;
        }
        canceller = null;
        messageId = id;
        outcome.emitValue(id, Sinks.EmitFailureHandler.FAIL_FAST);
        return true;
    }

    boolean fail(Throwable failure) {
        if (!state.compareAndSet(CompletionState.PENDING, CompletionState.FAILED)) {
            return false;
        }
        canceller = null;
        error = failure;
        outcome.emitError(failure, Sinks.EmitFailureHandler.FAIL_FAST);
        return true;
    }

    @Override
    public String toString() {
        return "PublishHandle{sequence=" + sequence + ", state=" + state.get() + '}';
    }
}
