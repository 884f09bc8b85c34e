package io.clype.reactorpubsub.publisher;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import io.clype.reactorpubsub.model.PubsubMessage;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Creates and resolves the {@link PublishHandle}s of one publisher.
 *
 * <p>Each handle resolves exactly once; later attempts return false and change nothing.</p>
 */
public class CompletionRegistry {

    private final Map<Long, PublishHandle> pending = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public PublishHandle register(PubsubMessage message) {
        Objects.requireNonNull(message, "message cannot be null");
        PublishHandle handle = new PublishHandle(sequence.incrementAndGet(), message);
        pending.put(handle.sequence(), handle);
        return handle;
    }

    /**
     * Resolves a handle with the id the service assigned.
     *
     * @param handle    the handle to resolve
     * @param messageId the service-assigned id
     * @return true if this call resolved the handle
     */
    public boolean succeed(PublishHandle handle, String messageId) {
        Objects.requireNonNull(messageId, "messageId cannot be null");
        if (!handle.succeed(messageId)) {
            return false;
        }
        pending.remove(handle.sequence());
        return true;
    }

    /**
     * Resolves a handle with a failure.
     *
     * @param handle  the handle to resolve
     * @param failure why the publish failed
     * @return true if this call resolved the handle
     */
    public boolean fail(PublishHandle handle, Throwable failure) {
        Objects.requireNonNull(failure, "failure cannot be null");
        if (!handle.fail(failure)) {
            return false;
        }
        pending.remove(handle.sequence());
        return true;
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Completes once every handle pending at call time has resolved.
     *
     * @return a Mono that never errors
     */
    public Mono<Void> whenAllResolved() {
        List<PublishHandle> snapshot = new ArrayList<>(pending.values());
        return Flux.fromIterable(snapshot)
                .flatMap(PublishHandle::whenResolved)
                .then();
    }
}
