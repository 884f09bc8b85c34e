package io.clype.reactorpubsub.publisher;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

import reactor.core.Disposable;

/**
 * State of one ordering key: messages waiting for a batch, the batch in flight, and whether the
 * key has halted. All fields are guarded by the lane's monitor.
 */
final class OrderingLane {

    final String orderingKey;
    final ArrayDeque<PendingMessage> queue = new ArrayDeque<>();
    long queuedBytes;
    Batch inFlight;
    boolean halted;
    Throwable haltCause;
    Disposable lingerTimer;

    OrderingLane(String orderingKey) {
        this.orderingKey = orderingKey;
    }

    void enqueue(PendingMessage pending) {
        queue.addLast(pending);
        queuedBytes += pending.sizeInBytes();
    }

    boolean removeQueued(PendingMessage pending) {
        if (!queue.remove(pending)) {
            return false;
        }
        queuedBytes -= pending.sizeInBytes();
        return true;
    }

    /**
     * Moves messages from the head of the queue into a new batch, up to the batching limits.
     * A single message larger than {@code maxBytes} still forms a batch of its own.
     */
    Batch takeBatch(BatchingSettings settings) {
        Batch batch = new Batch();
        while (!queue.isEmpty() && batch.size() < settings.maxMessages()) {
            PendingMessage next = queue.peekFirst();
            if (!batch.isEmpty() && batch.bytes() + next.sizeInBytes() > settings.maxBytes()) {
                break;
            }
            queue.pollFirst();
            queuedBytes -= next.sizeInBytes();
            batch.add(next);
        }
        batch.close();
        return batch;
    }

    List<PendingMessage> drainQueue() {
        List<PendingMessage> drained = new ArrayList<>(queue);
        queue.clear();
        queuedBytes = 0;
        return drained;
    }

    void cancelLingerTimer() {
        if (lingerTimer != null) {
            lingerTimer.dispose();
            lingerTimer = null;
        }
    }
}
