package io.clype.reactorpubsub.publisher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.clype.reactorpubsub.model.PubsubMessage;

/**
 * Messages collected for one send. Not thread-safe: mutated only under the owning
 * publisher's lock, and frozen once closed.
 */
final class Batch {

    private final List<PendingMessage> entries = new ArrayList<>();
    private long bytes;
    private boolean closed;

    void add(PendingMessage pending) {
        if (closed) {
            throw new IllegalStateException("batch is closed");
        }
        entries.add(pending);
        bytes += pending.sizeInBytes();
    }

    /**
     * Removes a message that has not been sent yet.
     *
     * @return false if the message is not in this batch or the batch is closed
     */
    boolean remove(PendingMessage pending) {
        if (closed || !entries.remove(pending)) {
            return false;
        }
        bytes -= pending.sizeInBytes();
        return true;
    }

    void close() {
        closed = true;
    }

    boolean isClosed() {
        return closed;
    }

    boolean isEmpty() {
        return entries.isEmpty();
    }

    int size() {
        return entries.size();
    }

    long bytes() {
        return bytes;
    }

    List<PendingMessage> entries() {
        return Collections.unmodifiableList(entries);
    }

    List<PubsubMessage> messages() {
        List<PubsubMessage> messages = new ArrayList<>(entries.size());
        for (PendingMessage entry : entries) {
            messages.add(entry.message());
        }
        return messages;
    }
}
