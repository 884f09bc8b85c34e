package io.clype.reactorpubsub.flowcontrol;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A reservation granted by {@link FlowController}. Released at most once.
 */
public final class FlowPermit {

    private final FlowController owner;
    private final FlowDirection direction;
    private final long bytes;
    private final long messages;
    private final AtomicBoolean released = new AtomicBoolean(false);

    FlowPermit(FlowController owner, FlowDirection direction, long bytes, long messages) {
        this.owner = owner;
        this.direction = direction;
        this.bytes = bytes;
        this.messages = messages;
    }

    public FlowDirection direction() {
        return direction;
    }

    public long bytes() {
        return bytes;
    }

    public long messages() {
        return messages;
    }

    public boolean isReleased() {
        return released.get();
    }

    FlowController owner() {
        return owner;
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "FlowPermit{" + direction.label() + ", bytes=" + bytes + ", messages=" + messages
                + ", released=" + released.get() + '}';
    }
}
