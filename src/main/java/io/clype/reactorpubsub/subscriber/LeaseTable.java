package io.clype.reactorpubsub.subscriber;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Unsettled leases of a session, keyed by ack id.
 */
final class LeaseTable {

    private final Map<String, Lease> leases = new ConcurrentHashMap<>();

    /**
     * @return false if a lease with the same ack id is already tracked
     */
    boolean insert(Lease lease) {
        return leases.putIfAbsent(lease.ackId(), lease) == null;
    }

    Lease get(String ackId) {
        return leases.get(ackId);
    }

    /**
     * Removes the lease if it is still the one tracked under its ack id. Idempotent.
     */
    boolean remove(Lease lease) {
        return leases.remove(lease.ackId(), lease);
    }

    int size() {
        return leases.size();
    }

    List<Lease> snapshot() {
        return new ArrayList<>(leases.values());
    }
}
