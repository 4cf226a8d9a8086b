package com.errorengine.monitor;

import com.errorengine.store.MonitorStore;
import com.errorengine.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At most one execution per query. Acquisition is a compare-and-set on an in-process map; a held
 * lock rejects the caller instead of queueing it. The store keeps a lock marker per query so that
 * locks held when the process died can be cleared at the next startup.
 */
@Component
public class ExecutionLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLockRegistry.class);

    private final Map<Long, Lease> held = new ConcurrentHashMap<>();
    private final MonitorStore store;
    private final Clock clock;

    public ExecutionLockRegistry(MonitorStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Try to take the lock of a query.
     *
     * @param queryId query id
     * @return the lease, empty when another execution holds the lock
     */
    public Optional<Lease> tryAcquire(long queryId) {
        Lease lease = new Lease(queryId, clock.instant());
        if (held.putIfAbsent(queryId, lease) != null) {
            return Optional.empty();
        }
        try {
            if (!store.markLocked(queryId, lease.acquiredAt)) {
                log.warn("Lock marker already present, continuing with in-process lock: query_id={}", queryId);
            }
        } catch (StoreException e) {
            log.warn("Failed to persist lock marker: query_id={}", queryId, e);
        }
        return Optional.of(lease);
    }

    public boolean isHeld(long queryId) {
        return held.containsKey(queryId);
    }

    public Set<Long> heldQueryIds() {
        return Set.copyOf(held.keySet());
    }

    /**
     * Clear lock markers left behind by a previous process.
     *
     * @return number of markers cleared
     */
    public int recoverStaleLocks() {
        int cleared = store.clearAllLocks();
        if (cleared > 0) {
            log.warn("Cleared stale execution locks from previous run: count={}", cleared);
        }
        return cleared;
    }

    private void release(Lease lease) {
        if (!held.remove(lease.queryId, lease)) {
            return;
        }
        try {
            store.clearLock(lease.queryId);
        } catch (StoreException e) {
            log.warn("Failed to clear lock marker: query_id={}", lease.queryId, e);
        }
    }

    /**
     * A held lock. Closing it releases the lock; closing twice is harmless.
     */
    public final class Lease implements AutoCloseable {
        private final long queryId;
        private final Instant acquiredAt;

        private Lease(long queryId, Instant acquiredAt) {
            this.queryId = queryId;
            this.acquiredAt = acquiredAt;
        }

        public long getQueryId() {
            return queryId;
        }

        public Instant getAcquiredAt() {
            return acquiredAt;
        }

        @Override
        public void close() {
            release(this);
        }
    }
}
