package com.omniva.dbwatch.engine.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Reference counts of generated database objects (ledger table, triggers)
 * shared by every watch session that uses this registry.
 * <p>
 * The registry also owns the provisioning lock: creating and dropping
 * generated objects is serialized across all sessions, and counts are only
 * changed while that lock is held. {@link #shared()} is the process-wide
 * instance; tests and embedders may create isolated registries.
 * <p>
 * Keys are canonical object names compared case-insensitively. Counts never
 * go below zero.
 */
public class ReferenceCountRegistry {

    private static final Logger log = LoggerFactory.getLogger(ReferenceCountRegistry.class);
    private static final ReferenceCountRegistry SHARED = new ReferenceCountRegistry();

    private final ReentrantLock provisioningLock = new ReentrantLock();
    private final Map<String, Integer> refCounts = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public static ReferenceCountRegistry shared() {
        return SHARED;
    }

    /**
     * Runs {@code action} while holding the provisioning lock
     */
    public <T> T callWithLock(Supplier<T> action) {
        provisioningLock.lock();
        try {
            return action.get();
        } finally {
            provisioningLock.unlock();
        }
    }

    public void runWithLock(Runnable action) {
        callWithLock(() -> {
            action.run();
            return null;
        });
    }

    public int increment(String objectName) {
        return callWithLock(() -> {
            int refCount = refCounts.getOrDefault(objectName, 0) + 1;
            refCounts.put(objectName, refCount);
            log.debug("Reference count of {} incremented to {}", objectName, refCount);
            return refCount;
        });
    }

    /**
     * @return the count after decrementing; zero if the object was not tracked
     */
    public int decrement(String objectName) {
        return callWithLock(() -> {
            int refCount = refCounts.getOrDefault(objectName, 0);
            if (refCount > 0) {
                refCount -= 1;
                refCounts.put(objectName, refCount);
            }
            log.debug("Reference count of {} decremented to {}", objectName, refCount);
            return refCount;
        });
    }

    public int count(String objectName) {
        return callWithLock(() -> refCounts.getOrDefault(objectName, 0));
    }

    /**
     * Copy of the current counts, for rollback with {@link #restore(Map)}
     */
    public Map<String, Integer> snapshot() {
        return callWithLock(() -> {
            Map<String, Integer> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            copy.putAll(refCounts);
            return copy;
        });
    }

    public void restore(Map<String, Integer> snapshot) {
        runWithLock(() -> {
            refCounts.clear();
            refCounts.putAll(snapshot);
            log.debug("Reference counts restored ({} objects)", snapshot.size());
        });
    }

    public boolean isLockedByCurrentThread() {
        return provisioningLock.isHeldByCurrentThread();
    }
}
