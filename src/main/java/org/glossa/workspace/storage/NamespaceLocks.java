package org.glossa.workspace.storage;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out one {@link ReentrantLock} per (namespace, store) pair so that read-modify-write
 * cycles against the same store file never interleave. Different namespaces never contend.
 * <p>
 * Locks are created lazily and kept for the lifetime of the process; the number of entries is
 * bounded by users times stores.
 */
public final class NamespaceLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * A unit of work executed while holding a namespace lock.
     *
     * @param <T> the result type
     */
    @FunctionalInterface
    public interface LockedOperation<T> {
        T execute() throws IOException;
    }

    /**
     * Runs the operation while holding the lock for the given namespace and store.
     *
     * @param namespace the namespace identifier
     * @param storeName the store name
     * @param operation the read-modify-write to run
     * @param <T>       the result type
     * @return the operation's result
     * @throws IOException if the operation fails with an I/O error
     */
    public <T> T withLock(final String namespace, final String storeName,
                          final LockedOperation<T> operation) throws IOException {
        final ReentrantLock lock = locks.computeIfAbsent(namespace + "/" + storeName, k -> new ReentrantLock());
        lock.lock();
        try {
            return operation.execute();
        } finally {
            lock.unlock();
        }
    }
}
