package dao.bridge.dataworker.service;

import dao.bridge.dataworker.model.RootType;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-bundle locking. Status transitions take the write lock. Leaf execution takes the read lock
 * plus the lock of its root type, so different root types of one bundle execute concurrently.
 */
@Component
public class BundleLocks {

    private record RootKey(long bundleId, RootType rootType) {}

    private final Map<Long, ReadWriteLock> bundleLocks = new ConcurrentHashMap<>();
    private final Map<RootKey, Lock> rootLocks = new ConcurrentHashMap<>();

    public ReadWriteLock forBundle(long bundleId) {
        return bundleLocks.computeIfAbsent(bundleId, id -> new ReentrantReadWriteLock());
    }

    public Lock forRoot(long bundleId, RootType rootType) {
        return rootLocks.computeIfAbsent(new RootKey(bundleId, rootType), k -> new ReentrantLock());
    }
}
