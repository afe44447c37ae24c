package jump.email.watch.service;

import jump.email.watch.config.WatchProperties;
import jump.email.watch.exception.WatchLockTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes every mutation of a principal's watch (create, renew, stop, reconcile) within
 * this instance. Acquisition waits at most {@code watch.lock.timeout}.
 * Across instances the record's optimistic version rejects lost updates.
 */
@Slf4j
@Service
public class PrincipalLockService {
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final WatchProperties properties;

    public PrincipalLockService(WatchProperties properties) {
        this.properties = properties;
    }

    public <T> T withLock(String principalId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(principalId, key -> new ReentrantLock());
        long timeoutMillis = properties.getLock().getTimeout().toMillis();
        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WatchLockTimeoutException(principalId);
        }
        if (!acquired) {
            log.warn("Gave up waiting {} ms for the watch lock of {}", timeoutMillis, principalId);
            throw new WatchLockTimeoutException(principalId);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String principalId, Runnable action) {
        withLock(principalId, () -> {
            action.run();
            return null;
        });
    }
}
