package jump.email.watch.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local registry. Correct only for a single instance.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "watch.session-registry", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemorySessionRegistry implements SessionRegistry {
    private final ConcurrentHashMap<String, Long> listeners = new ConcurrentHashMap<>();

    @Override
    public long attach(String principalId) {
        long count = listeners.merge(principalId, 1L, Long::sum);
        log.debug("Listener attached for {} ({} live)", principalId, count);
        return count;
    }

    @Override
    public long detach(String principalId) {
        Long count = listeners.computeIfPresent(principalId, (key, current) -> current <= 1 ? null : current - 1);
        long remaining = count != null ? count : 0L;
        log.debug("Listener detached for {} ({} live)", principalId, remaining);
        return remaining;
    }

    @Override
    public long listenerCount(String principalId) {
        return listeners.getOrDefault(principalId, 0L);
    }

    @Override
    public Map<String, Long> snapshot() {
        return new TreeMap<>(listeners);
    }
}
