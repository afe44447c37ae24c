package jump.email.watch.service;

import jump.email.watch.config.WatchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Registry shared by all instances through a Redis hash, so "no listeners" is decided
 * cluster-wide. Increments use HINCRBY; decrements run as a script so the field is removed
 * in the same step it reaches zero.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "watch.session-registry", name = "type", havingValue = "redis")
public class RedisSessionRegistry implements SessionRegistry {
    static final RedisScript<Long> DECREMENT_SCRIPT = new DefaultRedisScript<>(
        "local v = redis.call('HINCRBY', KEYS[1], ARGV[1], -1) "
            + "if v <= 0 then redis.call('HDEL', KEYS[1], ARGV[1]) return 0 end "
            + "return v",
        Long.class);

    private final StringRedisTemplate redisTemplate;
    private final String key;

    public RedisSessionRegistry(StringRedisTemplate redisTemplate, WatchProperties properties) {
        this.redisTemplate = redisTemplate;
        this.key = properties.getSessionRegistry().getRedisKey();
    }

    @Override
    public long attach(String principalId) {
        Long count = redisTemplate.opsForHash().increment(key, principalId, 1L);
        log.debug("Listener attached for {} ({} live cluster-wide)", principalId, count);
        return count != null ? count : 0L;
    }

    @Override
    public long detach(String principalId) {
        Long count = redisTemplate.execute(DECREMENT_SCRIPT, Collections.singletonList(key), principalId);
        long remaining = count != null ? count : 0L;
        log.debug("Listener detached for {} ({} live cluster-wide)", principalId, remaining);
        return remaining;
    }

    @Override
    public long listenerCount(String principalId) {
        Object value = redisTemplate.opsForHash().get(key, principalId);
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric listener count '{}' for {}", value, principalId);
            return 0L;
        }
    }

    @Override
    public Map<String, Long> snapshot() {
        Map<Object, Object> entries = redisTemplate.opsForHash().entries(key);
        Map<String, Long> counts = new TreeMap<>();
        entries.forEach((principal, count) -> counts.put(principal.toString(), Long.parseLong(count.toString())));
        return counts;
    }
}
