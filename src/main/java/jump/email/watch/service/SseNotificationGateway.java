package jump.email.watch.service;

import jump.email.watch.model.RealtimeEventKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Server-sent event streams per principal. Opening and closing a stream is what attaches and
 * detaches listeners in the {@link SessionRegistry}; events only ever go to the streams of
 * the principal they belong to.
 */
@Slf4j
@Service
public class SseNotificationGateway implements RealtimePublisher {
    static final long STREAM_TIMEOUT_MS = Duration.ofMinutes(30).toMillis();

    private final SessionRegistry sessionRegistry;
    private final Map<String, List<SseEmitter>> emitters = new ConcurrentHashMap<>();

    public SseNotificationGateway(SessionRegistry sessionRegistry) {
        this.sessionRegistry = sessionRegistry;
    }

    public SseEmitter connect(String principalId) {
        return register(principalId, new SseEmitter(STREAM_TIMEOUT_MS));
    }

    SseEmitter register(String principalId, SseEmitter emitter) {
        // add inside compute so a concurrent remove of the last stream cannot orphan the list
        emitters.compute(principalId, (key, list) -> {
            List<SseEmitter> streams = list != null ? list : new CopyOnWriteArrayList<>();
            streams.add(emitter);
            return streams;
        });
        long live = sessionRegistry.attach(principalId);
        log.info("Realtime stream opened for {} ({} live)", principalId, live);

        AtomicBoolean released = new AtomicBoolean(false);
        Runnable release = () -> {
            if (released.compareAndSet(false, true)) {
                remove(principalId, emitter);
            }
        };
        emitter.onCompletion(release);
        emitter.onTimeout(release);
        emitter.onError(error -> release.run());
        return emitter;
    }

    @Override
    @Async("realtimeFanoutExecutor")
    public void publish(String principalId, RealtimeEventKind kind, Object payload) {
        List<SseEmitter> targets = emitters.get(principalId);
        if (targets == null || targets.isEmpty()) {
            log.debug("No local stream for {}; {} not delivered", principalId, kind);
            return;
        }
        for (SseEmitter emitter : targets) {
            try {
                emitter.send(SseEmitter.event().name(kind.name()).data(payload));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping broken stream for {}: {}", principalId, e.getMessage());
                emitter.completeWithError(e);
            }
        }
    }

    public int localStreamCount(String principalId) {
        List<SseEmitter> targets = emitters.get(principalId);
        return targets != null ? targets.size() : 0;
    }

    private void remove(String principalId, SseEmitter emitter) {
        emitters.computeIfPresent(principalId, (key, list) -> {
            list.remove(emitter);
            return list.isEmpty() ? null : list;
        });
        long live = sessionRegistry.detach(principalId);
        log.info("Realtime stream closed for {} ({} live)", principalId, live);
    }
}
