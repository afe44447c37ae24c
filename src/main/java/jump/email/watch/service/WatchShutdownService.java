package jump.email.watch.service;

import jump.email.watch.config.WatchProperties;
import jump.email.watch.entity.WatchRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Optionally stops every active watch when the application shuts down, so no provider
 * watch outlives the process. Bounded by {@code watch.shutdown.timeout}.
 */
@Slf4j
@Service
public class WatchShutdownService {
    private final WatchSubscriptionService subscriptionService;
    private final WatchRecordStore store;
    private final WatchProperties properties;
    private final Executor executor;

    public WatchShutdownService(WatchSubscriptionService subscriptionService, WatchRecordStore store,
                                WatchProperties properties,
                                @Qualifier("watchShutdownExecutor") Executor executor) {
        this.subscriptionService = subscriptionService;
        this.store = store;
        this.properties = properties;
        this.executor = executor;
    }

    @EventListener(ContextClosedEvent.class)
    public void onShutdown() {
        if (!properties.getShutdown().isStopWatches()) {
            return;
        }
        stopAllWithin();
    }

    /**
     * @return number of watches stopped before the deadline
     */
    public int stopAllWithin() {
        List<WatchRecord> active = store.findActive();
        if (active.isEmpty()) {
            return 0;
        }
        long timeoutMillis = properties.getShutdown().getTimeout().toMillis();
        log.info("Stopping {} active watches before shutdown (timeout {} ms)", active.size(), timeoutMillis);

        AtomicInteger stopped = new AtomicInteger();
        CompletableFuture<?>[] stops = new CompletableFuture<?>[0];
        try {
            stops = active.stream()
                .map(record -> CompletableFuture.runAsync(() -> stopOne(record, stopped), executor))
                .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(stops).get(timeoutMillis, TimeUnit.MILLISECONDS);
            log.info("Stopped {} watches before shutdown", stopped.get());
        } catch (TimeoutException e) {
            log.warn("Shutdown watch cleanup timed out after {} ms; {} of {} stopped", timeoutMillis, stopped.get(), active.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Shutdown watch cleanup interrupted; {} of {} stopped", stopped.get(), active.size());
        } catch (ExecutionException e) {
            log.error("Shutdown watch cleanup failed: {}", e.getMessage(), e);
        } finally {
            for (CompletableFuture<?> stop : stops) {
                stop.cancel(false);
            }
        }
        return stopped.get();
    }

    private void stopOne(WatchRecord record, AtomicInteger stopped) {
        try {
            if (subscriptionService.stop(record.getPrincipalId())) {
                stopped.incrementAndGet();
            }
        } catch (RuntimeException e) {
            log.warn("Could not stop watch of {} during shutdown: {}", record.getPrincipalId(), e.getMessage());
        }
    }
}
