package jump.email.watch.service;

import jump.email.watch.config.WatchProperties;
import jump.email.watch.model.HealthReport;
import jump.email.watch.model.HealthStatus;
import jump.email.watch.model.OrphanWatchDetectedEvent;
import jump.email.watch.model.WatchStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic health sampling of the watch fleet.
 */
@Slf4j
@Service
public class WatchHealthService {
    static final String CHECK_PROVIDER = "providerConnectivity";
    static final String CHECK_ERROR_RATIO = "errorRatio";
    static final String CHECK_RENEWAL_BACKLOG = "renewalBacklog";
    private static final double MAX_ERROR_RATIO = 0.10;

    private final WatchRecordStore store;
    private final PullNotificationSource pullSource;
    private final WatchProperties properties;
    private final Clock clock;
    private final Map<OrphanWatchDetectedEvent.Kind, AtomicLong> orphanCounts = new EnumMap<>(OrphanWatchDetectedEvent.Kind.class);
    private volatile HealthReport lastReport;

    public WatchHealthService(WatchRecordStore store, PullNotificationSource pullSource,
                              WatchProperties properties, Clock clock) {
        this.store = store;
        this.pullSource = pullSource;
        this.properties = properties;
        this.clock = clock;
        for (OrphanWatchDetectedEvent.Kind kind : OrphanWatchDetectedEvent.Kind.values()) {
            orphanCounts.put(kind, new AtomicLong());
        }
    }

    @Scheduled(fixedDelayString = "${watch.health.fixed-delay-ms:900000}", initialDelayString = "${watch.health.initial-delay-ms:60000}")
    public void scheduledSample() {
        HealthReport report = sample();
        if (report.getStatus() != HealthStatus.HEALTHY) {
            log.warn("Watch health {}: checks={} recommendations={}", report.getStatus(), report.getChecks(), report.getRecommendations());
        } else {
            log.debug("Watch health {}", report.getStatus());
        }
    }

    public HealthReport sample() {
        WatchStatistics stats = store.statistics(properties.getRenewal().getWindow());

        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put(CHECK_PROVIDER, providerReachable());
        checks.put(CHECK_ERROR_RATIO, stats.getActiveWatches() == 0
            || (double) stats.getWatchesWithErrors() / stats.getActiveWatches() <= MAX_ERROR_RATIO);
        checks.put(CHECK_RENEWAL_BACKLOG, stats.getAlreadyExpired() == 0);

        long passing = checks.values().stream().filter(Boolean::booleanValue).count();
        HealthStatus status = HealthStatus.fromPassingRatio((double) passing / checks.size());

        HealthReport report = new HealthReport(status, checks, stats, recommendations(stats), orphanCounts(), clock.instant());
        lastReport = report;
        return report;
    }

    public HealthReport lastReport() {
        return lastReport != null ? lastReport : sample();
    }

    public Map<String, Long> orphanCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        orphanCounts.forEach((kind, count) -> counts.put(kind.name(), count.get()));
        return counts;
    }

    @EventListener
    public void onOrphanDetected(OrphanWatchDetectedEvent event) {
        orphanCounts.get(event.getKind()).incrementAndGet();
    }

    private boolean providerReachable() {
        try {
            return pullSource.isReachable();
        } catch (RuntimeException e) {
            log.warn("Provider connectivity check failed: {}", e.getMessage());
            return false;
        }
    }

    private List<String> recommendations(WatchStatistics stats) {
        List<String> recommendations = new ArrayList<>();
        if (stats.getExpiringWithinWindow() > 0) {
            recommendations.add(stats.getExpiringWithinWindow() + " watches expiring within "
                + properties.getRenewal().getWindow().toHours() + "h");
        }
        if (stats.getWatchesInAuthError() > 0) {
            recommendations.add(stats.getWatchesInAuthError() + " watches in auth-error state");
        }
        if (stats.getWatchesWithErrors() > 0) {
            recommendations.add(stats.getWatchesWithErrors() + " watches have errors");
        }
        if (stats.getAlreadyExpired() > 0) {
            recommendations.add(stats.getAlreadyExpired() + " active watches are past expiry; run a renewal sweep");
        }
        return recommendations;
    }
}
