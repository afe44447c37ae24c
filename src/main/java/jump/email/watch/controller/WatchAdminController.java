package jump.email.watch.controller;

import jump.email.watch.exception.WatchNotFoundException;
import jump.email.watch.model.BulkStopSummary;
import jump.email.watch.model.HealthReport;
import jump.email.watch.model.PullCycleSummary;
import jump.email.watch.model.RenewalSummary;
import jump.email.watch.model.WatchStatusView;
import jump.email.watch.service.OrphanWatchSupervisor;
import jump.email.watch.service.PullNotificationService;
import jump.email.watch.service.SessionRegistry;
import jump.email.watch.service.WatchHealthService;
import jump.email.watch.service.WatchRenewalScheduler;
import jump.email.watch.service.WatchSubscriptionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Operator endpoints for inspecting and repairing watches.
 */
@Slf4j
@RestController
@RequestMapping("/api/admin/watches")
public class WatchAdminController {
    private final WatchSubscriptionService subscriptionService;
    private final WatchRenewalScheduler renewalScheduler;
    private final PullNotificationService pullNotificationService;
    private final OrphanWatchSupervisor orphanSupervisor;
    private final WatchHealthService healthService;
    private final SessionRegistry sessionRegistry;

    public WatchAdminController(WatchSubscriptionService subscriptionService,
                                WatchRenewalScheduler renewalScheduler,
                                PullNotificationService pullNotificationService,
                                OrphanWatchSupervisor orphanSupervisor,
                                WatchHealthService healthService,
                                SessionRegistry sessionRegistry) {
        this.subscriptionService = subscriptionService;
        this.renewalScheduler = renewalScheduler;
        this.pullNotificationService = pullNotificationService;
        this.orphanSupervisor = orphanSupervisor;
        this.healthService = healthService;
        this.sessionRegistry = sessionRegistry;
    }

    @GetMapping
    public List<WatchStatusView> listActive() {
        return subscriptionService.listActive();
    }

    @GetMapping("/{principalId}")
    public WatchStatusView status(@PathVariable String principalId) {
        return subscriptionService.getStatus(principalId, null)
            .orElseThrow(() -> new WatchNotFoundException("No watch for principal " + principalId));
    }

    @PostMapping("/{principalId}/stop")
    public Map<String, Boolean> stop(@PathVariable String principalId) {
        log.info("Operator stop of watch for {}", principalId);
        return Map.of("stopped", subscriptionService.stop(principalId));
    }

    @PostMapping("/{principalId}/renew")
    public WatchStatusView renew(@PathVariable String principalId) {
        log.info("Operator renewal of watch for {}", principalId);
        return WatchStatusView.from(subscriptionService.renewForPrincipal(principalId), null);
    }

    @PostMapping("/renewal-sweep")
    public RenewalSummary renewalSweep() {
        return renewalScheduler.runSweep();
    }

    @PostMapping("/pull-cycle")
    public PullCycleSummary pullCycle() {
        return pullNotificationService.runPullCycle();
    }

    @PostMapping("/stop-all")
    public BulkStopSummary stopAll() {
        log.warn("Operator requested a bulk stop of all watches");
        return subscriptionService.stopAll();
    }

    @PostMapping("/cleanup")
    public Map<String, Integer> cleanup() {
        return Map.of("stopped", orphanSupervisor.cleanupInactiveWatches());
    }

    @GetMapping("/health")
    public HealthReport health() {
        return healthService.sample();
    }

    @GetMapping("/sessions")
    public Map<String, Long> sessions() {
        return sessionRegistry.snapshot();
    }
}
