package jump.email.watch.service;

import jump.email.watch.config.WatchProperties;
import jump.email.watch.entity.WatchRecord;
import jump.email.watch.model.RenewalSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hourly upkeep: retires watches past their maximum age or error threshold, then renews
 * those close to provider expiry.
 */
@Slf4j
@Service
public class WatchRenewalScheduler {
    private final WatchSubscriptionService subscriptionService;
    private final WatchProperties properties;

    public WatchRenewalScheduler(WatchSubscriptionService subscriptionService, WatchProperties properties) {
        this.subscriptionService = subscriptionService;
        this.properties = properties;
    }

    @Scheduled(cron = "${watch.renewal.cron:0 0 * * * *}")
    public void scheduledSweep() {
        runSweep();
    }

    public RenewalSummary runSweep() {
        List<String> details = new ArrayList<>();
        int retired = retire(details);

        int renewed = 0;
        int failed = 0;
        List<WatchRecord> due = subscriptionService.findNeedingRenewal(properties.getRenewal().getWindow());
        for (WatchRecord record : due) {
            try {
                WatchRecord renewedRecord = subscriptionService.renew(record.getSubscriptionId());
                renewed++;
                details.add("renewed " + record.getPrincipalId() + " until " + renewedRecord.getExpiresAt());
            } catch (RuntimeException e) {
                failed++;
                details.add("failed " + record.getPrincipalId() + ": " + e.getMessage());
                log.error("Renewal of watch {} for {} failed: {}", record.getSubscriptionId(), record.getPrincipalId(), e.getMessage(), e);
            }
        }

        if (renewed + failed + retired > 0) {
            log.info("Renewal sweep: {} renewed, {} failed, {} retired", renewed, failed, retired);
        } else {
            log.debug("Renewal sweep: nothing due");
        }
        return new RenewalSummary(renewed, failed, retired, details);
    }

    private int retire(List<String> details) {
        Map<String, String> toRetire = new LinkedHashMap<>();
        for (WatchRecord record : subscriptionService.findOverAge(properties.getSubscription().getMaxAge())) {
            toRetire.putIfAbsent(record.getPrincipalId(), "older than " + properties.getSubscription().getMaxAge());
        }
        int maxErrors = properties.getSubscription().getMaxErrorCount();
        for (WatchRecord record : subscriptionService.findOverErrorThreshold(maxErrors)) {
            toRetire.putIfAbsent(record.getPrincipalId(), record.getStats().getErrorCount() + " errors");
        }

        int retired = 0;
        for (Map.Entry<String, String> entry : toRetire.entrySet()) {
            try {
                subscriptionService.stop(entry.getKey());
                retired++;
                details.add("retired " + entry.getKey() + " (" + entry.getValue() + ")");
                log.info("Retired watch of {}: {}", entry.getKey(), entry.getValue());
            } catch (RuntimeException e) {
                details.add("retire failed " + entry.getKey() + ": " + e.getMessage());
                log.error("Could not retire watch of {}: {}", entry.getKey(), e.getMessage(), e);
            }
        }
        return retired;
    }
}
