package jump.email.watch.service;

import jump.email.watch.config.WatchProperties;
import jump.email.watch.exception.NotificationDecodeException;
import jump.email.watch.model.NotificationEvent;
import jump.email.watch.model.NotificationSource;
import jump.email.watch.model.PullCycleSummary;
import jump.email.watch.model.PulledNotification;
import jump.email.watch.model.ReconcileOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Backup path for notifications that push delivery missed. Pulled messages go through the
 * same reconciler as pushes; auth and transient failures are left unacknowledged so
 * Pub/Sub redelivers them.
 */
@Slf4j
@Service
public class PullNotificationService {
    private final PullNotificationSource source;
    private final NotificationDecoder decoder;
    private final HistoryReconciler reconciler;
    private final WatchProperties properties;

    public PullNotificationService(PullNotificationSource source,
                                   NotificationDecoder decoder,
                                   HistoryReconciler reconciler,
                                   WatchProperties properties) {
        this.source = source;
        this.decoder = decoder;
        this.reconciler = reconciler;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${watch.pull.fixed-delay-ms:300000}", initialDelayString = "${watch.pull.initial-delay-ms:60000}")
    public void scheduledPull() {
        if (!properties.getPull().isEnabled()) {
            return;
        }
        runPullCycle();
    }

    public PullCycleSummary runPullCycle() {
        List<PulledNotification> pulled;
        try {
            pulled = source.pull(properties.getPull().getMaxMessages());
        } catch (RuntimeException e) {
            log.error("Pull cycle failed: {}", e.getMessage(), e);
            return PullCycleSummary.failed(e.getMessage());
        }
        if (pulled.isEmpty()) {
            return new PullCycleSummary(0, 0, 0, 0, 0, null);
        }

        List<String> ackIds = new ArrayList<>();
        int retained = 0;
        int decodeFailures = 0;
        int processed = 0;
        for (PulledNotification notification : pulled) {
            NotificationEvent event;
            try {
                event = decoder.decodePayload(notification.getData(), notification.getMessageId(), notification.getPublishTime());
            } catch (NotificationDecodeException e) {
                // redelivery would fail the same way
                log.warn("Dropping undecodable pulled message {}: {}", notification.getMessageId(), e.getMessage());
                ackIds.add(notification.getAckId());
                decodeFailures++;
                continue;
            }

            ReconcileOutcome outcome = reconciler.reconcile(event, NotificationSource.PULL);
            processed += outcome.getProcessedCount();
            if (outcome.getStatus().isAcknowledgeable()) {
                ackIds.add(notification.getAckId());
            } else {
                retained++;
                log.info("Leaving pulled message {} for redelivery ({})", notification.getMessageId(), outcome.getStatus());
            }
        }

        int acknowledged = 0;
        if (!ackIds.isEmpty()) {
            try {
                source.acknowledge(ackIds);
                acknowledged = ackIds.size();
            } catch (RuntimeException e) {
                log.error("Failed to acknowledge {} pulled messages: {}", ackIds.size(), e.getMessage(), e);
            }
        }
        log.info("Pull cycle: {} pulled, {} acknowledged, {} left for redelivery, {} undecodable, {} messages emitted",
            pulled.size(), acknowledged, retained, decodeFailures, processed);
        return new PullCycleSummary(pulled.size(), acknowledged, retained, decodeFailures, processed, null);
    }
}
