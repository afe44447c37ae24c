package jump.email.watch.service;

import jump.email.watch.entity.WatchRecord;
import jump.email.watch.exception.CredentialException;
import jump.email.watch.model.MailboxHandle;
import jump.email.watch.model.NotificationEvent;
import jump.email.watch.model.OrphanWatchDetectedEvent;
import jump.email.watch.model.ProviderResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Cleans up watches that deliver notifications nobody should receive. Runs off the request
 * path on {@code watchCleanupExecutor} and never throws.
 */
@Slf4j
@Service
public class OrphanWatchSupervisor {
    private final WatchRecordStore store;
    private final WatchSubscriptionService subscriptionService;
    private final CredentialProvider credentialProvider;
    private final MailboxProvider mailboxProvider;
    private final SessionRegistry sessionRegistry;
    private final ApplicationEventPublisher eventPublisher;

    public OrphanWatchSupervisor(WatchRecordStore store,
                                 WatchSubscriptionService subscriptionService,
                                 CredentialProvider credentialProvider,
                                 MailboxProvider mailboxProvider,
                                 SessionRegistry sessionRegistry,
                                 ApplicationEventPublisher eventPublisher) {
        this.store = store;
        this.subscriptionService = subscriptionService;
        this.credentialProvider = credentialProvider;
        this.mailboxProvider = mailboxProvider;
        this.sessionRegistry = sessionRegistry;
        this.eventPublisher = eventPublisher;
    }

    /**
     * A notification arrived for a mailbox with no active watch.
     */
    @Async("watchCleanupExecutor")
    public void handleUnknownAccount(NotificationEvent event) {
        String account = event.getProviderAccountId();
        try {
            Optional<WatchRecord> latest = store.findLatestByAccount(account);
            if (latest.isPresent()) {
                WatchRecord record = latest.get();
                log.info("orphan_watch kind=KNOWN_BUT_STOPPED account={} principal={} subscription={} stoppedAt={} historyId={} delivery={}",
                    account, record.getPrincipalId(), record.getSubscriptionId(), record.getStoppedAt(),
                    event.getNotifiedCursor(), event.getDeliveryId());
                String action = stopAtProvider(record.getPrincipalId(), account);
                publish(OrphanWatchDetectedEvent.Kind.KNOWN_BUT_STOPPED, account, record.getPrincipalId(),
                    record.getSubscriptionId(), action);
            } else {
                log.warn("orphan_watch kind=UNKNOWN_ACCOUNT account={} historyId={} delivery={} receivedAt={}: "
                        + "no principal or credential is known for this mailbox; it stops on provider expiry or an operator bulk stop",
                    account, event.getNotifiedCursor(), event.getDeliveryId(), event.getReceivedAt());
                publish(OrphanWatchDetectedEvent.Kind.UNKNOWN_ACCOUNT, account, null, null, "none");
            }
        } catch (RuntimeException e) {
            log.error("Orphan handling failed for {}: {}", account, e.getMessage(), e);
        }
    }

    /**
     * A notification arrived for a principal with no live listener.
     */
    @Async("watchCleanupExecutor")
    public void handleInactivePrincipal(String principalId, String providerAccountId) {
        try {
            stopIfStillInactive(principalId, providerAccountId);
        } catch (RuntimeException e) {
            log.error("Inactive-principal cleanup failed for {}: {}", principalId, e.getMessage(), e);
        }
    }

    /**
     * Stops every active watch whose principal has no live listener.
     *
     * @return number of watches stopped
     */
    public int cleanupInactiveWatches() {
        List<WatchRecord> active = store.findActive();
        int stopped = 0;
        for (WatchRecord record : active) {
            try {
                if (stopIfStillInactive(record.getPrincipalId(), record.getProviderAccountId())) {
                    stopped++;
                }
            } catch (RuntimeException e) {
                log.error("Cleanup of watch {} failed: {}", record.getSubscriptionId(), e.getMessage(), e);
            }
        }
        log.info("Inactive watch cleanup: {} of {} active watches stopped", stopped, active.size());
        return stopped;
    }

    @Scheduled(cron = "${watch.cleanup.cron:-}")
    public void scheduledCleanup() {
        cleanupInactiveWatches();
    }

    private boolean stopIfStillInactive(String principalId, String providerAccountId) {
        // a listener may have reconnected since the check that sent us here
        if (sessionRegistry.hasListeners(principalId)) {
            log.debug("Principal {} has listeners again; keeping its watch", principalId);
            return false;
        }
        Optional<WatchRecord> active = store.findActiveByPrincipal(principalId);
        String subscriptionId = active.map(WatchRecord::getSubscriptionId).orElse(null);
        boolean stopped = subscriptionService.stop(principalId);
        log.info("orphan_watch kind=NO_LISTENERS account={} principal={} subscription={} stopped={}",
            providerAccountId, principalId, subscriptionId, stopped);
        publish(OrphanWatchDetectedEvent.Kind.NO_LISTENERS, providerAccountId, principalId, subscriptionId,
            stopped ? "stopped" : "no-record");
        return stopped;
    }

    private String stopAtProvider(String principalId, String account) {
        try {
            MailboxHandle handle = credentialProvider.getAuthenticatedHandle(principalId);
            if (!account.equalsIgnoreCase(handle.getEmailAddress())) {
                return "skipped: credential is for " + handle.getEmailAddress();
            }
            ProviderResult<Void> result = mailboxProvider.stopWatch(handle);
            return "provider-stop " + result.getOutcome();
        } catch (CredentialException e) {
            log.warn("Cannot stop orphaned watch for {}: {}", account, e.getMessage());
            return "provider-stop skipped: " + e.getMessage();
        }
    }

    private void publish(OrphanWatchDetectedEvent.Kind kind, String account, String principalId,
                         String subscriptionId, String action) {
        eventPublisher.publishEvent(new OrphanWatchDetectedEvent(kind, account, principalId, subscriptionId, action));
    }
}
