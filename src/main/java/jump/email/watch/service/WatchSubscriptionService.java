package jump.email.watch.service;

import jump.email.watch.config.WatchProperties;
import jump.email.watch.entity.LabelFilter;
import jump.email.watch.entity.WatchErrorKind;
import jump.email.watch.entity.WatchRecord;
import jump.email.watch.entity.WatchState;
import jump.email.watch.exception.CredentialException;
import jump.email.watch.exception.WatchAlreadyActiveException;
import jump.email.watch.exception.WatchNotFoundException;
import jump.email.watch.exception.WatchOperationException;
import jump.email.watch.model.BulkStopSummary;
import jump.email.watch.model.MailboxHandle;
import jump.email.watch.model.ProviderResult;
import jump.email.watch.model.WatchCreated;
import jump.email.watch.model.WatchStatusView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Creates, renews and stops Gmail watches.
 *
 * <p>Local state always wins: a stop deactivates the record whatever the provider answers,
 * and a provider 404 on stop counts as already stopped. All mutations for a principal run
 * under its {@link PrincipalLockService} lock.
 */
@Slf4j
@Service
public class WatchSubscriptionService {
    private final WatchRecordStore store;
    private final MailboxProvider mailboxProvider;
    private final CredentialProvider credentialProvider;
    private final PrincipalLockService lockService;
    private final WatchProperties properties;
    private final Clock clock;

    public WatchSubscriptionService(WatchRecordStore store,
                                    MailboxProvider mailboxProvider,
                                    CredentialProvider credentialProvider,
                                    PrincipalLockService lockService,
                                    WatchProperties properties,
                                    Clock clock) {
        this.store = store;
        this.mailboxProvider = mailboxProvider;
        this.credentialProvider = credentialProvider;
        this.lockService = lockService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Starts watching the principal's mailbox from its current history id.
     *
     * @throws WatchAlreadyActiveException if the principal already has an active watch
     * @throws CredentialException if the principal has no usable credential
     * @throws WatchOperationException if Gmail refuses the watch
     */
    public WatchRecord create(String principalId, LabelFilter labelFilter) {
        LabelFilter filter = labelFilter != null ? labelFilter : LabelFilter.inbox();
        return lockService.withLock(principalId, () -> {
            if (store.findActiveByPrincipal(principalId).isPresent()) {
                throw new WatchAlreadyActiveException(principalId);
            }
            MailboxHandle handle = credentialProvider.getAuthenticatedHandle(principalId);
            // Gmail keeps one watch per mailbox, so a second principal on the same address would steal it
            Optional<WatchRecord> sameMailbox = store.findActiveByAccount(handle.getEmailAddress());
            if (sameMailbox.isPresent()) {
                throw new WatchAlreadyActiveException(sameMailbox.get().getPrincipalId(), handle.getEmailAddress());
            }

            Instant now = clock.instant();
            WatchRecord record = new WatchRecord();
            record.setPrincipalId(principalId);
            record.setProviderAccountId(handle.getEmailAddress());
            record.setLabelFilter(filter);
            record.setCreatedAt(now);
            String id = store.save(record).getId();

            boolean providerWatchCreated = false;
            try {
                ProviderResult<WatchCreated> result = mailboxProvider.createWatch(handle, filter);
                if (!result.isOk()) {
                    log.error("Failed to create Gmail watch for {} ({}): {}", principalId, handle.getEmailAddress(), result.getErrorMessage());
                    throw new WatchOperationException("Failed to create watch for " + handle.getEmailAddress() + ": " + result.getErrorMessage());
                }
                providerWatchCreated = true;
                WatchCreated created = result.getData();
                BigInteger initialCursor = initialCursor(handle, created);

                record = store.load(id);
                record.setSubscriptionId(created.getSubscriptionId());
                record.setCursor(initialCursor.toString());
                record.setExpiresAt(expiry(created, now));
                record.transitionTo(WatchState.ACTIVE);
                record = store.save(record);
            } catch (RuntimeException e) {
                abandonProvisioning(id, handle, providerWatchCreated);
                if (e instanceof WatchOperationException) {
                    throw e;
                }
                log.error("Could not record new watch for {} ({}): {}", principalId, handle.getEmailAddress(), e.getMessage(), e);
                throw new WatchOperationException("Failed to create watch for " + handle.getEmailAddress() + ": " + e.getMessage(), e);
            }
            log.info("Watch {} active for {} ({}), cursor {}, expires {}",
                record.getSubscriptionId(), principalId, record.getProviderAccountId(), record.getCursor(), record.getExpiresAt());
            return record;
        });
    }

    /**
     * Undoes a half-finished create: the provisioning record is stopped and a provider
     * watch that nothing will track is cancelled.
     */
    private void abandonProvisioning(String id, MailboxHandle handle, boolean providerWatchCreated) {
        if (providerWatchCreated) {
            ProviderResult<Void> stopped = mailboxProvider.stopWatch(handle);
            if (!stopped.isOk() && !stopped.isNotFound()) {
                log.warn("Could not cancel untracked Gmail watch for {}: {}", handle.getEmailAddress(), stopped.getErrorMessage());
            }
        }
        try {
            store.deactivate(id);
        } catch (RuntimeException e) {
            log.error("Could not stop provisioning watch record {}: {}", id, e.getMessage(), e);
        }
    }

    /**
     * Replaces the provider watch behind a record, keeping its cursor and label filter.
     */
    public WatchRecord renew(String subscriptionId) {
        WatchRecord existing = store.findBySubscriptionId(subscriptionId)
            .orElseThrow(() -> new WatchNotFoundException("No watch with subscription " + subscriptionId));

        return lockService.withLock(existing.getPrincipalId(), () -> {
            WatchRecord record = store.load(existing.getId());
            if (!record.isActive()) {
                throw new WatchOperationException("Watch " + subscriptionId + " is stopped and cannot be renewed");
            }
            record.transitionTo(WatchState.RENEWING);
            record = store.save(record);
            String id = record.getId();

            MailboxHandle handle;
            try {
                handle = credentialProvider.getAuthenticatedHandle(record.getPrincipalId());
            } catch (CredentialException e) {
                store.recordError(id, WatchErrorKind.AUTH, e.getMessage());
                throw new WatchOperationException("Cannot renew watch " + subscriptionId + ": " + e.getMessage(), e);
            }

            ProviderResult<Void> stopped = mailboxProvider.stopWatch(handle);
            if (!stopped.isOk() && !stopped.isNotFound()) {
                log.warn("Could not stop old watch {} before renewal: {}", subscriptionId, stopped.getErrorMessage());
            }

            ProviderResult<WatchCreated> result = mailboxProvider.createWatch(handle, record.getLabelFilter());
            if (!result.isOk()) {
                WatchErrorKind kind = result.isAuthFailure() ? WatchErrorKind.AUTH : WatchErrorKind.RENEWAL;
                store.recordError(id, kind, "Renewal failed: " + result.getErrorMessage());
                log.error("Renewal of watch {} for {} failed: {}", subscriptionId, record.getPrincipalId(), result.getErrorMessage());
                throw new WatchOperationException("Failed to renew watch " + subscriptionId + ": " + result.getErrorMessage());
            }

            WatchCreated created = result.getData();
            Instant now = clock.instant();
            record = store.load(id);
            record.setSubscriptionId(created.getSubscriptionId());
            record.setExpiresAt(expiry(created, now));
            record.setLastRenewedAt(now);
            record.getStats().clearErrors();
            record.transitionTo(WatchState.ACTIVE);
            record = store.save(record);
            log.info("Watch {} renewed as {} for {}, expires {}", subscriptionId, record.getSubscriptionId(),
                record.getPrincipalId(), record.getExpiresAt());
            return record;
        });
    }

    public WatchRecord renewForPrincipal(String principalId) {
        WatchRecord record = store.findActiveByPrincipal(principalId)
            .orElseThrow(() -> new WatchNotFoundException("No active watch for principal " + principalId));
        return renew(record.getSubscriptionId());
    }

    /**
     * Stops the principal's watch. The provider stop is best effort; the local record is
     * deactivated regardless.
     *
     * @return false only if the principal never had a watch
     */
    public boolean stop(String principalId) {
        Optional<WatchRecord> target = store.findActiveByPrincipal(principalId);
        if (target.isEmpty()) {
            target = store.findLatestByPrincipal(principalId);
        }
        if (target.isEmpty()) {
            return false;
        }
        String id = target.get().getId();

        lockService.withLock(principalId, () -> {
            WatchRecord record = store.load(id);
            stopProviderWatch(record);
            store.deactivate(id);
            log.info("Watch {} for {} stopped", record.getSubscriptionId(), principalId);
        });
        return true;
    }

    private void stopProviderWatch(WatchRecord record) {
        try {
            MailboxHandle handle = credentialProvider.getAuthenticatedHandle(record.getPrincipalId());
            ProviderResult<Void> result = mailboxProvider.stopWatch(handle);
            if (result.isOk() || result.isNotFound()) {
                log.debug("Provider watch for {} is gone ({})", record.getProviderAccountId(), result.getOutcome());
            } else {
                log.warn("Provider stop for {} failed ({}); deactivating locally anyway: {}",
                    record.getProviderAccountId(), result.getOutcome(), result.getErrorMessage());
            }
        } catch (CredentialException e) {
            log.warn("No credentials to stop provider watch for {}; deactivating locally: {}",
                record.getProviderAccountId(), e.getMessage());
        }
    }

    /**
     * Active records whose provider expiry is less than {@code window} away.
     */
    public List<WatchRecord> findNeedingRenewal(Duration window) {
        Instant now = clock.instant();
        return store.findActiveExpiringBefore(now.plus(window)).stream()
            .filter(record -> record.isExpiringWithin(now, window))
            .collect(Collectors.toList());
    }

    public List<WatchRecord> findOverAge(Duration maxAge) {
        return store.findActiveCreatedBefore(clock.instant().minus(maxAge));
    }

    public List<WatchRecord> findOverErrorThreshold(int maxErrors) {
        return store.findActiveWithErrorCountAtLeast(maxErrors);
    }

    public Optional<WatchStatusView> getStatus(String principalId, String authenticatedEmail) {
        Optional<WatchRecord> record = store.findActiveByPrincipal(principalId);
        if (record.isEmpty()) {
            record = store.findLatestByPrincipal(principalId);
        }
        return record.map(r -> WatchStatusView.from(r, authenticatedEmail));
    }

    public List<WatchStatusView> listActive() {
        return store.findActive().stream()
            .map(record -> WatchStatusView.from(record, null))
            .collect(Collectors.toList());
    }

    /**
     * Stops every active watch, one principal at a time. Used for incident recovery.
     */
    public BulkStopSummary stopAll() {
        List<WatchRecord> active = store.findActive();
        int stopped = 0;
        List<String> failures = new ArrayList<>();
        for (WatchRecord record : active) {
            try {
                if (stop(record.getPrincipalId())) {
                    stopped++;
                }
            } catch (RuntimeException e) {
                log.error("Bulk stop failed for {}: {}", record.getPrincipalId(), e.getMessage(), e);
                failures.add(record.getPrincipalId() + ": " + e.getMessage());
            }
        }
        log.info("Bulk stop finished: {}/{} stopped, {} failed", stopped, active.size(), failures.size());
        return new BulkStopSummary(active.size(), stopped, failures.size(), failures);
    }

    private BigInteger initialCursor(MailboxHandle handle, WatchCreated created) {
        BigInteger cursor = created.getInitialCursor();
        if (cursor != null && cursor.signum() > 0) {
            return cursor;
        }
        ProviderResult<BigInteger> current = mailboxProvider.getCurrentCursor(handle);
        if (!current.isOk()) {
            throw new WatchOperationException("Could not read current history id: " + current.getErrorMessage());
        }
        return current.getData();
    }

    private Instant expiry(WatchCreated created, Instant now) {
        return created.getExpiresAt() != null
            ? created.getExpiresAt()
            : now.plus(properties.getSubscription().getValidity());
    }
}
