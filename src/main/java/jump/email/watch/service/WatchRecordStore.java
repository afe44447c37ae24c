package jump.email.watch.service;

import jump.email.watch.entity.WatchErrorKind;
import jump.email.watch.entity.WatchRecord;
import jump.email.watch.entity.WatchState;
import jump.email.watch.exception.WatchNotFoundException;
import jump.email.watch.model.WatchStatistics;
import jump.email.watch.repository.WatchRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable watch state. Each mutation reloads the record by id so callers never write back a
 * stale copy, and the cursor is only ever moved forward.
 */
@Slf4j
@Service
public class WatchRecordStore {
    private final WatchRecordRepository repository;
    private final Clock clock;

    public WatchRecordStore(WatchRecordRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public Optional<WatchRecord> findActiveByAccount(String providerAccountId) {
        return repository.findFirstByProviderAccountIdAndActiveTrue(providerAccountId);
    }

    public Optional<WatchRecord> findActiveByPrincipal(String principalId) {
        return repository.findFirstByPrincipalIdAndActiveTrue(principalId);
    }

    public Optional<WatchRecord> findLatestByAccount(String providerAccountId) {
        return repository.findFirstByProviderAccountIdOrderByCreatedAtDesc(providerAccountId);
    }

    public Optional<WatchRecord> findLatestByPrincipal(String principalId) {
        return repository.findFirstByPrincipalIdOrderByCreatedAtDesc(principalId);
    }

    public Optional<WatchRecord> findBySubscriptionId(String subscriptionId) {
        return repository.findBySubscriptionId(subscriptionId);
    }

    public List<WatchRecord> findActive() {
        return repository.findByActiveTrue();
    }

    public List<WatchRecord> findActiveExpiringBefore(Instant cutoff) {
        return repository.findByActiveTrueAndExpiresAtBefore(cutoff);
    }

    public List<WatchRecord> findActiveCreatedBefore(Instant cutoff) {
        return repository.findByActiveTrueAndCreatedAtBefore(cutoff);
    }

    public List<WatchRecord> findActiveWithErrorCountAtLeast(int threshold) {
        return repository.findActiveWithErrorCountAtLeast(threshold);
    }

    @Transactional
    public WatchRecord save(WatchRecord record) {
        return repository.save(record);
    }

    public WatchRecord load(String id) {
        return repository.findById(id)
            .orElseThrow(() -> new WatchNotFoundException("Watch record " + id + " not found"));
    }

    @Transactional
    public WatchRecord recordNotification(String id) {
        WatchRecord record = load(id);
        record.getStats().setNotificationsReceived(record.getStats().getNotificationsReceived() + 1);
        return repository.save(record);
    }

    /**
     * Moves the cursor to {@code target} if that is ahead of the stored one, counts the
     * processed messages and clears an ERRORING state.
     */
    @Transactional
    public WatchRecord advanceCursor(String id, BigInteger target, int processedCount) {
        WatchRecord record = load(id);
        BigInteger current = record.cursorValue();
        if (target.compareTo(current) > 0) {
            record.setCursor(target.toString());
        } else {
            log.debug("Cursor of watch {} stays at {} (offered {})", id, current, target);
        }
        record.getStats().setMessagesProcessed(record.getStats().getMessagesProcessed() + processedCount);
        if (record.getState() == WatchState.ERRORING) {
            record.transitionTo(WatchState.ACTIVE);
        }
        return repository.save(record);
    }

    /**
     * Jumps a stale cursor to the provider's current history id. Not an error.
     */
    @Transactional
    public WatchRecord resetCursor(String id, BigInteger providerCurrent) {
        WatchRecord record = load(id);
        BigInteger previous = record.cursorValue();
        if (providerCurrent.compareTo(previous) > 0) {
            record.setCursor(providerCurrent.toString());
            log.warn("Stale cursor reset for watch {} ({}): {} -> {}", id, record.getProviderAccountId(), previous, providerCurrent);
        }
        return repository.save(record);
    }

    @Transactional
    public WatchRecord recordError(String id, WatchErrorKind kind, String message) {
        WatchRecord record = load(id);
        record.getStats().recordError(kind, message, clock.instant());
        if (record.getState() != WatchState.STOPPED) {
            record.transitionTo(WatchState.ERRORING);
        }
        return repository.save(record);
    }

    @Transactional
    public WatchRecord deactivate(String id) {
        WatchRecord record = load(id);
        if (record.getState() == WatchState.STOPPED) {
            return record;
        }
        record.transitionTo(WatchState.STOPPED);
        record.setStoppedAt(clock.instant());
        return repository.save(record);
    }

    public WatchStatistics statistics(Duration expiryWindow) {
        Instant now = clock.instant();
        return WatchStatistics.builder()
            .activeWatches(repository.countByActiveTrue())
            .inactiveWatches(repository.countByActiveFalse())
            .watchesWithErrors(repository.countActiveWithErrors())
            .watchesInAuthError(repository.countByStateAndLastErrorKind(WatchState.ERRORING, WatchErrorKind.AUTH))
            .expiringWithinWindow(repository.countByActiveTrueAndExpiresAtBefore(now.plus(expiryWindow)))
            .alreadyExpired(repository.countByActiveTrueAndExpiresAtBefore(now))
            .totalNotificationsReceived(repository.sumNotificationsReceived())
            .totalMessagesProcessed(repository.sumMessagesProcessed())
            .build();
    }
}
