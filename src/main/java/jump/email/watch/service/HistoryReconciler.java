package jump.email.watch.service;

import com.google.api.services.gmail.model.Message;
import jump.email.watch.config.WatchProperties;
import jump.email.watch.entity.WatchErrorKind;
import jump.email.watch.entity.WatchRecord;
import jump.email.watch.exception.CredentialException;
import jump.email.watch.exception.WatchLockTimeoutException;
import jump.email.watch.model.CanonicalMessage;
import jump.email.watch.model.MailboxHandle;
import jump.email.watch.model.MessageRef;
import jump.email.watch.model.NotificationEvent;
import jump.email.watch.model.NotificationSource;
import jump.email.watch.model.ProviderResult;
import jump.email.watch.model.RealtimeEventKind;
import jump.email.watch.model.ReconcileOutcome;
import jump.email.watch.model.ReconcileStatus;
import jump.email.watch.model.SourceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a mailbox-change notification into newly arrived messages.
 *
 * <p>Per principal, cycles run one at a time. The stored cursor is compared with the
 * notified history id, the gap up to {@code min(notified, current)} is fetched, each new
 * message goes to triage and to the principal's realtime stream, and only then is the
 * cursor advanced. Provider failures are classified and recorded on the watch; nothing is
 * thrown to the caller.
 */
@Slf4j
@Service
public class HistoryReconciler {
    private final WatchRecordStore store;
    private final SessionRegistry sessionRegistry;
    private final OrphanWatchSupervisor orphanSupervisor;
    private final PrincipalLockService lockService;
    private final CredentialProvider credentialProvider;
    private final MailboxProvider mailboxProvider;
    private final CanonicalMessageMapper messageMapper;
    private final AutomatedSenderFilter senderFilter;
    private final TriageClient triageClient;
    private final RealtimePublisher realtimePublisher;
    private final WatchProperties properties;

    public HistoryReconciler(WatchRecordStore store,
                             SessionRegistry sessionRegistry,
                             OrphanWatchSupervisor orphanSupervisor,
                             PrincipalLockService lockService,
                             CredentialProvider credentialProvider,
                             MailboxProvider mailboxProvider,
                             CanonicalMessageMapper messageMapper,
                             AutomatedSenderFilter senderFilter,
                             TriageClient triageClient,
                             RealtimePublisher realtimePublisher,
                             WatchProperties properties) {
        this.store = store;
        this.sessionRegistry = sessionRegistry;
        this.orphanSupervisor = orphanSupervisor;
        this.lockService = lockService;
        this.credentialProvider = credentialProvider;
        this.mailboxProvider = mailboxProvider;
        this.messageMapper = messageMapper;
        this.senderFilter = senderFilter;
        this.triageClient = triageClient;
        this.realtimePublisher = realtimePublisher;
        this.properties = properties;
    }

    public ReconcileOutcome reconcile(NotificationEvent event, NotificationSource source) {
        String account = event.getProviderAccountId();
        Optional<WatchRecord> active = store.findActiveByAccount(account);
        if (active.isEmpty()) {
            log.info("No active watch for {} (historyId {}, delivery {}); routing to orphan cleanup",
                account, event.getNotifiedCursor(), event.getDeliveryId());
            orphanSupervisor.handleUnknownAccount(event);
            return ReconcileOutcome.of(ReconcileStatus.ORPHANED, null);
        }

        WatchRecord gate = active.get();
        String principalId = gate.getPrincipalId();
        if (!sessionRegistry.hasListeners(principalId)) {
            log.info("No live listener for {} ({}); skipping historyId {} and cleaning up",
                principalId, account, event.getNotifiedCursor());
            orphanSupervisor.handleInactivePrincipal(principalId, account);
            return ReconcileOutcome.of(ReconcileStatus.NO_LISTENERS, gate.cursorValue());
        }

        try {
            return lockService.withLock(principalId, () -> reconcileLocked(gate.getId(), event, source));
        } catch (WatchLockTimeoutException | OptimisticLockingFailureException e) {
            log.warn("Concurrent update of watch {} for {}; leaving historyId {} for a later cycle: {}",
                gate.getSubscriptionId(), principalId, event.getNotifiedCursor(), e.getMessage());
            recordErrorQuietly(gate.getId(), WatchErrorKind.TRANSIENT, e.getMessage());
            return ReconcileOutcome.of(ReconcileStatus.TRANSIENT_FAILURE, gate.cursorValue());
        } catch (RuntimeException e) {
            log.error("Reconciliation of {} for {} failed: {}", account, principalId, e.getMessage(), e);
            recordErrorQuietly(gate.getId(), WatchErrorKind.TRANSIENT, e.getMessage());
            return ReconcileOutcome.of(ReconcileStatus.TRANSIENT_FAILURE, gate.cursorValue());
        }
    }

    private ReconcileOutcome reconcileLocked(String watchId, NotificationEvent event, NotificationSource source) {
        WatchRecord record = store.load(watchId);
        if (!record.isActive()) {
            // stopped while this cycle waited for the lock
            orphanSupervisor.handleUnknownAccount(event);
            return ReconcileOutcome.of(ReconcileStatus.ORPHANED, record.cursorValue());
        }
        record = store.recordNotification(watchId);

        BigInteger local = record.cursorValue();
        BigInteger notified = event.getNotifiedCursor();
        if (notified.compareTo(local) <= 0) {
            log.debug("Duplicate or out-of-order notification for {}: historyId {} <= cursor {}",
                record.getProviderAccountId(), notified, local);
            return ReconcileOutcome.of(ReconcileStatus.DUPLICATE, local);
        }

        MailboxHandle handle;
        try {
            handle = credentialProvider.getAuthenticatedHandle(record.getPrincipalId());
        } catch (CredentialException e) {
            return authFailure(record, e.getMessage());
        }

        ProviderResult<BigInteger> currentResult = mailboxProvider.getCurrentCursor(handle);
        if (!currentResult.isOk()) {
            return providerFailure(record, currentResult);
        }
        BigInteger current = currentResult.getData();
        if (current.subtract(local).compareTo(BigInteger.valueOf(properties.getReconcile().getStaleCursorGap())) > 0) {
            return staleReset(record, local, current);
        }

        BigInteger target = notified.min(current);
        if (target.compareTo(local) <= 0) {
            log.debug("Provider for {} is at {} which is not past cursor {}; nothing to fetch",
                record.getProviderAccountId(), current, local);
            store.advanceCursor(watchId, target, 0);
            return ReconcileOutcome.processed(0, local);
        }

        ProviderResult<List<MessageRef>> changes = mailboxProvider.listChanges(handle, local, target, record.getLabelFilter());
        if (changes.isNotFound()) {
            return staleReset(record, local, current);
        }
        if (!changes.isOk()) {
            return providerFailure(record, changes);
        }

        SourceContext context = new SourceContext(record.getPrincipalId(), record.getProviderAccountId(),
            record.getSubscriptionId(), source, event.getDeliveryId());
        int processed = 0;
        for (MessageRef ref : changes.getData()) {
            ProviderResult<Message> message = mailboxProvider.getMessage(handle, ref);
            if (message.isAuthFailure()) {
                // abort with the cursor untouched so the range is retried after re-authorization
                return authFailure(record, message.getErrorMessage());
            }
            if (!message.isOk()) {
                log.warn("Skipping message {} for {}: {} {}", ref.getId(), record.getProviderAccountId(),
                    message.getOutcome(), message.getErrorMessage());
                continue;
            }
            if (emit(message.getData(), record, context)) {
                processed++;
            }
        }

        store.advanceCursor(watchId, target, processed);
        log.info("Reconciled {} ({}) via {}: {} -> {}, {} of {} new messages emitted",
            record.getProviderAccountId(), record.getPrincipalId(), source, local, target, processed, changes.getData().size());
        return ReconcileOutcome.processed(processed, target);
    }

    private boolean emit(Message raw, WatchRecord record, SourceContext context) {
        try {
            CanonicalMessage message = messageMapper.map(raw, record.getPrincipalId(), record.getProviderAccountId());
            if (senderFilter.shouldSkip(message)) {
                log.info("Skipping automated email {} \"{}\" from {}", message.getId(), message.getSubject(), message.getFrom());
                return false;
            }
            triageClient.submit(message, context);
            realtimePublisher.publish(record.getPrincipalId(), RealtimeEventKind.EMAIL_RECEIVED, message);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to process message {} for {}: {}", raw.getId(), record.getProviderAccountId(), e.getMessage(), e);
            return false;
        }
    }

    private ReconcileOutcome staleReset(WatchRecord record, BigInteger local, BigInteger current) {
        log.warn("stale_cursor account={} principal={} cursor={} providerCurrent={}; resetting without fetching history",
            record.getProviderAccountId(), record.getPrincipalId(), local, current);
        store.resetCursor(record.getId(), current);
        return ReconcileOutcome.of(ReconcileStatus.STALE_CURSOR_RESET, current);
    }

    private ReconcileOutcome providerFailure(WatchRecord record, ProviderResult<?> result) {
        if (result.isAuthFailure()) {
            return authFailure(record, result.getErrorMessage());
        }
        log.warn("Transient provider error for {} ({}); cursor stays at {}: {}",
            record.getProviderAccountId(), result.getOutcome(), record.getCursor(), result.getErrorMessage());
        store.recordError(record.getId(), WatchErrorKind.TRANSIENT, result.getErrorMessage());
        return ReconcileOutcome.of(ReconcileStatus.TRANSIENT_FAILURE, record.cursorValue());
    }

    private ReconcileOutcome authFailure(WatchRecord record, String reason) {
        log.warn("Authorization failed for {} ({}); re-authorization required: {}",
            record.getProviderAccountId(), record.getPrincipalId(), reason);
        store.recordError(record.getId(), WatchErrorKind.AUTH, reason);
        Map<String, Object> payload = new HashMap<>();
        payload.put("providerAccountId", record.getProviderAccountId());
        payload.put("reason", reason);
        try {
            realtimePublisher.publish(record.getPrincipalId(), RealtimeEventKind.REAUTHORIZATION_REQUIRED, payload);
        } catch (RuntimeException e) {
            log.warn("Could not signal re-authorization to {}: {}", record.getPrincipalId(), e.getMessage());
        }
        return ReconcileOutcome.of(ReconcileStatus.AUTH_FAILURE, record.cursorValue());
    }

    private void recordErrorQuietly(String watchId, WatchErrorKind kind, String message) {
        try {
            store.recordError(watchId, kind, message);
        } catch (RuntimeException e) {
            log.warn("Could not record error on watch {}: {}", watchId, e.getMessage());
        }
    }
}
