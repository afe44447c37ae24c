package jump.email.watch.model;

import jump.email.watch.entity.LabelFilterBehavior;
import jump.email.watch.entity.WatchErrorKind;
import jump.email.watch.entity.WatchRecord;
import jump.email.watch.entity.WatchState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Status of one watch as shown to its principal and to operators.
 * {@code accountMismatch} is set when the signed-in mailbox differs from the watched one.
 */
@Value
@Builder
public class WatchStatusView {
    String principalId;
    String providerAccountId;
    String subscriptionId;
    boolean active;
    WatchState state;
    String cursor;
    List<String> labelIds;
    LabelFilterBehavior labelFilterBehavior;
    Instant expiresAt;
    Instant createdAt;
    Instant lastRenewedAt;
    long notificationsReceived;
    long messagesProcessed;
    int errorCount;
    String lastError;
    WatchErrorKind lastErrorKind;
    boolean accountMismatch;

    public static WatchStatusView from(WatchRecord record, String authenticatedEmail) {
        boolean mismatch = authenticatedEmail != null
            && !authenticatedEmail.equalsIgnoreCase(record.getProviderAccountId());
        return WatchStatusView.builder()
            .principalId(record.getPrincipalId())
            .providerAccountId(record.getProviderAccountId())
            .subscriptionId(record.getSubscriptionId())
            .active(record.isActive())
            .state(record.getState())
            .cursor(record.getCursor())
            .labelIds(record.getLabelFilter() != null ? record.getLabelFilter().getLabelIds() : List.of())
            .labelFilterBehavior(record.getLabelFilter() != null ? record.getLabelFilter().getBehavior() : null)
            .expiresAt(record.getExpiresAt())
            .createdAt(record.getCreatedAt())
            .lastRenewedAt(record.getLastRenewedAt())
            .notificationsReceived(record.getStats().getNotificationsReceived())
            .messagesProcessed(record.getStats().getMessagesProcessed())
            .errorCount(record.getStats().getErrorCount())
            .lastError(record.getStats().getLastError())
            .lastErrorKind(record.getStats().getLastErrorKind())
            .accountMismatch(mismatch)
            .build();
    }
}
