package jump.email.watch.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WatchStatistics {
    long activeWatches;
    long inactiveWatches;
    long watchesWithErrors;
    long watchesInAuthError;
    long expiringWithinWindow;
    long alreadyExpired;
    long totalNotificationsReceived;
    long totalMessagesProcessed;
}
