package jump.email.watch.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * A decoded mailbox-change notification. {@code deliveryId} is the Pub/Sub message id and
 * is only used for logging; deduplication is cursor based.
 */
@Value
@Builder
public class NotificationEvent {
    String providerAccountId;
    BigInteger notifiedCursor;
    Instant receivedAt;
    String deliveryId;
}
