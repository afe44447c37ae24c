package jump.email.watch.model;

import lombok.Value;

/**
 * Where a message submitted to triage came from.
 */
@Value
public class SourceContext {
    String principalId;
    String providerAccountId;
    String subscriptionId;
    NotificationSource source;
    String deliveryId;
}
