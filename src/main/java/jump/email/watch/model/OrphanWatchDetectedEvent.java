package jump.email.watch.model;

import lombok.Value;

/**
 * Published whenever a notification or sweep finds a watch nobody should be receiving.
 */
@Value
public class OrphanWatchDetectedEvent {

    public enum Kind {
        UNKNOWN_ACCOUNT,
        KNOWN_BUT_STOPPED,
        NO_LISTENERS
    }

    Kind kind;
    String providerAccountId;
    String principalId;
    String subscriptionId;
    String action;
}
