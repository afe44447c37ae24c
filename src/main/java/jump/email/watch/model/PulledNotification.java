package jump.email.watch.model;

import lombok.Value;

/**
 * A message taken from the backup pull subscription, still awaiting acknowledgement.
 */
@Value
public class PulledNotification {
    String ackId;
    String messageId;
    byte[] data;
    String publishTime;
}
