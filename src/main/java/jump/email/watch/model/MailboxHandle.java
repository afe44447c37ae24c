package jump.email.watch.model;

import lombok.ToString;
import lombok.Value;

/**
 * Authenticated access to one principal's mailbox.
 */
@Value
@ToString(exclude = "accessToken")
public class MailboxHandle {
    String principalId;
    String emailAddress;
    String accessToken;
}
