package jump.email.watch.service;

import jump.email.watch.model.PulledNotification;

import java.util.List;

/**
 * Backup queue of mailbox notifications. Anything not acknowledged is redelivered.
 */
public interface PullNotificationSource {
    List<PulledNotification> pull(int maxMessages);

    void acknowledge(List<String> ackIds);

    boolean isReachable();
}
