package jump.email.watch.service;

import java.util.Map;

/**
 * Counts live realtime listeners per principal. A principal with no listeners gets no
 * mailbox processing and its watch is treated as orphaned.
 */
public interface SessionRegistry {

    /**
     * @return the listener count after attaching
     */
    long attach(String principalId);

    /**
     * @return the listener count after detaching; the entry is removed at zero
     */
    long detach(String principalId);

    long listenerCount(String principalId);

    default boolean hasListeners(String principalId) {
        return listenerCount(principalId) > 0;
    }

    Map<String, Long> snapshot();
}
