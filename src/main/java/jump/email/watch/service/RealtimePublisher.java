package jump.email.watch.service;

import jump.email.watch.model.RealtimeEventKind;

/**
 * Best-effort push of events to a principal's live listeners. Must not block the caller.
 */
public interface RealtimePublisher {
    void publish(String principalId, RealtimeEventKind kind, Object payload);
}
