package jump.email.watch.model;

public enum RealtimeEventKind {
    EMAIL_RECEIVED,
    REAUTHORIZATION_REQUIRED
}
