package jump.email.watch.model;

public enum ReconcileStatus {
    PROCESSED,
    DUPLICATE,
    STALE_CURSOR_RESET,
    ORPHANED,
    NO_LISTENERS,
    AUTH_FAILURE,
    TRANSIENT_FAILURE;

    /**
     * Whether a pulled message with this outcome can be acknowledged. Auth and transient
     * failures stay on the subscription for redelivery.
     */
    public boolean isAcknowledgeable() {
        return this != AUTH_FAILURE && this != TRANSIENT_FAILURE;
    }
}
