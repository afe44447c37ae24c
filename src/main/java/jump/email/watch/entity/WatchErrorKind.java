package jump.email.watch.entity;

/**
 * Category of the last error recorded against a watch.
 */
public enum WatchErrorKind {
    /** Credential expired or revoked; needs re-authorization. */
    AUTH,
    /** Timeout, rate limit or other retryable provider failure. */
    TRANSIENT,
    /** Provider refused to create the replacement watch. */
    RENEWAL
}
