package jump.email.watch.entity;

/**
 * State of the stored OAuth credential for a mailbox account.
 * EXPIRED and ERROR both mean the principal has to sign in again.
 */
public enum CredentialStatus {
    ACTIVE,
    EXPIRED,
    ERROR
}
