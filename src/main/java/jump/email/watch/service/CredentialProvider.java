package jump.email.watch.service;

import jump.email.watch.exception.CredentialException;
import jump.email.watch.model.MailboxHandle;

/**
 * Supplies a valid, refreshed mailbox handle for a principal.
 */
public interface CredentialProvider {
    /**
     * @throws CredentialException if the principal has no usable credential
     */
    MailboxHandle getAuthenticatedHandle(String principalId);
}
