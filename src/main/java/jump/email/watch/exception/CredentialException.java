package jump.email.watch.exception;

import lombok.Getter;

/**
 * No usable credential for a principal; the user has to sign in again.
 */
@Getter
public class CredentialException extends RuntimeException {
    private final String principalId;

    public CredentialException(String principalId, String message) {
        super(message);
        this.principalId = principalId;
    }

    public CredentialException(String principalId, String message, Throwable cause) {
        super(message, cause);
        this.principalId = principalId;
    }
}
