package jump.email.watch.exception;

import lombok.Getter;

@Getter
public class WatchLockTimeoutException extends RuntimeException {
    private final String principalId;

    public WatchLockTimeoutException(String principalId) {
        super("Timed out waiting for the watch lock of principal " + principalId);
        this.principalId = principalId;
    }
}
