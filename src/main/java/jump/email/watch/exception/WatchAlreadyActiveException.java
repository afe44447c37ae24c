package jump.email.watch.exception;

import lombok.Getter;

@Getter
public class WatchAlreadyActiveException extends RuntimeException {
    private final String principalId;

    public WatchAlreadyActiveException(String principalId) {
        super("An active watch already exists for principal " + principalId + "; stop it first");
        this.principalId = principalId;
    }

    public WatchAlreadyActiveException(String principalId, String providerAccountId) {
        super("Mailbox " + providerAccountId + " is already watched for principal " + principalId);
        this.principalId = principalId;
    }
}
