package jump.email.watch.exception;

/**
 * A provider-side watch operation (create or renew) failed.
 */
public class WatchOperationException extends RuntimeException {
    public WatchOperationException(String message) {
        super(message);
    }

    public WatchOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
