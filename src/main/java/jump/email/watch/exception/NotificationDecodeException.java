package jump.email.watch.exception;

/**
 * A push envelope or pulled message that cannot be turned into a notification.
 * Nothing has been written when this is thrown.
 */
public class NotificationDecodeException extends RuntimeException {
    public NotificationDecodeException(String message) {
        super(message);
    }

    public NotificationDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
