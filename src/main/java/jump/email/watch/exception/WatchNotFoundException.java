package jump.email.watch.exception;

public class WatchNotFoundException extends RuntimeException {
    public WatchNotFoundException(String message) {
        super(message);
    }
}
