package jump.email.watch.exception;

import jump.email.watch.entity.WatchState;
import lombok.Getter;

@Getter
public class InvalidWatchTransitionException extends RuntimeException {
    private final WatchState from;
    private final WatchState to;

    public InvalidWatchTransitionException(String watchId, WatchState from, WatchState to) {
        super("Watch " + watchId + " cannot move from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }
}
