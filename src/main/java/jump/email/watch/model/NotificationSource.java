package jump.email.watch.model;

public enum NotificationSource {
    PUSH,
    PULL
}
