package jump.email.watch.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.Data;

import java.time.Instant;

/**
 * Running counters kept on each watch for health reporting. Counters only grow,
 * except errorCount which a successful renewal resets.
 */
@Embeddable
@Data
public class WatchStats {
    private long notificationsReceived;

    private long messagesProcessed;

    private int errorCount;

    @Column(length = 2000)
    private String lastError;

    @Enumerated(EnumType.STRING)
    private WatchErrorKind lastErrorKind;

    private Instant lastErrorAt;

    public void recordError(WatchErrorKind kind, String message, Instant at) {
        errorCount++;
        lastErrorKind = kind;
        lastErrorAt = at;
        lastError = message != null && message.length() > 2000 ? message.substring(0, 2000) : message;
    }

    public void clearErrors() {
        errorCount = 0;
        lastError = null;
        lastErrorKind = null;
        lastErrorAt = null;
    }
}
