package jump.email.watch.entity;

import jakarta.persistence.*;
import jump.email.watch.exception.InvalidWatchTransitionException;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

/**
 * Durable per-principal record of a Gmail watch: the provider subscription, the last
 * reconciled history id and running statistics.
 *
 * <p>The cursor is a decimal history id and only ever moves forward. {@code active}
 * mirrors {@code state} and is kept as a column so repositories can query it.
 */
@Entity
@Table(name = "watch_records", indexes = {
    @Index(name = "idx_watch_principal", columnList = "principalId"),
    @Index(name = "idx_watch_account", columnList = "providerAccountId")
})
@Getter
@Setter
@ToString
public class WatchRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String principalId;

    @Column(nullable = false)
    private String providerAccountId;

    @Column(unique = true)
    private String subscriptionId;

    private String cursor;

    @Embedded
    private LabelFilter labelFilter = LabelFilter.inbox();

    private Instant expiresAt;

    private Instant createdAt;

    private Instant lastRenewedAt;

    private Instant stoppedAt;

    private boolean active = true;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WatchState state = WatchState.PROVISIONING;

    @Embedded
    private WatchStats stats = new WatchStats();

    @Version
    private Long version;

    public void transitionTo(WatchState target) {
        if (!state.canTransitionTo(target)) {
            throw new InvalidWatchTransitionException(id, state, target);
        }
        this.state = target;
        this.active = target.isActive();
    }

    public boolean isExpiringWithin(Instant now, Duration window) {
        return expiresAt != null && Duration.between(now, expiresAt).compareTo(window) < 0;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public boolean isOlderThan(Instant now, Duration maxAge) {
        return createdAt != null && createdAt.plus(maxAge).isBefore(now);
    }

    public BigInteger cursorValue() {
        return cursor != null ? new BigInteger(cursor) : BigInteger.ZERO;
    }
}
