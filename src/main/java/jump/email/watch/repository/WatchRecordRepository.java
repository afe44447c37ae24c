package jump.email.watch.repository;

import jump.email.watch.entity.WatchErrorKind;
import jump.email.watch.entity.WatchRecord;
import jump.email.watch.entity.WatchState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface WatchRecordRepository extends JpaRepository<WatchRecord, String> {
    Optional<WatchRecord> findFirstByProviderAccountIdAndActiveTrue(String providerAccountId);
    Optional<WatchRecord> findFirstByPrincipalIdAndActiveTrue(String principalId);

    // Latest record of any state, used to tell "known but stopped" from "unknown"
    Optional<WatchRecord> findFirstByProviderAccountIdOrderByCreatedAtDesc(String providerAccountId);
    Optional<WatchRecord> findFirstByPrincipalIdOrderByCreatedAtDesc(String principalId);

    Optional<WatchRecord> findBySubscriptionId(String subscriptionId);

    List<WatchRecord> findByActiveTrue();
    List<WatchRecord> findByActiveTrueAndExpiresAtBefore(Instant cutoff);
    List<WatchRecord> findByActiveTrueAndCreatedAtBefore(Instant cutoff);

    @Query("SELECT w FROM WatchRecord w WHERE w.active = true AND w.stats.errorCount >= :threshold")
    List<WatchRecord> findActiveWithErrorCountAtLeast(@Param("threshold") int threshold);

    long countByActiveTrue();
    long countByActiveFalse();
    long countByActiveTrueAndExpiresAtBefore(Instant cutoff);

    @Query("SELECT COUNT(w) FROM WatchRecord w WHERE w.active = true AND w.stats.errorCount > 0")
    long countActiveWithErrors();

    @Query("SELECT COUNT(w) FROM WatchRecord w WHERE w.state = :state AND w.stats.lastErrorKind = :kind")
    long countByStateAndLastErrorKind(@Param("state") WatchState state, @Param("kind") WatchErrorKind kind);

    @Query("SELECT COALESCE(SUM(w.stats.notificationsReceived), 0) FROM WatchRecord w")
    long sumNotificationsReceived();

    @Query("SELECT COALESCE(SUM(w.stats.messagesProcessed), 0) FROM WatchRecord w")
    long sumMessagesProcessed();
}
