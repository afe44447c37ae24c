package jump.email.watch.service;

import jump.email.watch.config.WatchProperties;
import jump.email.watch.entity.LabelFilter;
import jump.email.watch.entity.LabelFilterBehavior;
import jump.email.watch.entity.WatchErrorKind;
import jump.email.watch.entity.WatchRecord;
import jump.email.watch.entity.WatchState;
import jump.email.watch.exception.CredentialException;
import jump.email.watch.exception.WatchAlreadyActiveException;
import jump.email.watch.exception.WatchOperationException;
import jump.email.watch.model.BulkStopSummary;
import jump.email.watch.model.MailboxHandle;
import jump.email.watch.model.ProviderResult;
import jump.email.watch.model.WatchCreated;
import jump.email.watch.model.WatchStatusView;
import jump.email.watch.repository.WatchRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WatchSubscriptionServiceTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String PRINCIPAL = "user-1";
    private static final String ACCOUNT = "owner@example.com";

    @Mock
    private WatchRecordRepository repository;
    @Mock
    private MailboxProvider mailboxProvider;
    @Mock
    private CredentialProvider credentialProvider;

    private Map<String, WatchRecord> records;
    private WatchSubscriptionService service;
    private MailboxHandle handle;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        WatchProperties properties = new WatchProperties();
        records = WatchTestData.inMemory(repository);
        service = new WatchSubscriptionService(new WatchRecordStore(repository, clock), mailboxProvider,
            credentialProvider, new PrincipalLockService(properties), properties, clock);
        handle = new MailboxHandle(PRINCIPAL, ACCOUNT, "access-token");
        lenient().when(credentialProvider.getAuthenticatedHandle(PRINCIPAL)).thenReturn(handle);
    }

    @Test
    void create_WithValidCredentials_ShouldActivateAtInitialCursor() {
        // Given
        Instant expiry = NOW.plus(Duration.ofDays(7));
        when(mailboxProvider.createWatch(eq(handle), any(LabelFilter.class)))
            .thenReturn(ProviderResult.ok(new WatchCreated(ACCOUNT + "/500", BigInteger.valueOf(500), expiry)));

        // When
        WatchRecord record = service.create(PRINCIPAL, LabelFilter.of(List.of("INBOX", "IMPORTANT"), LabelFilterBehavior.INCLUDE));

        // Then
        assertEquals(WatchState.ACTIVE, record.getState());
        assertTrue(record.isActive());
        assertEquals("500", record.getCursor());
        assertEquals(ACCOUNT, record.getProviderAccountId());
        assertEquals(ACCOUNT + "/500", record.getSubscriptionId());
        assertEquals(expiry, record.getExpiresAt());
        assertEquals(List.of("INBOX", "IMPORTANT"), record.getLabelFilter().getLabelIds());
    }

    @Test
    void create_WithoutInitialCursor_ShouldUseProviderCurrent() {
        // Given
        when(mailboxProvider.createWatch(eq(handle), any(LabelFilter.class)))
            .thenReturn(ProviderResult.ok(new WatchCreated(ACCOUNT + "/0", null, null)));
        when(mailboxProvider.getCurrentCursor(handle)).thenReturn(ProviderResult.ok(BigInteger.valueOf(777)));

        // When
        WatchRecord record = service.create(PRINCIPAL, null);

        // Then
        assertEquals("777", record.getCursor());
        assertEquals(NOW.plus(Duration.ofDays(7)), record.getExpiresAt());
        assertEquals(LabelFilter.inbox(), record.getLabelFilter());
    }

    @Test
    void create_WhenAlreadyActive_ShouldThrow() {
        // Given
        WatchRecord existing = WatchTestData.activeRecord(PRINCIPAL, ACCOUNT, "100", NOW);
        records.put(existing.getId(), existing);

        // When & Then
        assertThrows(WatchAlreadyActiveException.class, () -> service.create(PRINCIPAL, null));
        verifyNoInteractions(mailboxProvider);
    }

    @Test
    void create_ProviderRefuses_ShouldLeaveNoActiveRecord() {
        // Given
        when(mailboxProvider.createWatch(eq(handle), any(LabelFilter.class)))
            .thenReturn(ProviderResult.authFailure("403 forbidden"));

        // When & Then
        assertThrows(WatchOperationException.class, () -> service.create(PRINCIPAL, null));
        assertEquals(1, records.size());
        WatchRecord record = records.values().iterator().next();
        assertFalse(record.isActive());
        assertEquals(WatchState.STOPPED, record.getState());
    }

    @Test
    void create_InitialCursorUnreadable_ShouldCancelProviderWatchAndStopRecord() {
        // Given
        when(mailboxProvider.createWatch(eq(handle), any(LabelFilter.class)))
            .thenReturn(ProviderResult.ok(new WatchCreated(ACCOUNT + "/0", null, null)));
        when(mailboxProvider.getCurrentCursor(handle)).thenReturn(ProviderResult.transientFailure("503"));
        when(mailboxProvider.stopWatch(handle)).thenReturn(ProviderResult.ok(null));

        // When & Then
        assertThrows(WatchOperationException.class, () -> service.create(PRINCIPAL, null));
        verify(mailboxProvider).stopWatch(handle);
        WatchRecord record = records.values().iterator().next();
        assertEquals(WatchState.STOPPED, record.getState());
        assertFalse(record.isActive());
    }

    @Test
    void create_MailboxWatchedByAnotherPrincipal_ShouldThrow() {
        // Given
        WatchRecord other = WatchTestData.activeRecord("user-2", ACCOUNT, "100", NOW);
        records.put(other.getId(), other);

        // When & Then
        WatchAlreadyActiveException e = assertThrows(WatchAlreadyActiveException.class, () -> service.create(PRINCIPAL, null));
        assertEquals("user-2", e.getPrincipalId());
        verifyNoInteractions(mailboxProvider);
        assertEquals(1, records.size());
    }

    @Test
    void create_WithoutCredentials_ShouldPropagateCredentialException() {
        // Given
        when(credentialProvider.getAuthenticatedHandle(PRINCIPAL))
            .thenThrow(new CredentialException(PRINCIPAL, "no Gmail account"));

        // When & Then
        assertThrows(CredentialException.class, () -> service.create(PRINCIPAL, null));
        assertTrue(records.isEmpty());
    }

    @Test
    void renew_ShouldReplaceSubscriptionKeepCursorAndClearErrors() {
        // Given
        WatchRecord record = WatchTestData.activeRecord(PRINCIPAL, ACCOUNT, "300", NOW);
        record.getStats().recordError(WatchErrorKind.TRANSIENT, "503", NOW.minusSeconds(60));
        record.transitionTo(WatchState.ERRORING);
        records.put(record.getId(), record);
        String oldSubscription = record.getSubscriptionId();
        Instant newExpiry = NOW.plus(Duration.ofDays(7));
        when(mailboxProvider.stopWatch(handle)).thenReturn(ProviderResult.ok(null));
        when(mailboxProvider.createWatch(eq(handle), any(LabelFilter.class)))
            .thenReturn(ProviderResult.ok(new WatchCreated(ACCOUNT + "/350", BigInteger.valueOf(350), newExpiry)));

        // When
        WatchRecord renewed = service.renew(oldSubscription);

        // Then
        assertEquals(WatchState.ACTIVE, renewed.getState());
        assertEquals(ACCOUNT + "/350", renewed.getSubscriptionId());
        assertEquals("300", renewed.getCursor());
        assertEquals(newExpiry, renewed.getExpiresAt());
        assertEquals(NOW, renewed.getLastRenewedAt());
        assertEquals(0, renewed.getStats().getErrorCount());
    }

    @Test
    void renew_ProviderFails_ShouldRecordRenewalError() {
        // Given
        WatchRecord record = WatchTestData.activeRecord(PRINCIPAL, ACCOUNT, "300", NOW);
        records.put(record.getId(), record);
        when(mailboxProvider.stopWatch(handle)).thenReturn(ProviderResult.notFound("no watch"));
        when(mailboxProvider.createWatch(eq(handle), any(LabelFilter.class)))
            .thenReturn(ProviderResult.transientFailure("500"));

        // When & Then
        assertThrows(WatchOperationException.class, () -> service.renew(record.getSubscriptionId()));
        assertEquals(WatchState.ERRORING, record.getState());
        assertEquals(WatchErrorKind.RENEWAL, record.getStats().getLastErrorKind());
        assertTrue(record.isActive());
    }

    @Test
    void stop_ProviderSaysNotFound_ShouldStillDeactivate() {
        // Given
        WatchRecord record = WatchTestData.activeRecord(PRINCIPAL, ACCOUNT, "300", NOW);
        records.put(record.getId(), record);
        when(mailboxProvider.stopWatch(handle)).thenReturn(ProviderResult.notFound("404"));

        // When
        boolean stopped = service.stop(PRINCIPAL);

        // Then
        assertTrue(stopped);
        assertFalse(record.isActive());
        assertEquals(NOW, record.getStoppedAt());
    }

    @Test
    void stop_WithoutCredentials_ShouldDeactivateLocally() {
        // Given
        WatchRecord record = WatchTestData.activeRecord(PRINCIPAL, ACCOUNT, "300", NOW);
        records.put(record.getId(), record);
        when(credentialProvider.getAuthenticatedHandle(PRINCIPAL))
            .thenThrow(new CredentialException(PRINCIPAL, "token expired"));

        // When
        boolean stopped = service.stop(PRINCIPAL);

        // Then
        assertTrue(stopped);
        assertEquals(WatchState.STOPPED, record.getState());
        verifyNoInteractions(mailboxProvider);
    }

    @Test
    void stop_Twice_ShouldBeIdempotent() {
        // Given
        WatchRecord record = WatchTestData.activeRecord(PRINCIPAL, ACCOUNT, "300", NOW);
        records.put(record.getId(), record);
        when(mailboxProvider.stopWatch(handle)).thenReturn(ProviderResult.ok(null));

        // When
        service.stop(PRINCIPAL);
        boolean again = service.stop(PRINCIPAL);

        // Then
        assertTrue(again);
        assertEquals(WatchState.STOPPED, record.getState());
    }

    @Test
    void stop_UnknownPrincipal_ShouldReturnFalse() {
        assertFalse(service.stop("nobody"));
    }

    @Test
    void findNeedingRenewal_ShouldIncludeOnlyWatchesInsideTheWindow() {
        // Given
        WatchRecord soon = WatchTestData.activeRecord("user-a", "a@example.com", "1", NOW);
        soon.setExpiresAt(NOW.plus(Duration.ofHours(23)));
        WatchRecord later = WatchTestData.activeRecord("user-b", "b@example.com", "1", NOW);
        later.setExpiresAt(NOW.plus(Duration.ofHours(25)));
        records.put(soon.getId(), soon);
        records.put(later.getId(), later);

        // When
        List<WatchRecord> due = service.findNeedingRenewal(Duration.ofHours(24));

        // Then
        assertEquals(List.of("user-a"), due.stream().map(WatchRecord::getPrincipalId).collect(Collectors.toList()));
    }

    @Test
    void getStatus_WithDifferentSignedInEmail_ShouldFlagMismatch() {
        // Given
        WatchRecord record = WatchTestData.activeRecord(PRINCIPAL, ACCOUNT, "300", NOW);
        records.put(record.getId(), record);

        // When
        Optional<WatchStatusView> status = service.getStatus(PRINCIPAL, "someone.else@example.com");
        Optional<WatchStatusView> sameAccount = service.getStatus(PRINCIPAL, "OWNER@example.com");

        // Then
        assertTrue(status.isPresent());
        assertTrue(status.get().isAccountMismatch());
        assertFalse(sameAccount.get().isAccountMismatch());
    }

    @Test
    void stopAll_ShouldStopEveryActiveWatch() {
        // Given
        WatchRecord first = WatchTestData.activeRecord("user-a", "a@example.com", "1", NOW);
        WatchRecord second = WatchTestData.activeRecord("user-b", "b@example.com", "1", NOW);
        records.put(first.getId(), first);
        records.put(second.getId(), second);
        when(credentialProvider.getAuthenticatedHandle(anyString()))
            .thenThrow(new CredentialException("any", "not needed"));

        // When
        BulkStopSummary summary = service.stopAll();

        // Then
        assertEquals(2, summary.getTotal());
        assertEquals(2, summary.getStopped());
        assertEquals(0, summary.getFailed());
        assertFalse(first.isActive());
        assertFalse(second.isActive());
    }
}
