package jump.email.watch.service;

import jump.email.watch.config.WatchProperties;
import jump.email.watch.entity.LabelFilter;
import jump.email.watch.entity.WatchErrorKind;
import jump.email.watch.entity.WatchRecord;
import jump.email.watch.entity.WatchState;
import jump.email.watch.exception.CredentialException;
import jump.email.watch.model.CanonicalMessage;
import jump.email.watch.model.MailboxHandle;
import jump.email.watch.model.MessageRef;
import jump.email.watch.model.NotificationEvent;
import jump.email.watch.model.NotificationSource;
import jump.email.watch.model.ProviderResult;
import jump.email.watch.model.RealtimeEventKind;
import jump.email.watch.model.ReconcileOutcome;
import jump.email.watch.model.ReconcileStatus;
import jump.email.watch.model.SourceContext;
import jump.email.watch.model.TriageReceipt;
import jump.email.watch.repository.WatchRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HistoryReconcilerTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String PRINCIPAL = "user-1";
    private static final String ACCOUNT = "owner@example.com";

    @Mock
    private WatchRecordRepository repository;
    @Mock
    private OrphanWatchSupervisor orphanSupervisor;
    @Mock
    private CredentialProvider credentialProvider;
    @Mock
    private MailboxProvider mailboxProvider;
    @Mock
    private TriageClient triageClient;
    @Mock
    private RealtimePublisher realtimePublisher;

    private Map<String, WatchRecord> records;
    private InMemorySessionRegistry sessionRegistry;
    private HistoryReconciler reconciler;
    private MailboxHandle handle;
    private WatchRecord record;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        WatchProperties properties = new WatchProperties();
        records = WatchTestData.inMemory(repository);
        sessionRegistry = new InMemorySessionRegistry();
        reconciler = new HistoryReconciler(
            new WatchRecordStore(repository, clock),
            sessionRegistry,
            orphanSupervisor,
            new PrincipalLockService(properties),
            credentialProvider,
            mailboxProvider,
            new CanonicalMessageMapper(properties, clock),
            new AutomatedSenderFilter(),
            triageClient,
            realtimePublisher,
            properties);

        record = WatchTestData.activeRecord(PRINCIPAL, ACCOUNT, "100", NOW);
        records.put(record.getId(), record);
        sessionRegistry.attach(PRINCIPAL);
        handle = new MailboxHandle(PRINCIPAL, ACCOUNT, "access-token");
        lenient().when(credentialProvider.getAuthenticatedHandle(PRINCIPAL)).thenReturn(handle);
        lenient().when(triageClient.submit(any(), any())).thenReturn(new TriageReceipt("t-1", "ACCEPTED"));
    }

    private static NotificationEvent event(long historyId) {
        return NotificationEvent.builder()
            .providerAccountId(ACCOUNT)
            .notifiedCursor(BigInteger.valueOf(historyId))
            .receivedAt(NOW)
            .deliveryId("delivery-" + historyId)
            .build();
    }

    private static BigInteger id(long value) {
        return BigInteger.valueOf(value);
    }

    @Test
    void reconcile_DuplicateThenNewNotification_ShouldEmitOnlyHumanMail() {
        // Given
        when(mailboxProvider.getCurrentCursor(handle)).thenReturn(ProviderResult.ok(id(105)));
        when(mailboxProvider.listChanges(eq(handle), eq(id(100)), eq(id(105)), any(LabelFilter.class)))
            .thenReturn(ProviderResult.ok(List.of(new MessageRef("m1", "t1"), new MessageRef("m2", "t2"))));
        when(mailboxProvider.getMessage(handle, new MessageRef("m1", "t1"))).thenReturn(ProviderResult.ok(
            WatchTestData.gmailMessage("m1", "Alice <alice@example.com>", "Lunch tomorrow?", "Are you free at noon?")));
        when(mailboxProvider.getMessage(handle, new MessageRef("m2", "t2"))).thenReturn(ProviderResult.ok(
            WatchTestData.gmailMessage("m2", "noreply@shop.com", "Your order shipped", "Tracking inside")));

        // When
        ReconcileOutcome duplicate = reconciler.reconcile(event(100), NotificationSource.PUSH);

        // Then
        assertEquals(ReconcileStatus.DUPLICATE, duplicate.getStatus());
        verifyNoInteractions(mailboxProvider);

        // When
        ReconcileOutcome outcome = reconciler.reconcile(event(105), NotificationSource.PUSH);

        // Then
        assertEquals(ReconcileStatus.PROCESSED, outcome.getStatus());
        assertEquals(1, outcome.getProcessedCount());
        assertEquals("105", record.getCursor());
        assertEquals(1, record.getStats().getMessagesProcessed());
        assertEquals(2, record.getStats().getNotificationsReceived());

        ArgumentCaptor<CanonicalMessage> submitted = ArgumentCaptor.forClass(CanonicalMessage.class);
        ArgumentCaptor<SourceContext> context = ArgumentCaptor.forClass(SourceContext.class);
        verify(triageClient).submit(submitted.capture(), context.capture());
        assertEquals("m1", submitted.getValue().getId());
        assertEquals("Are you free at noon?", submitted.getValue().getBody());
        assertEquals(NotificationSource.PUSH, context.getValue().getSource());
        assertEquals("delivery-105", context.getValue().getDeliveryId());
        verify(realtimePublisher).publish(eq(PRINCIPAL), eq(RealtimeEventKind.EMAIL_RECEIVED), any(CanonicalMessage.class));
    }

    @Test
    void reconcile_NotificationBeyondProviderCurrent_ShouldStopAtProviderCurrent() {
        // Given
        when(mailboxProvider.getCurrentCursor(handle)).thenReturn(ProviderResult.ok(id(103)));
        when(mailboxProvider.listChanges(eq(handle), eq(id(100)), eq(id(103)), any(LabelFilter.class)))
            .thenReturn(ProviderResult.ok(List.of()));

        // When
        ReconcileOutcome outcome = reconciler.reconcile(event(110), NotificationSource.PULL);

        // Then
        assertEquals(ReconcileStatus.PROCESSED, outcome.getStatus());
        assertEquals(id(103), outcome.getCursor());
        assertEquals("103", record.getCursor());
    }

    @Test
    void reconcile_OlderNotificationAfterNewerOne_ShouldNotMoveCursorBack() {
        // Given
        record.setCursor("120");

        // When
        ReconcileOutcome outcome = reconciler.reconcile(event(110), NotificationSource.PUSH);

        // Then
        assertEquals(ReconcileStatus.DUPLICATE, outcome.getStatus());
        assertEquals("120", record.getCursor());
        verifyNoInteractions(mailboxProvider, triageClient);
    }

    @Test
    void reconcile_HugeCursorGap_ShouldResetWithoutFetchingHistory() {
        // Given
        BigInteger current = id(100 + 2_000_000);
        when(mailboxProvider.getCurrentCursor(handle)).thenReturn(ProviderResult.ok(current));

        // When
        ReconcileOutcome outcome = reconciler.reconcile(event(2_000_100), NotificationSource.PUSH);

        // Then
        assertEquals(ReconcileStatus.STALE_CURSOR_RESET, outcome.getStatus());
        assertEquals(current.toString(), record.getCursor());
        assertEquals(WatchState.ACTIVE, record.getState());
        assertEquals(0, record.getStats().getErrorCount());
        verify(mailboxProvider, never()).listChanges(any(), any(), any(), any());
    }

    @Test
    void reconcile_HistoryExpiredAtProvider_ShouldResetToProviderCurrent() {
        // Given
        when(mailboxProvider.getCurrentCursor(handle)).thenReturn(ProviderResult.ok(id(150)));
        when(mailboxProvider.listChanges(eq(handle), eq(id(100)), eq(id(150)), any(LabelFilter.class)))
            .thenReturn(ProviderResult.notFound("startHistoryId too old"));

        // When
        ReconcileOutcome outcome = reconciler.reconcile(event(150), NotificationSource.PUSH);

        // Then
        assertEquals(ReconcileStatus.STALE_CURSOR_RESET, outcome.getStatus());
        assertEquals("150", record.getCursor());
        verifyNoInteractions(triageClient);
    }

    @Test
    void reconcile_OneMessageFails_ShouldStillEmitOthersAndAdvance() {
        // Given
        MessageRef first = new MessageRef("m1", "t1");
        MessageRef second = new MessageRef("m2", "t2");
        MessageRef third = new MessageRef("m3", "t3");
        when(mailboxProvider.getCurrentCursor(handle)).thenReturn(ProviderResult.ok(id(110)));
        when(mailboxProvider.listChanges(eq(handle), eq(id(100)), eq(id(110)), any(LabelFilter.class)))
            .thenReturn(ProviderResult.ok(List.of(first, second, third)));
        when(mailboxProvider.getMessage(handle, first)).thenReturn(ProviderResult.ok(
            WatchTestData.gmailMessage("m1", "bob@example.com", "Contract draft", "See attached")));
        when(mailboxProvider.getMessage(handle, second)).thenReturn(ProviderResult.transientFailure("503 backend error"));
        when(mailboxProvider.getMessage(handle, third)).thenReturn(ProviderResult.ok(
            WatchTestData.gmailMessage("m3", "carol@example.com", "Quarterly numbers", "Numbers look good")));

        // When
        ReconcileOutcome outcome = reconciler.reconcile(event(110), NotificationSource.PUSH);

        // Then
        assertEquals(ReconcileStatus.PROCESSED, outcome.getStatus());
        assertEquals(2, outcome.getProcessedCount());
        assertEquals("110", record.getCursor());
        verify(triageClient, times(2)).submit(any(), any());
    }

    @Test
    void reconcile_TriageThrowsForOneMessage_ShouldContinueWithTheRest() {
        // Given
        MessageRef first = new MessageRef("m1", "t1");
        MessageRef second = new MessageRef("m2", "t2");
        when(mailboxProvider.getCurrentCursor(handle)).thenReturn(ProviderResult.ok(id(102)));
        when(mailboxProvider.listChanges(eq(handle), eq(id(100)), eq(id(102)), any(LabelFilter.class)))
            .thenReturn(ProviderResult.ok(List.of(first, second)));
        when(mailboxProvider.getMessage(handle, first)).thenReturn(ProviderResult.ok(
            WatchTestData.gmailMessage("m1", "bob@example.com", "Contract draft", "See attached")));
        when(mailboxProvider.getMessage(handle, second)).thenReturn(ProviderResult.ok(
            WatchTestData.gmailMessage("m2", "carol@example.com", "Quarterly numbers", "Numbers look good")));
        when(triageClient.submit(argThat(m -> m != null && "m1".equals(m.getId())), any()))
            .thenThrow(new IllegalStateException("triage down"));

        // When
        ReconcileOutcome outcome = reconciler.reconcile(event(102), NotificationSource.PUSH);

        // Then
        assertEquals(1, outcome.getProcessedCount());
        assertEquals("102", record.getCursor());
    }

    @Test
    void reconcile_NoListeners_ShouldSkipProviderAndTriggerCleanup() {
        // Given
        sessionRegistry.detach(PRINCIPAL);

        // When
        ReconcileOutcome outcome = reconciler.reconcile(event(105), NotificationSource.PUSH);

        // Then
        assertEquals(ReconcileStatus.NO_LISTENERS, outcome.getStatus());
        assertEquals("100", record.getCursor());
        verify(orphanSupervisor).handleInactivePrincipal(PRINCIPAL, ACCOUNT);
        verifyNoInteractions(mailboxProvider, credentialProvider, triageClient);
    }

    @Test
    void reconcile_UnknownAccount_ShouldRouteToOrphanHandling() {
        // Given
        NotificationEvent stranger = NotificationEvent.builder()
            .providerAccountId("stranger@example.com")
            .notifiedCursor(id(5))
            .receivedAt(NOW)
            .deliveryId("d-5")
            .build();

        // When
        ReconcileOutcome outcome = reconciler.reconcile(stranger, NotificationSource.PUSH);

        // Then
        assertEquals(ReconcileStatus.ORPHANED, outcome.getStatus());
        verify(orphanSupervisor).handleUnknownAccount(stranger);
        verifyNoInteractions(mailboxProvider, credentialProvider);
    }

    @Test
    void reconcile_CredentialRevoked_ShouldFlagAuthErrorAndAskForReauthorization() {
        // Given
        when(credentialProvider.getAuthenticatedHandle(PRINCIPAL))
            .thenThrow(new CredentialException(PRINCIPAL, "refresh token revoked"));

        // When
        ReconcileOutcome outcome = reconciler.reconcile(event(105), NotificationSource.PUSH);

        // Then
        assertEquals(ReconcileStatus.AUTH_FAILURE, outcome.getStatus());
        assertFalse(outcome.getStatus().isAcknowledgeable());
        assertEquals("100", record.getCursor());
        assertEquals(WatchState.ERRORING, record.getState());
        assertEquals(WatchErrorKind.AUTH, record.getStats().getLastErrorKind());
        verify(realtimePublisher).publish(eq(PRINCIPAL), eq(RealtimeEventKind.REAUTHORIZATION_REQUIRED), any());
    }

    @Test
    void reconcile_AuthFailureMidBatch_ShouldLeaveCursorForRetry() {
        // Given
        MessageRef first = new MessageRef("m1", "t1");
        when(mailboxProvider.getCurrentCursor(handle)).thenReturn(ProviderResult.ok(id(105)));
        when(mailboxProvider.listChanges(eq(handle), eq(id(100)), eq(id(105)), any(LabelFilter.class)))
            .thenReturn(ProviderResult.ok(List.of(first)));
        when(mailboxProvider.getMessage(handle, first)).thenReturn(ProviderResult.authFailure("401 invalid credentials"));

        // When
        ReconcileOutcome outcome = reconciler.reconcile(event(105), NotificationSource.PUSH);

        // Then
        assertEquals(ReconcileStatus.AUTH_FAILURE, outcome.getStatus());
        assertEquals("100", record.getCursor());
        verifyNoInteractions(triageClient);
    }

    @Test
    void reconcile_ProviderUnavailable_ShouldRecordTransientErrorAndKeepCursor() {
        // Given
        when(mailboxProvider.getCurrentCursor(handle)).thenReturn(ProviderResult.transientFailure("503"));

        // When
        ReconcileOutcome outcome = reconciler.reconcile(event(105), NotificationSource.PUSH);

        // Then
        assertEquals(ReconcileStatus.TRANSIENT_FAILURE, outcome.getStatus());
        assertEquals("100", record.getCursor());
        assertEquals(1, record.getStats().getErrorCount());
        assertEquals(WatchErrorKind.TRANSIENT, record.getStats().getLastErrorKind());
        assertEquals(WatchState.ERRORING, record.getState());
    }

    @Test
    void reconcile_SuccessAfterError_ShouldReturnWatchToActive() {
        // Given
        when(mailboxProvider.getCurrentCursor(handle))
            .thenReturn(ProviderResult.transientFailure("503"))
            .thenReturn(ProviderResult.ok(id(105)));
        when(mailboxProvider.listChanges(eq(handle), eq(id(100)), eq(id(105)), any(LabelFilter.class)))
            .thenReturn(ProviderResult.ok(List.of()));
        reconciler.reconcile(event(105), NotificationSource.PUSH);

        // When
        ReconcileOutcome outcome = reconciler.reconcile(event(105), NotificationSource.PULL);

        // Then
        assertEquals(ReconcileStatus.PROCESSED, outcome.getStatus());
        assertEquals(WatchState.ACTIVE, record.getState());
        assertEquals("105", record.getCursor());
    }
}
