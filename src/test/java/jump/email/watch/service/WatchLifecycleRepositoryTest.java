package jump.email.watch.service;

import com.google.api.client.http.LowLevelHttpRequest;
import com.google.api.client.http.LowLevelHttpResponse;
import com.google.api.client.json.Json;
import com.google.api.client.testing.http.MockHttpTransport;
import com.google.api.client.testing.http.MockLowLevelHttpRequest;
import com.google.api.client.testing.http.MockLowLevelHttpResponse;
import jump.email.watch.config.WatchProperties;
import jump.email.watch.entity.LabelFilter;
import jump.email.watch.entity.WatchRecord;
import jump.email.watch.entity.WatchState;
import jump.email.watch.exception.WatchOperationException;
import jump.email.watch.model.MailboxHandle;
import jump.email.watch.model.ProviderResult;
import jump.email.watch.model.WatchCreated;
import jump.email.watch.repository.WatchRecordRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Create, stop and create again against the real schema, each repository call committing
 * on its own as it does in the running service.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class WatchLifecycleRepositoryTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String PRINCIPAL = "user-1";
    private static final String ACCOUNT = "a@example.com";

    @Autowired
    private WatchRecordRepository repository;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final MailboxHandle handle = new MailboxHandle(PRINCIPAL, ACCOUNT, "access-token");
    private WatchProperties properties;
    private WatchRecordStore store;
    private CredentialProvider credentialProvider;

    @BeforeEach
    void setUp() {
        properties = new WatchProperties();
        properties.getPubsub().setTopic("projects/demo/topics/gmail");
        store = new WatchRecordStore(repository, clock);
        credentialProvider = mock(CredentialProvider.class);
        when(credentialProvider.getAuthenticatedHandle(PRINCIPAL)).thenReturn(handle);
    }

    @AfterEach
    void tearDown() {
        repository.deleteAll();
    }

    private WatchSubscriptionService service(MailboxProvider provider) {
        return new WatchSubscriptionService(store, provider, credentialProvider,
            new PrincipalLockService(properties), properties, clock);
    }

    /**
     * Gmail answering every watch call with the same history id, as it does when no mail
     * arrives between a stop and the next watch.
     */
    private static MockHttpTransport gmailAtHistoryId(String historyId) {
        return new MockHttpTransport() {
            @Override
            public LowLevelHttpRequest buildRequest(String method, String url) {
                return new MockLowLevelHttpRequest(url) {
                    @Override
                    public LowLevelHttpResponse execute() {
                        if (url.endsWith("/users/me/stop")) {
                            return new MockLowLevelHttpResponse().setStatusCode(204);
                        }
                        return new MockLowLevelHttpResponse()
                            .setStatusCode(200)
                            .setContentType(Json.MEDIA_TYPE)
                            .setContent("{\"historyId\":\"" + historyId + "\",\"expiration\":\"1715169600000\"}");
                    }
                };
            }
        };
    }

    @Test
    void createStopCreate_SameHistoryId_ShouldActivateSecondWatch() {
        // Given
        WatchSubscriptionService service = service(new GmailMailboxProvider(gmailAtHistoryId("100"), properties, clock));
        WatchRecord first = service.create(PRINCIPAL, null);
        assertTrue(service.stop(PRINCIPAL));

        // When
        WatchRecord second = service.create(PRINCIPAL, null);

        // Then
        assertEquals(WatchState.ACTIVE, second.getState());
        assertEquals("100", second.getCursor());
        assertNotEquals(first.getSubscriptionId(), second.getSubscriptionId());
        assertEquals(second.getId(), store.findActiveByPrincipal(PRINCIPAL).orElseThrow().getId());
        assertEquals(WatchState.STOPPED, repository.findById(first.getId()).orElseThrow().getState());
    }

    @Test
    void create_SubscriptionIdCollision_ShouldStopProvisioningRecordAndAllowRetry() {
        // Given
        MailboxProvider provider = mock(MailboxProvider.class);
        WatchCreated colliding = new WatchCreated(ACCOUNT + "/100", BigInteger.valueOf(100), NOW.plusSeconds(86_400));
        when(provider.createWatch(eq(handle), any(LabelFilter.class)))
            .thenReturn(ProviderResult.ok(colliding))
            .thenReturn(ProviderResult.ok(colliding))
            .thenReturn(ProviderResult.ok(new WatchCreated(ACCOUNT + "/101", BigInteger.valueOf(101), NOW.plusSeconds(86_400))));
        when(provider.stopWatch(handle)).thenReturn(ProviderResult.ok(null));
        WatchSubscriptionService service = service(provider);
        service.create(PRINCIPAL, null);
        service.stop(PRINCIPAL);

        // When
        assertThrows(WatchOperationException.class, () -> service.create(PRINCIPAL, null));

        // Then
        assertTrue(store.findActiveByPrincipal(PRINCIPAL).isEmpty());
        List<WatchState> states = repository.findAll().stream()
            .map(WatchRecord::getState)
            .collect(Collectors.toList());
        assertEquals(List.of(WatchState.STOPPED, WatchState.STOPPED), states);
        verify(provider, times(2)).stopWatch(handle);

        // When
        WatchRecord retried = service.create(PRINCIPAL, null);

        // Then
        assertEquals(WatchState.ACTIVE, retried.getState());
        assertEquals(ACCOUNT + "/101", retried.getSubscriptionId());
    }
}
