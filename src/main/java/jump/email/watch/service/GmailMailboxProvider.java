package jump.email.watch.service;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.History;
import com.google.api.services.gmail.model.HistoryMessageAdded;
import com.google.api.services.gmail.model.ListHistoryResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.Profile;
import com.google.api.services.gmail.model.WatchRequest;
import com.google.api.services.gmail.model.WatchResponse;
import jump.email.watch.config.WatchProperties;
import jump.email.watch.entity.LabelFilter;
import jump.email.watch.model.MailboxHandle;
import jump.email.watch.model.MessageRef;
import jump.email.watch.model.ProviderResult;
import jump.email.watch.model.WatchCreated;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * {@link MailboxProvider} backed by the Gmail REST API. Every request carries the configured
 * connect and read timeouts.
 */
@Slf4j
@Service
public class GmailMailboxProvider implements MailboxProvider {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final String ME = "me";
    private static final String MESSAGE_ADDED = "messageAdded";

    private final HttpTransport httpTransport;
    private final WatchProperties properties;
    private final Clock clock;

    @Autowired
    public GmailMailboxProvider(WatchProperties properties, Clock clock) throws GeneralSecurityException, IOException {
        this(GoogleNetHttpTransport.newTrustedTransport(), properties, clock);
    }

    GmailMailboxProvider(HttpTransport httpTransport, WatchProperties properties, Clock clock) {
        this.httpTransport = httpTransport;
        this.properties = properties;
        this.clock = clock;
    }

    Gmail gmail(MailboxHandle handle) {
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
            .setTransport(httpTransport)
            .setJsonFactory(JSON_FACTORY)
            .build();
        credential.setAccessToken(handle.getAccessToken());

        int connectTimeout = (int) properties.getProvider().getConnectTimeout().toMillis();
        int readTimeout = (int) properties.getProvider().getReadTimeout().toMillis();
        HttpRequestInitializer initializer = request -> {
            credential.initialize(request);
            request.setConnectTimeout(connectTimeout);
            request.setReadTimeout(readTimeout);
        };

        return new Gmail.Builder(httpTransport, JSON_FACTORY, initializer)
            .setApplicationName(properties.getProvider().getApplicationName())
            .build();
    }

    @Override
    public ProviderResult<BigInteger> getCurrentCursor(MailboxHandle handle) {
        try {
            Profile profile = gmail(handle).users().getProfile(ME).execute();
            if (profile.getHistoryId() == null) {
                return ProviderResult.transientFailure("Profile returned no historyId");
            }
            return ProviderResult.ok(profile.getHistoryId());
        } catch (IOException e) {
            log.warn("getProfile failed for {}: {}", handle.getEmailAddress(), e.getMessage());
            return GmailErrorClassifier.toResult(e);
        }
    }

    @Override
    public ProviderResult<WatchCreated> createWatch(MailboxHandle handle, LabelFilter labelFilter) {
        String topic = properties.getPubsub().getTopic();
        if (topic == null || topic.isBlank()) {
            return ProviderResult.transientFailure("watch.pubsub.topic is not configured");
        }
        WatchRequest request = new WatchRequest().setTopicName(topic);
        if (labelFilter != null && labelFilter.getLabelIds() != null && !labelFilter.getLabelIds().isEmpty()) {
            request.setLabelIds(new ArrayList<>(labelFilter.getLabelIds()));
            request.setLabelFilterAction(labelFilter.getBehavior().name().toLowerCase(Locale.ROOT));
        }
        try {
            WatchResponse response = gmail(handle).users().watch(ME, request).execute();
            BigInteger historyId = response.getHistoryId();
            if (historyId == null) {
                return ProviderResult.transientFailure("Watch response carried no historyId");
            }
            Instant expiresAt = response.getExpiration() != null
                ? Instant.ofEpochMilli(response.getExpiration())
                : clock.instant().plus(properties.getSubscription().getValidity());
            // Gmail has no watch id. The history id repeats when a mailbox is re-watched before new mail arrives.
            String subscriptionId = handle.getEmailAddress() + "/" + historyId + "/" + UUID.randomUUID();
            log.info("Gmail watch created for {} at historyId {}, expires {}", handle.getEmailAddress(), historyId, expiresAt);
            return ProviderResult.ok(new WatchCreated(subscriptionId, historyId, expiresAt));
        } catch (IOException e) {
            log.error("users.watch failed for {}: {}", handle.getEmailAddress(), e.getMessage(), e);
            return GmailErrorClassifier.toResult(e);
        }
    }

    @Override
    public ProviderResult<Void> stopWatch(MailboxHandle handle) {
        try {
            gmail(handle).users().stop(ME).execute();
            log.info("Gmail watch stopped for {}", handle.getEmailAddress());
            return ProviderResult.ok(null);
        } catch (IOException e) {
            log.warn("users.stop failed for {}: {}", handle.getEmailAddress(), e.getMessage());
            return GmailErrorClassifier.toResult(e);
        }
    }

    @Override
    public ProviderResult<List<MessageRef>> listChanges(MailboxHandle handle, BigInteger fromCursor,
                                                        BigInteger toCursor, LabelFilter labelFilter) {
        Map<String, MessageRef> added = new LinkedHashMap<>();
        try {
            Gmail.Users.History.List request = gmail(handle).users().history().list(ME)
                .setStartHistoryId(fromCursor)
                .setHistoryTypes(Collections.singletonList(MESSAGE_ADDED))
                .setMaxResults(properties.getReconcile().getMaxHistoryResults());
            String pushedLabel = labelFilter != null ? labelFilter.singleIncludedLabel() : null;
            if (pushedLabel != null) {
                request.setLabelId(pushedLabel);
            }

            String pageToken = null;
            do {
                ListHistoryResponse response = request.setPageToken(pageToken).execute();
                if (response.getHistory() != null) {
                    for (History history : response.getHistory()) {
                        if (history.getId() != null && history.getId().compareTo(toCursor) > 0) {
                            continue;
                        }
                        collectAdded(history, labelFilter, added);
                    }
                }
                pageToken = response.getNextPageToken();
            } while (pageToken != null);
        } catch (IOException e) {
            log.warn("history.list from {} failed for {}: {}", fromCursor, handle.getEmailAddress(), e.getMessage());
            return GmailErrorClassifier.toResult(e);
        }
        return ProviderResult.ok(new ArrayList<>(added.values()));
    }

    private void collectAdded(History history, LabelFilter labelFilter, Map<String, MessageRef> added) {
        if (history.getMessagesAdded() == null) {
            return;
        }
        for (HistoryMessageAdded messageAdded : history.getMessagesAdded()) {
            Message message = messageAdded.getMessage();
            if (message == null || message.getId() == null) {
                continue;
            }
            if (labelFilter != null && !labelFilter.matches(message.getLabelIds())) {
                continue;
            }
            added.putIfAbsent(message.getId(), new MessageRef(message.getId(), message.getThreadId()));
        }
    }

    @Override
    public ProviderResult<Message> getMessage(MailboxHandle handle, MessageRef ref) {
        try {
            Message message = gmail(handle).users().messages().get(ME, ref.getId())
                .setFormat("full")
                .execute();
            return ProviderResult.ok(message);
        } catch (IOException e) {
            log.warn("messages.get {} failed for {}: {}", ref.getId(), handle.getEmailAddress(), e.getMessage());
            return GmailErrorClassifier.toResult(e);
        }
    }
}
