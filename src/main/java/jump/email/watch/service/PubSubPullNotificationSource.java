package jump.email.watch.service;

import com.google.api.gax.rpc.ApiException;
import com.google.cloud.pubsub.v1.stub.GrpcSubscriberStub;
import com.google.cloud.pubsub.v1.stub.SubscriberStub;
import com.google.cloud.pubsub.v1.stub.SubscriberStubSettings;
import com.google.protobuf.Timestamp;
import com.google.pubsub.v1.AcknowledgeRequest;
import com.google.pubsub.v1.GetSubscriptionRequest;
import com.google.pubsub.v1.ProjectSubscriptionName;
import com.google.pubsub.v1.PullRequest;
import com.google.pubsub.v1.PullResponse;
import com.google.pubsub.v1.ReceivedMessage;
import jakarta.annotation.PreDestroy;
import jump.email.watch.config.WatchProperties;
import jump.email.watch.model.PulledNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Synchronous pull from the Gmail notification subscription using Application Default
 * Credentials. One gRPC stub is opened lazily and shared until the bean is destroyed.
 */
@Slf4j
@Service
public class PubSubPullNotificationSource implements PullNotificationSource {
    private final WatchProperties properties;
    private final Supplier<SubscriberStub> stubFactory;
    private SubscriberStub subscriber;

    @Autowired
    public PubSubPullNotificationSource(WatchProperties properties) {
        this(properties, PubSubPullNotificationSource::createStub);
    }

    PubSubPullNotificationSource(WatchProperties properties, Supplier<SubscriberStub> stubFactory) {
        this.properties = properties;
        this.stubFactory = stubFactory;
    }

    @Override
    public List<PulledNotification> pull(int maxMessages) {
        String subscription = subscriptionName();
        if (subscription == null) {
            log.debug("No pull subscription configured; skipping pull");
            return List.of();
        }
        PullRequest request = PullRequest.newBuilder()
            .setSubscription(subscription)
            .setMaxMessages(maxMessages)
            .build();
        PullResponse response = subscriber().pullCallable().call(request);
        List<PulledNotification> pulled = new ArrayList<>();
        for (ReceivedMessage received : response.getReceivedMessagesList()) {
            pulled.add(new PulledNotification(
                received.getAckId(),
                received.getMessage().getMessageId(),
                received.getMessage().getData().toByteArray(),
                received.getMessage().hasPublishTime() ? format(received.getMessage().getPublishTime()) : null));
        }
        log.debug("Pulled {} notifications from {}", pulled.size(), subscription);
        return pulled;
    }

    @Override
    public void acknowledge(List<String> ackIds) {
        String subscription = subscriptionName();
        if (subscription == null || ackIds.isEmpty()) {
            return;
        }
        AcknowledgeRequest request = AcknowledgeRequest.newBuilder()
            .setSubscription(subscription)
            .addAllAckIds(ackIds)
            .build();
        subscriber().acknowledgeCallable().call(request);
        log.debug("Acknowledged {} notifications on {}", ackIds.size(), subscription);
    }

    @Override
    public boolean isReachable() {
        String subscription = subscriptionName();
        if (subscription == null) {
            return false;
        }
        try {
            subscriber().getSubscriptionCallable()
                .call(GetSubscriptionRequest.newBuilder().setSubscription(subscription).build());
            return true;
        } catch (ApiException | UncheckedIOException e) {
            log.warn("Pull subscription {} is not reachable: {}", subscription, e.getMessage());
            return false;
        }
    }

    String subscriptionName() {
        String subscription = properties.getPubsub().getPullSubscription();
        if (subscription == null || subscription.isBlank()) {
            return null;
        }
        if (subscription.startsWith("projects/")) {
            return subscription;
        }
        String projectId = properties.getPubsub().getProjectId();
        if (projectId == null || projectId.isBlank()) {
            return null;
        }
        return ProjectSubscriptionName.format(projectId, subscription);
    }

    synchronized SubscriberStub subscriber() {
        if (subscriber == null || subscriber.isShutdown()) {
            subscriber = stubFactory.get();
        }
        return subscriber;
    }

    @PreDestroy
    public synchronized void close() {
        if (subscriber != null) {
            subscriber.close();
            subscriber = null;
        }
    }

    private static SubscriberStub createStub() {
        try {
            SubscriberStubSettings settings = SubscriberStubSettings.newBuilder()
                .setTransportChannelProvider(SubscriberStubSettings.defaultGrpcTransportProviderBuilder().build())
                .build();
            return GrpcSubscriberStub.create(settings);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create Pub/Sub subscriber", e);
        }
    }

    private static String format(Timestamp timestamp) {
        return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos()).toString();
    }
}
