package jump.email.watch.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "watch")
@Data
@Validated
public class WatchProperties {

    @Valid
    private PubSub pubsub = new PubSub();
    @Valid
    private Subscription subscription = new Subscription();
    @Valid
    private Reconcile reconcile = new Reconcile();
    @Valid
    private Renewal renewal = new Renewal();
    @Valid
    private Pull pull = new Pull();
    @Valid
    private Shutdown shutdown = new Shutdown();
    @Valid
    private SessionRegistry sessionRegistry = new SessionRegistry();
    @Valid
    private Triage triage = new Triage();
    @Valid
    private Provider provider = new Provider();
    @Valid
    private Lock lock = new Lock();
    @Valid
    private Admin admin = new Admin();

    @Data
    public static class PubSub {
        private String projectId;
        /** Fully qualified topic, projects/{project}/topics/{topic}. */
        private String topic;
        private String pullSubscription;
        /** When set, push requests must carry it as the {@code token} query parameter. */
        private String pushVerificationToken;
    }

    @Data
    public static class Subscription {
        @NotNull
        private Duration validity = Duration.ofDays(7);
        @NotNull
        private Duration maxAge = Duration.ofDays(30);
        @Positive
        private int maxErrorCount = 10;
    }

    @Data
    public static class Reconcile {
        /** History-id gap above which the local cursor is considered unrecoverable. */
        @Positive
        private long staleCursorGap = 1_000_000L;
        @Positive
        private int bodyCharLimit = 10_000;
        @Positive
        private long maxHistoryResults = 100L;
    }

    @Data
    public static class Renewal {
        @NotNull
        private Duration window = Duration.ofHours(24);
    }

    @Data
    public static class Pull {
        private boolean enabled = true;
        @Positive
        private int maxMessages = 50;
    }

    @Data
    public static class Shutdown {
        private boolean stopWatches = false;
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class SessionRegistry {
        /** memory or redis. */
        @NotBlank
        private String type = "memory";
        private String redisKey = "watch:listeners";
    }

    @Data
    public static class Triage {
        private String endpointUrl;
    }

    @Data
    public static class Provider {
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);
        private String applicationName = "Jump Email Watch";
    }

    @Data
    public static class Lock {
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Admin {
        private String username = "admin";
        private String password;
    }
}
