package jump.email.watch.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

@Embeddable
@Data
public class OAuthToken {
    @Column(length = 4000)
    private String accessToken;

    @Column(length = 4000)
    private String refreshToken;

    private Instant expiry;

    private String scopes;

    /**
     * A token with no expiry is treated as already expired.
     */
    public boolean expiresWithin(Instant now, Duration margin) {
        return expiry == null || expiry.isBefore(now.plus(margin));
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isEmpty();
    }
}
