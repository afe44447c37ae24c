package jump.email.watch.model;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

@Value
public class WatchCreated {
    String subscriptionId;
    BigInteger initialCursor;
    Instant expiresAt;
}
